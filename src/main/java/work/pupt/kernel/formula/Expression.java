package work.pupt.kernel.formula;

import java.util.List;
import java.util.Map;

/**
 * Parsed formula node.
 */
interface Expression {
    Object evaluate(Map<String, Object> answers);

    record Literal(Object value) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> answers) {
            return value;
        }
    }

    record Identifier(String name) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> answers) {
            return answers.get(name);
        }
    }

    record Not(Expression operand) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> answers) {
            return !Values.truthy(operand.evaluate(answers));
        }
    }

    record And(List<Expression> operands) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> answers) {
            for (Expression operand : operands) {
                if (!Values.truthy(operand.evaluate(answers))) {
                    return false;
                }
            }
            return true;
        }
    }

    record Or(List<Expression> operands) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> answers) {
            for (Expression operand : operands) {
                if (Values.truthy(operand.evaluate(answers))) {
                    return true;
                }
            }
            return false;
        }
    }

    record IsBlank(Expression operand) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> answers) {
            return Values.blank(operand.evaluate(answers));
        }
    }

    record Comparison(String operator, Expression left, Expression right) implements Expression {
        @Override
        public Object evaluate(Map<String, Object> answers) {
            Object a = left.evaluate(answers);
            Object b = right.evaluate(answers);
            return switch (operator) {
                case "=" -> Values.equal(a, b);
                case "<>" -> !Values.equal(a, b);
                default -> Values.ordered(operator, a, b);
            };
        }
    }
}
