package work.pupt.kernel.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser. Precedence from lowest to highest: OR, AND, NOT, comparison.
 */
final class FormulaParser {
    private final String source;
    private final List<Token> tokens;
    private int index;

    private FormulaParser(String source) {
        this.source = source;
        this.tokens = new FormulaLexer(source).tokenize();
    }

    static Expression parse(String formula) {
        String body = formula.strip();
        if (body.startsWith("=")) {
            body = body.substring(1);
        }
        if (body.isBlank()) {
            throw new FormulaException(formula, 0, "Empty formula");
        }
        FormulaParser parser = new FormulaParser(body);
        Expression expression = parser.orExpr();
        Token trailing = parser.peek();
        if (!trailing.is(Token.Kind.EOF)) {
            throw new FormulaException(body, trailing.position(), "Unexpected token '" + trailing.text() + "'");
        }
        return expression;
    }

    private Expression orExpr() {
        List<Expression> operands = new ArrayList<>();
        operands.add(andExpr());
        while (isOperatorKeyword("OR")) {
            index++;
            operands.add(andExpr());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.Or(operands);
    }

    private Expression andExpr() {
        List<Expression> operands = new ArrayList<>();
        operands.add(notExpr());
        while (isOperatorKeyword("AND")) {
            index++;
            operands.add(notExpr());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.And(operands);
    }

    private Expression notExpr() {
        if (isOperatorKeyword("NOT")) {
            index++;
            return new Expression.Not(notExpr());
        }
        return comparison();
    }

    private Expression comparison() {
        Expression left = primary();
        Token next = peek();
        if (next.is(Token.Kind.OPERATOR)) {
            index++;
            Expression right = primary();
            if (peek().is(Token.Kind.OPERATOR)) {
                throw new FormulaException(source, peek().position(), "Comparisons cannot be chained");
            }
            return new Expression.Comparison(next.text(), left, right);
        }
        return left;
    }

    private Expression primary() {
        Token token = advance();
        switch (token.kind()) {
            case NUMBER -> {
                return new Expression.Literal(Double.parseDouble(token.text()));
            }
            case STRING -> {
                return new Expression.Literal(token.text());
            }
            case LPAREN -> {
                Expression inner = orExpr();
                expect(Token.Kind.RPAREN, ")");
                return inner;
            }
            case IDENT -> {
                if (peek().is(Token.Kind.LPAREN)) {
                    return call(token);
                }
                if (token.isKeyword("TRUE")) {
                    return new Expression.Literal(Boolean.TRUE);
                }
                if (token.isKeyword("FALSE")) {
                    return new Expression.Literal(Boolean.FALSE);
                }
                return new Expression.Identifier(token.text());
            }
            default -> throw new FormulaException(source, token.position(),
                token.is(Token.Kind.EOF) ? "Unexpected end of formula" : "Unexpected token '" + token.text() + "'");
        }
    }

    private Expression call(Token name) {
        expect(Token.Kind.LPAREN, "(");
        List<Expression> args = new ArrayList<>();
        if (!peek().is(Token.Kind.RPAREN)) {
            args.add(orExpr());
            while (peek().is(Token.Kind.COMMA)) {
                index++;
                args.add(orExpr());
            }
        }
        expect(Token.Kind.RPAREN, ")");
        String function = name.text().toUpperCase(Locale.ROOT);
        return switch (function) {
            case "AND" -> new Expression.And(requireArgs(name, args, 1, Integer.MAX_VALUE));
            case "OR" -> new Expression.Or(requireArgs(name, args, 1, Integer.MAX_VALUE));
            case "NOT" -> new Expression.Not(requireArgs(name, args, 1, 1).get(0));
            case "ISBLANK" -> new Expression.IsBlank(requireArgs(name, args, 1, 1).get(0));
            case "TRUE" -> new Expression.Literal(requireArgs(name, args, 0, 0).isEmpty());
            case "FALSE" -> new Expression.Literal(!requireArgs(name, args, 0, 0).isEmpty());
            default -> throw new FormulaException(source, name.position(), "Unknown function " + name.text());
        };
    }

    private List<Expression> requireArgs(Token name, List<Expression> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new FormulaException(source, name.position(),
                "Function " + name.text() + " got " + args.size() + " argument(s)");
        }
        return args;
    }

    private boolean isOperatorKeyword(String keyword) {
        Token token = peek();
        if (!token.isKeyword(keyword)) {
            return false;
        }
        // NOT(...) parses as a call so that NOT(x) = y compares the negation.
        return !"NOT".equals(keyword) || !lookahead(1).is(Token.Kind.LPAREN);
    }

    private void expect(Token.Kind kind, String text) {
        Token token = advance();
        if (!token.is(kind)) {
            throw new FormulaException(source, token.position(), "Expected '" + text + "'");
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token lookahead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(Token.Kind.EOF)) {
            index++;
        }
        return token;
    }
}
