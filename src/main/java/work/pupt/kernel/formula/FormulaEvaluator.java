package work.pupt.kernel.formula;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates conditional formulas against collected answers.
 *
 * <p>Evaluation is pure: it only reads {@code answers}. Names without an answer evaluate as blank.
 */
public final class FormulaEvaluator {
    public static final String SENTINEL = "=";

    private static final int CACHE_LIMIT = 512;
    private static final Map<String, Expression> CACHE = new ConcurrentHashMap<>();

    private FormulaEvaluator() {}

    public static boolean isFormula(Object value) {
        return value instanceof String text && text.strip().startsWith(SENTINEL);
    }

    /**
     * Evaluates {@code formula} with or without the leading {@code =}.
     *
     * @throws FormulaException when the formula does not parse
     */
    public static boolean evaluate(String formula, Map<String, Object> answers) {
        Expression expression = compile(formula);
        return Values.truthy(expression.evaluate(answers == null ? Map.of() : answers));
    }

    /**
     * Evaluates a {@code when}-style condition: formulas are evaluated, other values use truthiness.
     */
    public static boolean condition(Object value, Map<String, Object> answers) {
        if (isFormula(value)) {
            return evaluate((String) value, answers);
        }
        return truthy(value);
    }

    public static boolean truthy(Object value) {
        return Values.truthy(value);
    }

    /**
     * Parses {@code formula} without evaluating it.
     *
     * @throws FormulaException when the formula does not parse
     */
    public static void check(String formula) {
        compile(formula);
    }

    private static Expression compile(String formula) {
        if (formula == null) {
            throw new FormulaException("", 0, "Missing formula");
        }
        Expression cached = CACHE.get(formula);
        if (cached != null) {
            return cached;
        }
        Expression parsed = FormulaParser.parse(formula);
        if (CACHE.size() >= CACHE_LIMIT) {
            CACHE.clear();
        }
        CACHE.put(formula, parsed);
        return parsed;
    }
}
