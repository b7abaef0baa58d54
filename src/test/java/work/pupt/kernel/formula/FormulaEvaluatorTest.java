package work.pupt.kernel.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FormulaEvaluatorTest {
    @Test
    void identifiersReadAnswersAndMissingNamesAreFalse() {
        assertTrue(FormulaEvaluator.evaluate("=x", Map.of("x", true)));
        assertFalse(FormulaEvaluator.evaluate("=x", Map.of("x", false)));
        assertFalse(FormulaEvaluator.evaluate("=x", Map.of()));
        assertTrue(FormulaEvaluator.evaluate("=NOT(x)", Map.of()));
        assertFalse(FormulaEvaluator.evaluate("=x = \"yes\"", Map.of()));
        assertTrue(FormulaEvaluator.evaluate("=x <> \"yes\"", Map.of()));
    }

    @Test
    void sentinelIsOptional() {
        assertTrue(FormulaEvaluator.evaluate("x", Map.of("x", "set")));
        assertTrue(FormulaEvaluator.isFormula("=x"));
        assertTrue(FormulaEvaluator.isFormula("  =x"));
        assertFalse(FormulaEvaluator.isFormula("x"));
        assertFalse(FormulaEvaluator.isFormula(true));
    }

    @Test
    void equalityIsCaseInsensitiveForText() {
        Map<String, Object> answers = Map.of("lang", "java", "count", 3);

        assertTrue(FormulaEvaluator.evaluate("=lang=\"Java\"", answers));
        assertFalse(FormulaEvaluator.evaluate("=lang<>'JAVA'", answers));
        assertTrue(FormulaEvaluator.evaluate("=count = 3", answers));
        assertTrue(FormulaEvaluator.evaluate("=count = \"3\"", answers));
        assertTrue(FormulaEvaluator.evaluate("=\"it\"\"s\" = \"IT\"\"S\"", Map.of()));
    }

    @Test
    void orderingIsNumericAndFalseForNonNumbers() {
        assertTrue(FormulaEvaluator.evaluate("=age >= 18", Map.of("age", 21)));
        assertFalse(FormulaEvaluator.evaluate("=age < 18", Map.of("age", 21)));
        assertTrue(FormulaEvaluator.evaluate("=age > 2.5", Map.of("age", "3")));
        assertFalse(FormulaEvaluator.evaluate("=age < 18", Map.of("age", "abc")));
        assertFalse(FormulaEvaluator.evaluate("=age < 18", Map.of()));
        assertTrue(FormulaEvaluator.evaluate("=delta > -1", Map.of("delta", 0)));
    }

    @Test
    void precedenceRunsOrThenAndThenNotThenComparison() {
        Map<String, Object> answers = Map.of("a", true, "b", false, "c", false);

        assertTrue(FormulaEvaluator.evaluate("=a OR b AND c", answers));
        assertFalse(FormulaEvaluator.evaluate("=(a OR b) AND c", answers));
        assertTrue(FormulaEvaluator.evaluate("=NOT b AND a", answers));
        assertFalse(FormulaEvaluator.evaluate("=NOT x = \"y\"", Map.of("x", "Y")));
        assertTrue(FormulaEvaluator.evaluate("=NOT(a) = FALSE", answers));
        assertTrue(FormulaEvaluator.evaluate("=a and not b", answers));
    }

    @Test
    void functionsCanBeNested() {
        Map<String, Object> answers = Map.of("a", true, "b", false, "c", true, "empty", "");

        assertTrue(FormulaEvaluator.evaluate("=AND(a, OR(b, c))", answers));
        assertFalse(FormulaEvaluator.evaluate("=AND(a, b)", answers));
        assertTrue(FormulaEvaluator.evaluate("=ISBLANK(missing)", answers));
        assertTrue(FormulaEvaluator.evaluate("=ISBLANK(empty)", answers));
        assertFalse(FormulaEvaluator.evaluate("=isblank(a)", answers));
        assertTrue(FormulaEvaluator.evaluate("=OR(FALSE(), TRUE())", answers));
    }

    @Test
    void structuredAnswersCompareByValueOrMembership() {
        Map<String, Object> answers = Map.of(
            "langs", List.of("go", "Java"),
            "rating", Map.of("value", 4, "label", "Good"),
            "none", List.of()
        );

        assertTrue(FormulaEvaluator.evaluate("=langs = \"java\"", answers));
        assertFalse(FormulaEvaluator.evaluate("=langs = \"rust\"", answers));
        assertTrue(FormulaEvaluator.evaluate("=rating >= 4", answers));
        assertFalse(FormulaEvaluator.evaluate("=none", answers));
    }

    @Test
    void wrappedListsAreMatchedByMembership() {
        Map<String, Object> answers = Map.of("picked", Map.of("value", List.of("a", "B")));

        assertTrue(FormulaEvaluator.evaluate("=picked = \"b\"", answers));
        assertFalse(FormulaEvaluator.evaluate("=picked = \"c\"", answers));
        assertTrue(FormulaEvaluator.evaluate("=picked <> \"c\"", answers));
    }

    @Test
    void evaluationDoesNotTouchAnswers() {
        Map<String, Object> answers = new HashMap<>(Map.of("x", 1));

        FormulaEvaluator.evaluate("=AND(x = 1, y)", answers);

        assertEquals(Map.of("x", 1), answers);
    }

    @Test
    void conditionAcceptsBooleansAndFormulas() {
        assertTrue(FormulaEvaluator.condition(true, Map.of()));
        assertFalse(FormulaEvaluator.condition(null, Map.of()));
        assertTrue(FormulaEvaluator.condition("=x", Map.of("x", 1)));
        assertTrue(FormulaEvaluator.condition("plain", Map.of()));
        assertFalse(FormulaEvaluator.condition("", Map.of()));
    }

    @Test
    void malformedFormulasAreRejected() {
        assertThrows(FormulaException.class, () -> FormulaEvaluator.evaluate("=", Map.of()));
        assertThrows(FormulaException.class, () -> FormulaEvaluator.evaluate("=AND(", Map.of()));
        assertThrows(FormulaException.class, () -> FormulaEvaluator.evaluate("=x ==", Map.of()));
        assertThrows(FormulaException.class, () -> FormulaEvaluator.evaluate("=a < b < c", Map.of()));
        assertThrows(FormulaException.class, () -> FormulaEvaluator.evaluate("=FOO(x)", Map.of()));
        assertThrows(FormulaException.class, () -> FormulaEvaluator.evaluate("=NOT(a, b)", Map.of()));
        assertThrows(FormulaException.class, () -> FormulaEvaluator.evaluate("=\"open", Map.of()));
        assertThrows(FormulaException.class, () -> FormulaEvaluator.check("=x )"));
    }
}
