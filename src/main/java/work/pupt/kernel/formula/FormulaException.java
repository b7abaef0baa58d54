package work.pupt.kernel.formula;

/**
 * Raised when a formula cannot be parsed.
 */
public final class FormulaException extends RuntimeException {
    private final String formula;
    private final int position;

    public FormulaException(String formula, int position, String message) {
        super(message + " at position " + position + " in '" + formula + "'");
        this.formula = formula;
        this.position = position;
    }

    public String formula() {
        return formula;
    }

    public int position() {
        return position;
    }
}
