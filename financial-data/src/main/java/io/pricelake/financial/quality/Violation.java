package io.pricelake.financial.quality;

/**
 * One failed check. {@code row} is the 0-based data row, or -1 for column-level findings.
 */
public record Violation(Check check, String column, int row, String message) {
    public static Violation column(Check check, String column, String message) {
        return new Violation(check, column, -1, message);
    }

    @Override
    public String toString() {
        return check + " [" + column + (row >= 0 ? " row " + row : "") + "]: " + message;
    }
}
