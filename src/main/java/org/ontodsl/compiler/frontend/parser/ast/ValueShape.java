package org.ontodsl.compiler.frontend.parser.ast;

/**
 * A best-effort, purely structural hint about what an expression evaluates to.
 * It is derived from literal kinds at parse time, never from runtime types.
 */
public enum ValueShape {
    /** A string literal, or a {@code +} chain containing one. */
    STRING,
    /** A numeric literal, or arithmetic over numeric literals only. */
    NUMBER,
    /** Anything involving an identifier or function call whose type is not known. */
    UNKNOWN;

    /**
     * Combines the shapes of the two operands of a binary operator.
     * @param operator The operator symbol.
     * @param left The left operand shape.
     * @param right The right operand shape.
     * @return The shape of the result.
     */
    public static ValueShape combine(String operator, ValueShape left, ValueShape right) {
        if ("+".equals(operator) && (left == STRING || right == STRING)) {
            return STRING;
        }
        if (left == NUMBER && right == NUMBER) {
            return NUMBER;
        }
        return UNKNOWN;
    }
}
