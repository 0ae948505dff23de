package net.littleredcomputer.inference.tableau;

/**
 * How the search of a branch ended.
 */
public enum Outcome {
    /** Every branch below closed: the formulas are unsatisfiable. */
    CLOSED,
    /** Some branch ran out of formulas without closing. */
    OPEN,
    /** The search was abandoned; nothing is known. */
    BUDGET_EXCEEDED
}
