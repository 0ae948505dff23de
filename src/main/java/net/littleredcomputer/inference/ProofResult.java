package net.littleredcomputer.inference;

public final class ProofResult {
    private final boolean proved;
    private final boolean budgetExceeded;
    private final String proof;
    private final long steps;

    public ProofResult(boolean proved, boolean budgetExceeded, String proof, long steps) {
        this.proved = proved;
        this.budgetExceeded = budgetExceeded;
        this.proof = proof;
        this.steps = steps;
    }

    public boolean proved() { return proved; }

    /**
     * @return true if the search gave up. The goal is then reported as not proved, though it
     * may be valid.
     */
    public boolean budgetExceeded() { return budgetExceeded; }

    /**
     * @return the search trace, empty unless tracing was requested
     */
    public String proof() { return proof; }

    public long steps() { return steps; }

    @Override
    public String toString() {
        return String.format("%s in %d steps%s", proved ? "proved" : "not proved", steps,
                budgetExceeded ? " (budget exceeded)" : "");
    }
}
