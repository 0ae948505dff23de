package net.littleredcomputer.inference.tableau;

import com.google.common.base.Preconditions;

/**
 * Limits on a tableau search: the length of any one branch, counted in rule applications,
 * and the total number of rule applications.
 */
public final class SearchBudget {
    public static final SearchBudget DEFAULT = new SearchBudget(10_000, 200_000);
    private final int maxDepth;
    private final long maxSteps;

    public SearchBudget(int maxDepth, long maxSteps) {
        Preconditions.checkArgument(maxDepth > 0, "maxDepth must be positive");
        Preconditions.checkArgument(maxSteps > 0, "maxSteps must be positive");
        this.maxDepth = maxDepth;
        this.maxSteps = maxSteps;
    }

    public int maxDepth() { return maxDepth; }

    public long maxSteps() { return maxSteps; }

    public SearchBudget withMaxDepth(int depth) { return new SearchBudget(depth, maxSteps); }

    public SearchBudget withMaxSteps(long steps) { return new SearchBudget(maxDepth, steps); }

    @Override
    public String toString() {
        return String.format("depth %d, steps %d", maxDepth, maxSteps);
    }
}
