package net.littleredcomputer.inference;

import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.inference.model.FiniteModelBuilder;
import net.littleredcomputer.inference.tableau.SearchBudget;
import net.littleredcomputer.inference.tableau.TableauProver;

/**
 * Look up provers and model builders by name.
 */
public final class TheoremTools {
    public static final String TABLEAU = "tableau";
    public static final String FINITE = "finite";

    private TheoremTools() {}

    public static ImmutableSet<String> proverNames() { return ImmutableSet.of(TABLEAU); }

    public static ImmutableSet<String> modelBuilderNames() { return ImmutableSet.of(FINITE); }

    public static Prover prover(String name) {
        return prover(name, SearchBudget.DEFAULT);
    }

    /**
     * @throws IllegalArgumentException if no prover has that name
     */
    public static Prover prover(String name, SearchBudget budget) {
        switch (name) {
            case TABLEAU: return new TableauProver(budget);
            default: throw new IllegalArgumentException("Unknown prover: " + name);
        }
    }

    public static ModelBuilder modelBuilder(String name) {
        return modelBuilder(name, FiniteModelBuilder.DEFAULT_MAX_DOMAIN_SIZE);
    }

    /**
     * @throws IllegalArgumentException if no model builder has that name
     */
    public static ModelBuilder modelBuilder(String name, int maxDomainSize) {
        switch (name) {
            case FINITE: return new FiniteModelBuilder(maxDomainSize);
            default: throw new IllegalArgumentException("Unknown model builder: " + name);
        }
    }
}
