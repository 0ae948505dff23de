package net.littleredcomputer.inference;

import net.littleredcomputer.logic.Expression;

import java.util.List;
import java.util.Optional;

/**
 * Tries to prove a goal from a list of assumptions. Implementations must accept the same
 * expressions, so callers can pick one by name (see {@link TheoremTools}).
 */
public interface Prover {
    /**
     * @param goal the formula to prove; if absent, the assumptions are shown to be jointly
     *             unsatisfiable
     * @param trace record a human-readable account of the search in the result
     */
    ProofResult prove(Optional<Expression> goal, List<Expression> assumptions, boolean trace);

    default boolean prove(Expression goal, List<Expression> assumptions) {
        return prove(Optional.of(goal), assumptions, false).proved();
    }
}
