package net.littleredcomputer.inference;

import net.littleredcomputer.logic.Expression;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A proof problem bound to a prover, with the prover's verdict cached until the problem
 * changes.
 */
public interface ProverCommand {
    Optional<Expression> goal();

    List<Expression> assumptions();

    void addAssumptions(Collection<? extends Expression> added);

    void retractAssumptions(Collection<? extends Expression> retracted, boolean warnIfAbsent);

    Prover prover();

    /**
     * @return whether the goal follows from the assumptions, running the prover if no
     * answer is cached
     */
    boolean prove();

    /**
     * @return the trace of the cached proof attempt
     * @throws IllegalStateException if {@link #prove()} has not run since the last change
     */
    String proof();

    /**
     * Run the prover again with tracing on, log the trace, and return it. The cached verdict
     * is not changed.
     */
    String showProof();
}
