package net.littleredcomputer.inference;

import net.littleredcomputer.logic.Expression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A prover command that rewrites the problem of another before proving it. Subclasses
 * override {@link #goal()} and {@link #assumptions()} to present the rewritten problem;
 * changes to the assumptions are passed through to the wrapped command.
 */
public abstract class ProverCommandDecorator implements ProverCommand {
    private static final Logger log = LogManager.getFormatterLogger(ProverCommandDecorator.class);
    protected final ProverCommand command;
    private ProofResult result;

    protected ProverCommandDecorator(ProverCommand command) {
        this.command = command;
    }

    @Override
    public Optional<Expression> goal() { return command.goal(); }

    @Override
    public List<Expression> assumptions() { return command.assumptions(); }

    @Override
    public void addAssumptions(Collection<? extends Expression> added) {
        command.addAssumptions(added);
        result = null;
    }

    @Override
    public void retractAssumptions(Collection<? extends Expression> retracted, boolean warnIfAbsent) {
        command.retractAssumptions(retracted, warnIfAbsent);
        result = null;
    }

    @Override
    public Prover prover() { return command.prover(); }

    @Override
    public boolean prove() {
        if (result == null) {
            List<Expression> assumptions = assumptions();
            log.debug("%s: proving with assumptions %s", getClass().getSimpleName(), assumptions);
            result = prover().prove(goal(), assumptions, true);
        }
        return result.proved();
    }

    @Override
    public String proof() {
        if (result == null) throw new IllegalStateException("You have to call prove() first to get a proof!");
        return result.proof();
    }

    @Override
    public String showProof() {
        String proof = prover().prove(goal(), assumptions(), true).proof();
        log.info("%s", proof);
        return proof;
    }
}
