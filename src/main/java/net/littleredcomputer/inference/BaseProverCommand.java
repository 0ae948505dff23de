package net.littleredcomputer.inference;

import net.littleredcomputer.logic.Expression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

public class BaseProverCommand extends TheoremToolCommand implements ProverCommand {
    private static final Logger log = LogManager.getFormatterLogger(BaseProverCommand.class);
    private final Prover prover;
    private ProofResult result;

    public BaseProverCommand(Prover prover, Optional<Expression> goal, List<Expression> assumptions) {
        super(goal, assumptions);
        this.prover = prover;
    }

    public BaseProverCommand(Prover prover, Expression goal, List<Expression> assumptions) {
        this(prover, Optional.of(goal), assumptions);
    }

    @Override
    public Prover prover() { return prover; }

    @Override
    public boolean prove() {
        if (result == null) {
            result = prover.prove(goal(), assumptions(), true);
            log.debug("%s: %s", goal().map(Object::toString).orElse("(no goal)"), result);
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
        String proof = prover.prove(goal(), assumptions(), true).proof();
        log.info("%s", proof);
        return proof;
    }

    /**
     * @return the cached result, if the prover has run since the problem last changed
     */
    public Optional<ProofResult> result() { return Optional.ofNullable(result); }

    @Override
    protected void reset() {
        result = null;
    }
}
