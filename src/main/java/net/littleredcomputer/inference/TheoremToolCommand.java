package net.littleredcomputer.inference;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.logic.Expression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * A goal and a mutable list of assumptions, to be handed to a theorem tool. Subclasses cache
 * the tool's answer; any change to the assumptions discards it.
 */
public abstract class TheoremToolCommand {
    private static final Logger log = LogManager.getFormatterLogger(TheoremToolCommand.class);
    private final Optional<Expression> goal;
    private final List<Expression> assumptions;

    protected TheoremToolCommand(Optional<Expression> goal, List<Expression> assumptions) {
        this.goal = goal;
        this.assumptions = new ArrayList<>(assumptions);
    }

    public Optional<Expression> goal() { return goal; }

    public ImmutableList<Expression> assumptions() { return ImmutableList.copyOf(assumptions); }

    public void addAssumptions(Collection<? extends Expression> added) {
        assumptions.addAll(added);
        reset();
    }

    /**
     * Remove every occurrence of the given assumptions.
     *
     * @param warnIfAbsent log a warning for each one that was not present
     */
    public void retractAssumptions(Collection<? extends Expression> retracted, boolean warnIfAbsent) {
        for (Expression r : retracted) {
            boolean present = assumptions.removeIf(r::equals);
            if (!present && warnIfAbsent) log.warn("Assumption not present: %s", r);
        }
        reset();
    }

    /**
     * Forget any cached result.
     */
    protected abstract void reset();
}
