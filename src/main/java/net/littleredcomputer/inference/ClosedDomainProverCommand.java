package net.littleredcomputer.inference;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.logic.AllExpression;
import net.littleredcomputer.logic.ExistsExpression;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.Variable;
import net.littleredcomputer.logic.VariableExpression;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BinaryOperator;

/**
 * Proves under the assumption that the named constants are the only individuals: each
 * outermost universal becomes the conjunction of its instances over the constants, and each
 * outermost existential the disjunction. The expansion recurses into the instances.
 * <p>
 * With {@code exists x.walk(x)} and {@code man(Socrates)} assumed, {@code walk(Socrates)}
 * becomes provable.
 */
public class ClosedDomainProverCommand extends ProverCommandDecorator {
    public ClosedDomainProverCommand(ProverCommand command) {
        super(command);
    }

    /**
     * @return the constants of the goal and assumptions, in order of first appearance
     */
    public ImmutableSet<Variable> domain() {
        Set<Variable> domain = new LinkedHashSet<>();
        command.goal().ifPresent(g -> domain.addAll(g.constants()));
        for (Expression a : command.assumptions()) domain.addAll(a.constants());
        return ImmutableSet.copyOf(domain);
    }

    @Override
    public Optional<Expression> goal() {
        ImmutableSet<Variable> domain = domain();
        return command.goal().map(g -> replaceQuantifiers(g, domain).simplify());
    }

    @Override
    public List<Expression> assumptions() {
        ImmutableSet<Variable> domain = domain();
        ImmutableList.Builder<Expression> out = ImmutableList.builder();
        for (Expression a : command.assumptions()) out.add(replaceQuantifiers(a, domain).simplify());
        return out.build();
    }

    static Expression replaceQuantifiers(Expression e, Set<Variable> domain) {
        if (domain.isEmpty()) return e;
        if (e instanceof AllExpression) {
            AllExpression a = (AllExpression) e;
            return expand(a.variable(), a.body(), domain, Expression::and);
        }
        if (e instanceof ExistsExpression) {
            ExistsExpression x = (ExistsExpression) e;
            return expand(x.variable(), x.body(), domain, Expression::or);
        }
        return e;
    }

    private static Expression expand(Variable v, Expression body, Set<Variable> domain, BinaryOperator<Expression> combine) {
        Expression accum = null;
        for (Variable d : domain) {
            Expression instance = replaceQuantifiers(body.replace(v, new VariableExpression(d)), domain);
            accum = accum == null ? instance : combine.apply(accum, instance);
        }
        return accum;
    }
}
