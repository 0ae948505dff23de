package net.littleredcomputer.logic;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Application of a function to a single argument. Predicates of several arguments are
 * curried, so {@code see(x,y)} is {@code ((see x) y)}; {@link #uncurry()} recovers the
 * predicate and its argument list.
 */
public final class ApplicationExpression extends Expression {
    private static final Joiner commaJoiner = Joiner.on(',');
    private final Expression function;
    private final Expression argument;

    public ApplicationExpression(Expression function, Expression argument) {
        this.function = function;
        this.argument = argument;
    }

    public Expression function() { return function; }
    public Expression argument() { return argument; }

    /**
     * @return the innermost function of a chain of curried applications
     */
    public Expression baseFunction() {
        Expression f = function;
        while (f instanceof ApplicationExpression) f = ((ApplicationExpression) f).function;
        return f;
    }

    /**
     * @return the arguments of the curried chain, leftmost first
     */
    public ImmutableList<Expression> arguments() {
        List<Expression> args = new ArrayList<>();
        args.add(argument);
        Expression f = function;
        while (f instanceof ApplicationExpression) {
            args.add(((ApplicationExpression) f).argument);
            f = ((ApplicationExpression) f).function;
        }
        Collections.reverse(args);
        return ImmutableList.copyOf(args);
    }

    /**
     * @return the base function followed by its arguments
     */
    public ImmutableList<Expression> uncurry() {
        return ImmutableList.<Expression>builder().add(baseFunction()).addAll(arguments()).build();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitApplication(this);
    }

    @Override
    ImmutableSet<Variable> computeFree(boolean individualsOnly) {
        return Sets.union(function.free(individualsOnly), argument.free(individualsOnly)).immutableCopy();
    }

    @Override
    public Expression replace(Variable v, Expression expression, boolean replaceBound, FreshVariables fresh) {
        Expression f = function.replace(v, expression, replaceBound, fresh);
        Expression a = argument.replace(v, expression, replaceBound, fresh);
        return f == function && a == argument ? this : new ApplicationExpression(f, a);
    }

    @Override
    public Expression simplify(FreshVariables fresh) {
        Expression f = function.simplify(fresh);
        Expression a = argument.simplify(fresh);
        if (f instanceof LambdaExpression) {
            LambdaExpression l = (LambdaExpression) f;
            return l.body().replace(l.variable(), a, false, fresh).simplify(fresh);
        }
        return f == function && a == argument ? this : new ApplicationExpression(f, a);
    }

    @Override
    boolean equalsUnder(Expression other, List<Variable> mine, List<Variable> theirs) {
        if (!(other instanceof ApplicationExpression)) return false;
        ApplicationExpression o = (ApplicationExpression) other;
        return function.equalsUnder(o.function, mine, theirs) && argument.equalsUnder(o.argument, mine, theirs);
    }

    @Override
    int hashUnder(List<Variable> bound) {
        return 31 * function.hashUnder(bound) + argument.hashUnder(bound) + 17;
    }

    @Override
    public String toString() {
        Expression base = baseFunction();
        String args = "(" + commaJoiner.join(arguments()) + ")";
        if (base instanceof VariableExpression) return base + args;
        // Parenthesized whole, so that it reads back as an application inside a negation or binder body.
        return "((" + base + ")" + args + ")";
    }
}
