package net.littleredcomputer.logic;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable expression of first-order logic extended with lambda abstraction. Applications
 * are always curried: {@code P(x,y)} is represented as {@code ((P x) y)}.
 * <p>
 * Equality is alpha-aware: {@code all x.P(x)} equals {@code all y.P(y)}, and the hash code
 * agrees with that.
 */
public abstract class Expression {
    // Computed lazily, each in a single write (a hash of 0 means not yet), so a racing
    // reader at worst recomputes.
    private ImmutableSet<Variable> freeIndividuals;
    private ImmutableSet<Variable> freeAll;
    private int hash;

    Expression() {}

    public abstract <R> R accept(ExpressionVisitor<R> visitor);

    abstract ImmutableSet<Variable> computeFree(boolean individualsOnly);

    /**
     * @param individualsOnly if set, variables in predicate position (and other non-individual
     *                        variables) are excluded
     * @return the variables of this expression not bound by an enclosing binder
     */
    public final ImmutableSet<Variable> free(boolean individualsOnly) {
        if (individualsOnly) {
            ImmutableSet<Variable> f = freeIndividuals;
            if (f == null) freeIndividuals = f = computeFree(true);
            return f;
        }
        ImmutableSet<Variable> f = freeAll;
        if (f == null) freeAll = f = computeFree(false);
        return f;
    }

    public final ImmutableSet<Variable> free() { return free(true); }

    /**
     * Capture-avoiding substitution of {@code expression} for every free occurrence of
     * {@code variable}. A binder whose bound variable occurs free in {@code expression} is
     * first alpha-converted to a variable drawn from {@code fresh}.
     *
     * @param replaceBound if set, binders of {@code variable} itself are renamed too (in which
     *                     case {@code expression} must be a {@link VariableExpression})
     */
    public abstract Expression replace(Variable variable, Expression expression, boolean replaceBound, FreshVariables fresh);

    public final Expression replace(Variable variable, Expression expression) {
        return replace(variable, expression, false, FreshVariables.shared());
    }

    /**
     * @return this expression with every application of a lambda expression beta-reduced,
     * repeatedly, until none remain
     */
    public abstract Expression simplify(FreshVariables fresh);

    public final Expression simplify() {
        return simplify(FreshVariables.shared());
    }

    /**
     * @return the body of this expression if it is a negation, otherwise its negation
     */
    public Expression negate() {
        return new NegatedExpression(this);
    }

    public final AndExpression and(Expression other) { return new AndExpression(this, other); }
    public final OrExpression or(Expression other) { return new OrExpression(this, other); }
    public final ImpliesExpression implies(Expression other) { return new ImpliesExpression(this, other); }
    public final IffExpression iff(Expression other) { return new IffExpression(this, other); }
    public final EqualityExpression isEqualTo(Expression other) { return new EqualityExpression(this, other); }

    public final Expression applyTo(Expression... arguments) {
        Preconditions.checkArgument(arguments.length > 0, "must apply to at least one argument");
        Expression accum = this;
        for (Expression a : arguments) accum = new ApplicationExpression(accum, a);
        return accum;
    }

    /**
     * @return the free non-individual variables occurring in argument position (the
     * arguments of predicates and the sides of equalities): the named constants of the
     * expression
     */
    public final ImmutableSet<Variable> constants() {
        Set<Variable> out = new LinkedHashSet<>();
        collectConstants(this, out);
        out.retainAll(free(false));
        return ImmutableSet.copyOf(out);
    }

    private static void collectConstants(Expression e, Set<Variable> out) {
        e.accept(new Subexpressions() {
            @Override
            public Void visitApplication(ApplicationExpression a) {
                if (!(a.baseFunction() instanceof VariableExpression)) collectConstants(a.baseFunction(), out);
                a.arguments().forEach(this::argument);
                return null;
            }

            @Override
            public Void visitEquality(EqualityExpression q) {
                argument(q.first());
                argument(q.second());
                return null;
            }

            private void argument(Expression arg) {
                if (arg instanceof VariableExpression) {
                    Variable v = ((VariableExpression) arg).variable();
                    if (!v.isIndividual()) out.add(v);
                } else {
                    collectConstants(arg, out);
                }
            }
        });
    }

    /**
     * @return every variable mentioned in this expression, bound or free, in order of first
     * appearance
     */
    public final ImmutableList<Variable> variables() {
        Set<Variable> out = new LinkedHashSet<>();
        accept(new Subexpressions() {
            @Override
            public Void visitVariable(VariableExpression v) {
                out.add(v.variable());
                return null;
            }

            @Override
            Void binder(BinderExpression b) {
                out.add(b.variable());
                return super.binder(b);
            }
        });
        return ImmutableList.copyOf(out);
    }

    /**
     * Rename fresh variables ({@code z} followed by digits) to {@code z1, z2, ...} so that
     * the printed form does not depend on how many fresh variables were minted before.
     */
    public final Expression normalize() {
        List<Variable> fresh = new ArrayList<>();
        for (Variable v : variables()) if (FreshVariables.looksFresh(v)) fresh.add(v);
        fresh.sort(Comparator.comparingLong(v -> Long.parseLong(v.name().substring(1))));
        Expression result = this;
        for (int i = 0; i < fresh.size(); ++i) {
            result = result.replace(fresh.get(i), new VariableExpression("z" + (i + 1)), true, FreshVariables.shared());
        }
        return result;
    }

    /**
     * Alpha-aware structural comparison. {@code mine} and {@code theirs} hold the variables
     * bound by the binders enclosing each side, innermost last; they always have equal length.
     */
    abstract boolean equalsUnder(Expression other, List<Variable> mine, List<Variable> theirs);

    /**
     * A hash in which bound variables contribute only their binding depth.
     */
    abstract int hashUnder(List<Variable> bound);

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expression)) return false;
        Expression other = (Expression) o;
        if (hashCode() != other.hashCode()) return false;
        return equalsUnder(other, new ArrayList<>(), new ArrayList<>());
    }

    @Override
    public final int hashCode() {
        int h = hash;
        if (h == 0) {
            h = hashUnder(new ArrayList<>());
            hash = h;
        }
        return h;
    }

    /**
     * Visitor that walks every subexpression and returns nothing; override the cases of interest.
     */
    abstract static class Subexpressions implements ExpressionVisitor<Void> {
        @Override public Void visitVariable(VariableExpression v) { return null; }

        @Override
        public Void visitApplication(ApplicationExpression a) {
            a.function().accept(this);
            a.argument().accept(this);
            return null;
        }

        Void binder(BinderExpression b) {
            b.body().accept(this);
            return null;
        }

        @Override public Void visitLambda(LambdaExpression l) { return binder(l); }
        @Override public Void visitAll(AllExpression a) { return binder(a); }
        @Override public Void visitExists(ExistsExpression e) { return binder(e); }
        @Override public Void visitNegated(NegatedExpression n) { return n.body().accept(this); }

        Void binary(BinaryExpression b) {
            b.first().accept(this);
            b.second().accept(this);
            return null;
        }

        @Override public Void visitAnd(AndExpression a) { return binary(a); }
        @Override public Void visitOr(OrExpression o) { return binary(o); }
        @Override public Void visitImplies(ImpliesExpression i) { return binary(i); }
        @Override public Void visitIff(IffExpression i) { return binary(i); }
        @Override public Void visitEquality(EqualityExpression e) { return binary(e); }
    }
}
