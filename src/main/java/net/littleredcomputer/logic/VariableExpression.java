package net.littleredcomputer.logic;

import com.google.common.collect.ImmutableSet;

import java.util.List;

/**
 * A bare variable, standing alone or as the head of an application.
 */
public final class VariableExpression extends Expression {
    private final Variable variable;

    public VariableExpression(Variable variable) {
        this.variable = variable;
    }

    public VariableExpression(String name) {
        this(new Variable(name));
    }

    public Variable variable() { return variable; }

    public boolean isIndividual() { return variable.isIndividual(); }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    ImmutableSet<Variable> computeFree(boolean individualsOnly) {
        return !individualsOnly || variable.isIndividual() ? ImmutableSet.of(variable) : ImmutableSet.of();
    }

    @Override
    public Expression replace(Variable v, Expression expression, boolean replaceBound, FreshVariables fresh) {
        return variable.equals(v) ? expression : this;
    }

    @Override
    public Expression simplify(FreshVariables fresh) {
        return this;
    }

    @Override
    boolean equalsUnder(Expression other, List<Variable> mine, List<Variable> theirs) {
        if (!(other instanceof VariableExpression)) return false;
        Variable w = ((VariableExpression) other).variable;
        int i = mine.lastIndexOf(variable);
        int j = theirs.lastIndexOf(w);
        if (i < 0 && j < 0) return variable.equals(w);
        return i == j;
    }

    @Override
    int hashUnder(List<Variable> bound) {
        int i = bound.lastIndexOf(variable);
        return i < 0 ? variable.hashCode() : 31 * (bound.size() - i);
    }

    @Override
    public String toString() {
        return variable.name();
    }
}
