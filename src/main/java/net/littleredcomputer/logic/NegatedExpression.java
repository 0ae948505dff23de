package net.littleredcomputer.logic;

import com.google.common.collect.ImmutableSet;

import java.util.List;

public final class NegatedExpression extends Expression {
    private final Expression body;

    public NegatedExpression(Expression body) {
        this.body = body;
    }

    public Expression body() { return body; }

    @Override
    public Expression negate() {
        return body;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNegated(this);
    }

    @Override
    ImmutableSet<Variable> computeFree(boolean individualsOnly) {
        return body.free(individualsOnly);
    }

    @Override
    public Expression replace(Variable v, Expression expression, boolean replaceBound, FreshVariables fresh) {
        Expression b = body.replace(v, expression, replaceBound, fresh);
        return b == body ? this : new NegatedExpression(b);
    }

    @Override
    public Expression simplify(FreshVariables fresh) {
        Expression b = body.simplify(fresh);
        return b == body ? this : new NegatedExpression(b);
    }

    @Override
    boolean equalsUnder(Expression other, List<Variable> mine, List<Variable> theirs) {
        return other instanceof NegatedExpression && body.equalsUnder(((NegatedExpression) other).body, mine, theirs);
    }

    @Override
    int hashUnder(List<Variable> bound) {
        return 31 * body.hashUnder(bound) + 3;
    }

    @Override
    public String toString() {
        return Tokens.NOT + body;
    }
}
