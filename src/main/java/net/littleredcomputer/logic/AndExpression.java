package net.littleredcomputer.logic;

/**
 * The conjunction.
 */
public final class AndExpression extends BooleanExpression {
    public AndExpression(Expression first, Expression second) {
        super(first, second);
    }

    @Override
    AndExpression rebuild(Expression first, Expression second) {
        return new AndExpression(first, second);
    }

    @Override
    String operator() {
        return Tokens.AND;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
