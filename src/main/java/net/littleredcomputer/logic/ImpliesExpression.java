package net.littleredcomputer.logic;

/**
 * The implication.
 */
public final class ImpliesExpression extends BooleanExpression {
    public ImpliesExpression(Expression first, Expression second) {
        super(first, second);
    }

    @Override
    ImpliesExpression rebuild(Expression first, Expression second) {
        return new ImpliesExpression(first, second);
    }

    @Override
    String operator() {
        return Tokens.IMPLIES;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitImplies(this);
    }
}
