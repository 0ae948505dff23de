package net.littleredcomputer.logic;

public final class OrExpression extends BooleanExpression {
    public OrExpression(Expression first, Expression second) {
        super(first, second);
    }

    @Override
    OrExpression rebuild(Expression first, Expression second) {
        return new OrExpression(first, second);
    }

    @Override
    String operator() {
        return Tokens.OR;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
