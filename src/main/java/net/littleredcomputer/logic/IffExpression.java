package net.littleredcomputer.logic;

public final class IffExpression extends BooleanExpression {
    public IffExpression(Expression first, Expression second) {
        super(first, second);
    }

    @Override
    IffExpression rebuild(Expression first, Expression second) {
        return new IffExpression(first, second);
    }

    @Override
    String operator() {
        return Tokens.IFF;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIff(this);
    }
}
