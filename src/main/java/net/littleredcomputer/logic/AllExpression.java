package net.littleredcomputer.logic;

/**
 * The universal quantification {@code all x.body}.
 */
public final class AllExpression extends BinderExpression {
    public AllExpression(Variable variable, Expression body) {
        super(variable, body);
    }

    @Override
    AllExpression rebuild(Variable variable, Expression body) {
        return new AllExpression(variable, body);
    }

    @Override
    String binderToken() {
        return Tokens.ALL + " ";
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAll(this);
    }
}
