package net.littleredcomputer.logic;

/**
 * The lambda abstraction {@code \x.body}.
 */
public final class LambdaExpression extends BinderExpression {
    public LambdaExpression(Variable variable, Expression body) {
        super(variable, body);
    }

    @Override
    LambdaExpression rebuild(Variable variable, Expression body) {
        return new LambdaExpression(variable, body);
    }

    @Override
    String binderToken() {
        return Tokens.LAMBDA;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }
}
