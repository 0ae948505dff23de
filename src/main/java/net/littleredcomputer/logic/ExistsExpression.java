package net.littleredcomputer.logic;

/**
 * The existential quantification {@code exists x.body}.
 */
public final class ExistsExpression extends BinderExpression {
    public ExistsExpression(Variable variable, Expression body) {
        super(variable, body);
    }

    @Override
    ExistsExpression rebuild(Variable variable, Expression body) {
        return new ExistsExpression(variable, body);
    }

    @Override
    String binderToken() {
        return Tokens.EXISTS + " ";
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitExists(this);
    }
}
