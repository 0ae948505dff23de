package net.littleredcomputer.logic;

/**
 * The equality of two terms, {@code (a = b)}.
 */
public final class EqualityExpression extends BinaryExpression {
    public EqualityExpression(Expression first, Expression second) {
        super(first, second);
    }

    @Override
    EqualityExpression rebuild(Expression first, Expression second) {
        return new EqualityExpression(first, second);
    }

    @Override
    String operator() {
        return Tokens.EQ;
    }

    // The parser reads "-P = Q" as -(P = Q) and "all x.P(x) = Q" as all x.(P(x) = Q).
    @Override
    String firstOperandString() {
        return bracketed(first());
    }

    @Override
    String secondOperandString() {
        return bracketed(second());
    }

    private static String bracketed(Expression e) {
        if (e instanceof NegatedExpression || e instanceof BinderExpression) return Tokens.OPEN + e + Tokens.CLOSE;
        return e.toString();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitEquality(this);
    }
}
