package net.littleredcomputer.logic;

/**
 * Exhaustive case analysis over the concrete expression variants.
 */
public interface ExpressionVisitor<R> {
    R visitVariable(VariableExpression e);
    R visitApplication(ApplicationExpression e);
    R visitLambda(LambdaExpression e);
    R visitAll(AllExpression e);
    R visitExists(ExistsExpression e);
    R visitNegated(NegatedExpression e);
    R visitAnd(AndExpression e);
    R visitOr(OrExpression e);
    R visitImplies(ImpliesExpression e);
    R visitIff(IffExpression e);
    R visitEquality(EqualityExpression e);
}
