package net.littleredcomputer.logic;

/**
 * A binary truth-functional connective.
 */
public abstract class BooleanExpression extends BinaryExpression {
    BooleanExpression(Expression first, Expression second) {
        super(first, second);
    }
}
