package net.littleredcomputer.logic;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.List;

/**
 * An expression with two operands: the boolean connectives and equality.
 */
public abstract class BinaryExpression extends Expression {
    private final Expression first;
    private final Expression second;

    BinaryExpression(Expression first, Expression second) {
        this.first = first;
        this.second = second;
    }

    public Expression first() { return first; }
    public Expression second() { return second; }

    abstract BinaryExpression rebuild(Expression first, Expression second);

    abstract String operator();

    @Override
    ImmutableSet<Variable> computeFree(boolean individualsOnly) {
        return Sets.union(first.free(individualsOnly), second.free(individualsOnly)).immutableCopy();
    }

    @Override
    public Expression replace(Variable v, Expression expression, boolean replaceBound, FreshVariables fresh) {
        Expression f = first.replace(v, expression, replaceBound, fresh);
        Expression s = second.replace(v, expression, replaceBound, fresh);
        return f == first && s == second ? this : rebuild(f, s);
    }

    @Override
    public Expression simplify(FreshVariables fresh) {
        Expression f = first.simplify(fresh);
        Expression s = second.simplify(fresh);
        return f == first && s == second ? this : rebuild(f, s);
    }

    @Override
    boolean equalsUnder(Expression other, List<Variable> mine, List<Variable> theirs) {
        if (other.getClass() != getClass()) return false;
        BinaryExpression o = (BinaryExpression) other;
        return first.equalsUnder(o.first, mine, theirs) && second.equalsUnder(o.second, mine, theirs);
    }

    @Override
    int hashUnder(List<Variable> bound) {
        return 31 * (31 * first.hashUnder(bound) + second.hashUnder(bound)) + operator().hashCode();
    }

    @Override
    public String toString() {
        return Tokens.OPEN + firstOperandString() + " " + operator() + " " + secondOperandString() + Tokens.CLOSE;
    }

    String firstOperandString() { return first.toString(); }

    String secondOperandString() { return second.toString(); }
}
