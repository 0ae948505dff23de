package net.littleredcomputer.logic;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.ArrayList;
import java.util.List;

/**
 * An expression that binds a variable in its body: lambda abstraction and the quantifiers.
 */
public abstract class BinderExpression extends Expression {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private final Variable variable;
    private final Expression body;

    BinderExpression(Variable variable, Expression body) {
        this.variable = variable;
        this.body = body;
    }

    public Variable variable() { return variable; }
    public Expression body() { return body; }

    /**
     * @return a binder of the same kind as this one over the given variable and body
     */
    abstract BinderExpression rebuild(Variable variable, Expression body);

    abstract String binderToken();

    @Override
    ImmutableSet<Variable> computeFree(boolean individualsOnly) {
        return Sets.difference(body.free(individualsOnly), ImmutableSet.of(variable)).immutableCopy();
    }

    @Override
    public Expression replace(Variable v, Expression expression, boolean replaceBound, FreshVariables fresh) {
        if (variable.equals(v)) {
            if (!replaceBound) return this;
            Preconditions.checkArgument(expression instanceof VariableExpression,
                    "%s is not a variable expression", expression);
            return rebuild(((VariableExpression) expression).variable(), body.replace(v, expression, true, fresh));
        }
        if (!replaceBound && !body.free(false).contains(v)) return this;
        BinderExpression self = this;
        if (expression.free(false).contains(variable)) self = alphaConvert(fresh.next(), fresh);
        Expression b = self.body.replace(v, expression, replaceBound, fresh);
        return b == self.body ? self : self.rebuild(self.variable, b);
    }

    /**
     * @return this binder with its bound variable renamed to {@code newVariable} throughout
     */
    public BinderExpression alphaConvert(Variable newVariable, FreshVariables fresh) {
        return rebuild(newVariable, body.replace(variable, new VariableExpression(newVariable), true, fresh));
    }

    public BinderExpression alphaConvert(Variable newVariable) {
        return alphaConvert(newVariable, FreshVariables.shared());
    }

    @Override
    public Expression simplify(FreshVariables fresh) {
        Expression b = body.simplify(fresh);
        return b == body ? this : rebuild(variable, b);
    }

    @Override
    boolean equalsUnder(Expression other, List<Variable> mine, List<Variable> theirs) {
        if (other.getClass() != getClass()) return false;
        BinderExpression o = (BinderExpression) other;
        mine.add(variable);
        theirs.add(o.variable);
        try {
            return body.equalsUnder(o.body, mine, theirs);
        } finally {
            mine.remove(mine.size() - 1);
            theirs.remove(theirs.size() - 1);
        }
    }

    @Override
    int hashUnder(List<Variable> bound) {
        bound.add(variable);
        int h = body.hashUnder(bound);
        bound.remove(bound.size() - 1);
        return 31 * h + binderToken().hashCode();
    }

    @Override
    public String toString() {
        // Nested binders of the same kind print as one: all x y.P(x,y)
        List<Variable> vs = new ArrayList<>();
        vs.add(variable);
        Expression b = body;
        while (b.getClass() == getClass()) {
            vs.add(((BinderExpression) b).variable);
            b = ((BinderExpression) b).body;
        }
        return binderToken() + spaceJoiner.join(vs) + Tokens.DOT + b;
    }
}
