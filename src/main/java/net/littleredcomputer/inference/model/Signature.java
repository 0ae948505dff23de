package net.littleredcomputer.inference.model;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.logic.AllExpression;
import net.littleredcomputer.logic.AndExpression;
import net.littleredcomputer.logic.ApplicationExpression;
import net.littleredcomputer.logic.BinaryExpression;
import net.littleredcomputer.logic.BinderExpression;
import net.littleredcomputer.logic.EqualityExpression;
import net.littleredcomputer.logic.ExistsExpression;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.ExpressionVisitor;
import net.littleredcomputer.logic.IffExpression;
import net.littleredcomputer.logic.ImpliesExpression;
import net.littleredcomputer.logic.LambdaExpression;
import net.littleredcomputer.logic.NegatedExpression;
import net.littleredcomputer.logic.OrExpression;
import net.littleredcomputer.logic.Variable;
import net.littleredcomputer.logic.VariableExpression;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The symbols a set of formulas needs interpreted: constants (unbound variables in term
 * position) and relations with their arities (unbound variables in predicate position; a
 * bare one in formula position is a relation of arity zero).
 */
final class Signature {
    private final ImmutableSet<Variable> constants;
    private final ImmutableMap<Variable, Integer> relations;

    private Signature(Set<Variable> constants, Map<Variable, Integer> relations) {
        this.constants = ImmutableSet.copyOf(constants);
        this.relations = ImmutableMap.copyOf(relations);
    }

    ImmutableSet<Variable> constants() { return constants; }

    ImmutableMap<Variable, Integer> relations() { return relations; }

    /**
     * @throws IllegalArgumentException if a formula uses function terms, lambda expressions,
     *                                  quantified predicates, or a symbol in two roles
     */
    static Signature of(Iterable<Expression> formulas) {
        Collector c = new Collector();
        for (Expression f : formulas) f.accept(c);
        for (Variable v : c.constants) {
            if (c.relations.containsKey(v)) throw new IllegalArgumentException("symbol used as both constant and predicate: " + v);
        }
        return new Signature(c.constants, c.relations);
    }

    private static final class Collector implements ExpressionVisitor<Void> {
        final Set<Variable> constants = new LinkedHashSet<>();
        final Map<Variable, Integer> relations = new LinkedHashMap<>();
        final Deque<Variable> bound = new ArrayDeque<>();

        private void relation(Expression symbol, int arity, Expression context) {
            if (!(symbol instanceof VariableExpression) || bound.contains(((VariableExpression) symbol).variable())) {
                throw new IllegalArgumentException("unsupported predicate in: " + context);
            }
            Variable v = ((VariableExpression) symbol).variable();
            Integer previous = relations.putIfAbsent(v, arity);
            if (previous != null && previous != arity) {
                throw new IllegalArgumentException(String.format("predicate %s used with arities %d and %d", v, previous, arity));
            }
        }

        private void term(Expression t, Expression context) {
            if (!(t instanceof VariableExpression)) {
                throw new IllegalArgumentException("function terms are not supported: " + t + " in " + context);
            }
            Variable v = ((VariableExpression) t).variable();
            if (!bound.contains(v)) constants.add(v);
        }

        private Void binder(BinderExpression b) {
            bound.push(b.variable());
            try {
                return b.body().accept(this);
            } finally {
                bound.pop();
            }
        }

        private Void binary(BinaryExpression b) {
            b.first().accept(this);
            return b.second().accept(this);
        }

        @Override
        public Void visitVariable(VariableExpression e) {
            relation(e, 0, e);
            return null;
        }

        @Override
        public Void visitApplication(ApplicationExpression e) {
            relation(e.baseFunction(), e.arguments().size(), e);
            for (Expression a : e.arguments()) term(a, e);
            return null;
        }

        @Override
        public Void visitLambda(LambdaExpression e) {
            throw new IllegalArgumentException("lambda expressions must be reduced first: " + e);
        }

        @Override public Void visitAll(AllExpression e) { return binder(e); }
        @Override public Void visitExists(ExistsExpression e) { return binder(e); }
        @Override public Void visitNegated(NegatedExpression e) { return e.body().accept(this); }
        @Override public Void visitAnd(AndExpression e) { return binary(e); }
        @Override public Void visitOr(OrExpression e) { return binary(e); }
        @Override public Void visitImplies(ImpliesExpression e) { return binary(e); }
        @Override public Void visitIff(IffExpression e) { return binary(e); }

        @Override
        public Void visitEquality(EqualityExpression e) {
            term(e.first(), e);
            term(e.second(), e);
            return null;
        }
    }
}
