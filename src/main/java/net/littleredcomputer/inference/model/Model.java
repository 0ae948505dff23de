package net.littleredcomputer.inference.model;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.logic.AllExpression;
import net.littleredcomputer.logic.AndExpression;
import net.littleredcomputer.logic.ApplicationExpression;
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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An interpretation over the domain {@code {0, ..., size-1}}: an individual for each
 * constant and a set of tuples for each relation. Relations of arity zero are propositions,
 * true when they hold the empty tuple.
 */
public final class Model {
    private static final Joiner commaJoiner = Joiner.on(',');
    private final int size;
    private final ImmutableMap<Variable, Integer> constants;
    private final ImmutableMap<Variable, ImmutableSet<List<Integer>>> relations;

    public Model(int size, Map<Variable, Integer> constants, Map<Variable, ? extends Iterable<? extends List<Integer>>> relations) {
        if (size < 1) throw new IllegalArgumentException("domain must be nonempty");
        this.size = size;
        this.constants = ImmutableMap.copyOf(constants);
        ImmutableMap.Builder<Variable, ImmutableSet<List<Integer>>> b = ImmutableMap.builder();
        relations.forEach((v, tuples) -> b.put(v, ImmutableSet.copyOf(tuples)));
        this.relations = b.build();
        for (int c : this.constants.values()) {
            if (c < 0 || c >= size) throw new IllegalArgumentException("constant outside domain: " + c);
        }
    }

    public int size() { return size; }

    public ImmutableMap<Variable, Integer> constants() { return constants; }

    public ImmutableMap<Variable, ImmutableSet<List<Integer>>> relations() { return relations; }

    /**
     * @throws IllegalArgumentException if the formula mentions a symbol this model does not
     *                                  interpret, or is not first-order
     */
    public boolean satisfies(Expression formula) {
        return formula.accept(new Evaluator(new HashMap<>()));
    }

    public boolean satisfiesAll(Iterable<Expression> formulas) {
        for (Expression f : formulas) if (!satisfies(f)) return false;
        return true;
    }

    private final class Evaluator implements ExpressionVisitor<Boolean> {
        private final Map<Variable, Integer> env;

        Evaluator(Map<Variable, Integer> env) {
            this.env = env;
        }

        private int denotation(Expression term) {
            if (!(term instanceof VariableExpression)) throw new IllegalArgumentException("not an individual term: " + term);
            Variable v = ((VariableExpression) term).variable();
            Integer d = env.containsKey(v) ? env.get(v) : constants.get(v);
            if (d == null) throw new IllegalArgumentException("uninterpreted constant: " + v);
            return d;
        }

        private boolean holds(Variable relation, List<Integer> tuple) {
            ImmutableSet<List<Integer>> extension = relations.get(relation);
            if (extension == null) throw new IllegalArgumentException("uninterpreted predicate: " + relation);
            return extension.contains(tuple);
        }

        private boolean quantify(Variable v, Expression body, boolean universal) {
            Integer saved = env.get(v);
            boolean hadBinding = env.containsKey(v);
            try {
                for (int d = 0; d < size; ++d) {
                    env.put(v, d);
                    if (body.accept(this) != universal) return !universal;
                }
                return universal;
            } finally {
                if (hadBinding) env.put(v, saved);
                else env.remove(v);
            }
        }

        @Override
        public Boolean visitVariable(VariableExpression e) {
            return holds(e.variable(), ImmutableList.of());
        }

        @Override
        public Boolean visitApplication(ApplicationExpression e) {
            if (!(e.baseFunction() instanceof VariableExpression)) throw new IllegalArgumentException("unsupported predicate: " + e);
            ImmutableList.Builder<Integer> tuple = ImmutableList.builder();
            for (Expression a : e.arguments()) tuple.add(denotation(a));
            return holds(((VariableExpression) e.baseFunction()).variable(), tuple.build());
        }

        @Override
        public Boolean visitLambda(LambdaExpression e) {
            throw new IllegalArgumentException("a lambda expression has no truth value: " + e);
        }

        @Override public Boolean visitAll(AllExpression e) { return quantify(e.variable(), e.body(), true); }
        @Override public Boolean visitExists(ExistsExpression e) { return quantify(e.variable(), e.body(), false); }
        @Override public Boolean visitNegated(NegatedExpression e) { return !e.body().accept(this); }
        @Override public Boolean visitAnd(AndExpression e) { return e.first().accept(this) && e.second().accept(this); }
        @Override public Boolean visitOr(OrExpression e) { return e.first().accept(this) || e.second().accept(this); }
        @Override public Boolean visitImplies(ImpliesExpression e) { return !e.first().accept(this) || e.second().accept(this); }
        @Override public Boolean visitIff(IffExpression e) { return e.first().accept(this).equals(e.second().accept(this)); }

        @Override
        public Boolean visitEquality(EqualityExpression e) {
            return denotation(e.first()) == denotation(e.second());
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("domain size ").append(size).append('\n');
        constants.forEach((v, d) -> sb.append(v).append(" = ").append(d).append('\n'));
        relations.forEach((v, tuples) -> {
            sb.append(v).append(" = {");
            boolean first = true;
            for (List<Integer> t : tuples) {
                if (!first) sb.append(", ");
                first = false;
                sb.append('(').append(commaJoiner.join(t)).append(')');
            }
            sb.append("}\n");
        });
        return sb.toString();
    }
}
