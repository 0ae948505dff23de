package net.littleredcomputer.inference;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.logic.AllExpression;
import net.littleredcomputer.logic.AndExpression;
import net.littleredcomputer.logic.ApplicationExpression;
import net.littleredcomputer.logic.ExistsExpression;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.FreshVariables;
import net.littleredcomputer.logic.ImpliesExpression;
import net.littleredcomputer.logic.Variable;
import net.littleredcomputer.logic.VariableExpression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Proves under the assumption that a predicate holds only where the assumptions say it does.
 * Each predicate {@code P} asserted by the assumptions, as a fact {@code P(a)} or as the
 * conclusion of a universal implication {@code all x.(Q(x) -> P(x))}, is completed:
 * {@code all z.(P(z) -> ((z = a) | Q(z)))}.
 * <p>
 * With {@code walk(Socrates)} and {@code Socrates != Bill} assumed, {@code -walk(Bill)}
 * becomes provable.
 */
public class ClosedWorldProverCommand extends ProverCommandDecorator {
    private final FreshVariables fresh;

    public ClosedWorldProverCommand(ProverCommand command) {
        this(command, FreshVariables.shared());
    }

    public ClosedWorldProverCommand(ProverCommand command, FreshVariables fresh) {
        super(command);
        this.fresh = fresh;
    }

    @Override
    public List<Expression> assumptions() {
        List<Expression> assumptions = command.assumptions();
        ImmutableList.Builder<Expression> out = ImmutableList.<Expression>builder().addAll(assumptions);
        for (Map.Entry<Variable, Support> e : predicates(assumptions).entrySet()) {
            out.add(completion(e.getKey(), e.getValue()));
        }
        return out.build();
    }

    /**
     * @return what the assumptions say about each predicate, in order of first appearance
     * @throws IllegalArgumentException if a predicate is used with different numbers of arguments
     */
    static Map<Variable, Support> predicates(List<Expression> assumptions) {
        Map<Variable, Support> predicates = new LinkedHashMap<>();
        for (Expression a : assumptions) collect(a, predicates);
        return predicates;
    }

    private static void collect(Expression e, Map<Variable, Support> predicates) {
        if (e instanceof ApplicationExpression) {
            ApplicationExpression a = (ApplicationExpression) e;
            if (a.baseFunction() instanceof VariableExpression) {
                Variable p = ((VariableExpression) a.baseFunction()).variable();
                support(predicates, p, a.arguments().size()).facts.add(a.arguments());
            }
        } else if (e instanceof AndExpression) {
            collect(((AndExpression) e).first(), predicates);
            collect(((AndExpression) e).second(), predicates);
        } else if (e instanceof AllExpression) {
            List<Variable> prefix = new ArrayList<>();
            Expression body = e;
            while (body instanceof AllExpression) {
                prefix.add(((AllExpression) body).variable());
                body = ((AllExpression) body).body();
            }
            if (!(body instanceof ImpliesExpression)) return;
            ImpliesExpression i = (ImpliesExpression) body;
            if (!(i.second() instanceof ApplicationExpression)) return;
            ApplicationExpression conclusion = (ApplicationExpression) i.second();
            if (!(conclusion.baseFunction() instanceof VariableExpression)) return;
            Variable p = ((VariableExpression) conclusion.baseFunction()).variable();
            support(predicates, p, conclusion.arguments().size()).rules.add(new Rule(prefix, i.first(), conclusion.arguments()));
        }
    }

    private static Support support(Map<Variable, Support> predicates, Variable p, int arity) {
        Support s = predicates.computeIfAbsent(p, k -> new Support(arity));
        if (s.arity != arity) {
            throw new IllegalArgumentException(String.format(
                    "Predicate %s is used with %d and with %d arguments", p, s.arity, arity));
        }
        return s;
    }

    private Expression completion(Variable p, Support support) {
        List<Expression> args = new ArrayList<>();
        for (int i = 0; i < support.arity; ++i) args.add(new VariableExpression(fresh.next()));

        List<Expression> disjuncts = new ArrayList<>();
        for (List<Expression> fact : support.facts) disjuncts.add(matches(args, fact));
        for (Rule r : support.rules) disjuncts.add(r.instance(args));

        Expression consequent = disjuncts.get(0);
        for (Expression d : disjuncts.subList(1, disjuncts.size())) consequent = consequent.or(d);
        Expression accum = new VariableExpression(p).applyTo(args.toArray(new Expression[0])).implies(consequent);
        for (int i = args.size() - 1; i >= 0; --i) accum = new AllExpression(((VariableExpression) args.get(i)).variable(), accum);
        return accum;
    }

    // (z1 = t1) & ... & (zn = tn)
    private static Expression matches(List<Expression> args, List<Expression> terms) {
        Expression accum = args.get(0).isEqualTo(terms.get(0));
        for (int i = 1; i < args.size(); ++i) accum = accum.and(args.get(i).isEqualTo(terms.get(i)));
        return accum;
    }

    /**
     * The facts and universal implications that establish one predicate.
     */
    static final class Support {
        final int arity;
        final List<List<Expression>> facts = new ArrayList<>();
        final List<Rule> rules = new ArrayList<>();

        Support(int arity) {
            this.arity = arity;
        }
    }

    /**
     * {@code all prefix.(condition -> P(conclusion))}.
     */
    static final class Rule {
        final List<Variable> prefix;
        final Expression condition;
        final List<Expression> conclusion;

        Rule(List<Variable> prefix, Expression condition, List<Expression> conclusion) {
            this.prefix = prefix;
            this.condition = condition;
            this.conclusion = conclusion;
        }

        /**
         * @return the condition under which this rule makes {@code P(args)} true: prefix
         * variables in argument position are renamed to the matching argument, other
         * arguments must equal it, and the remaining prefix variables are existential
         */
        Expression instance(List<Expression> args) {
            Map<Variable, Expression> bindings = new LinkedHashMap<>();
            List<Expression> parts = new ArrayList<>();
            parts.add(condition);
            for (int i = 0; i < args.size(); ++i) {
                Expression c = conclusion.get(i);
                if (c instanceof VariableExpression) {
                    Variable v = ((VariableExpression) c).variable();
                    if (prefix.contains(v) && !bindings.containsKey(v)) {
                        bindings.put(v, args.get(i));
                        continue;
                    }
                }
                parts.add(args.get(i).isEqualTo(c));
            }
            Expression accum = parts.get(0);
            for (Expression part : parts.subList(1, parts.size())) accum = accum.and(part);
            for (Map.Entry<Variable, Expression> b : bindings.entrySet()) accum = accum.replace(b.getKey(), b.getValue());
            Set<Variable> unbound = new LinkedHashSet<>(prefix);
            unbound.removeAll(bindings.keySet());
            List<Variable> rest = new ArrayList<>(unbound);
            for (int i = rest.size() - 1; i >= 0; --i) accum = new ExistsExpression(rest.get(i), accum);
            return accum;
        }
    }
}
