package net.littleredcomputer.inference;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.logic.EqualityExpression;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.NegatedExpression;
import net.littleredcomputer.logic.Variable;
import net.littleredcomputer.logic.VariableExpression;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Proves under the assumption that distinct names denote distinct individuals. For every
 * pair of constants of the assumptions whose equality is neither assumed nor provable, the
 * inequality is added as an assumption.
 * <p>
 * With {@code man(Socrates)} and {@code man(Bill)} assumed, {@code exists x y.-(x = y)}
 * becomes provable.
 */
public class UniqueNamesProverCommand extends ProverCommandDecorator {
    public UniqueNamesProverCommand(ProverCommand command) {
        super(command);
    }

    @Override
    public List<Expression> assumptions() {
        List<Expression> assumptions = command.assumptions();
        Set<Variable> domain = new TreeSet<>();
        for (Expression a : assumptions) domain.addAll(a.constants());

        Map<Variable, Set<Variable>> equal = new HashMap<>();
        for (Expression a : assumptions) {
            if (a instanceof EqualityExpression) {
                EqualityExpression q = (EqualityExpression) a;
                if (q.first() instanceof VariableExpression && q.second() instanceof VariableExpression) {
                    merge(equal, ((VariableExpression) q.first()).variable(), ((VariableExpression) q.second()).variable());
                }
            }
        }

        List<Variable> names = new ArrayList<>(domain);
        ImmutableList.Builder<Expression> out = ImmutableList.<Expression>builder().addAll(assumptions);
        for (int i = 0; i < names.size(); ++i) {
            for (int j = i + 1; j < names.size(); ++j) {
                Variable a = names.get(i);
                Variable b = names.get(j);
                if (group(equal, a).contains(b)) continue;
                EqualityExpression same = new VariableExpression(a).isEqualTo(new VariableExpression(b));
                if (prover().prove(same, assumptions)) {
                    merge(equal, a, b);
                } else {
                    out.add(new NegatedExpression(same));
                }
            }
        }
        return out.build();
    }

    private static Set<Variable> group(Map<Variable, Set<Variable>> equal, Variable v) {
        return equal.computeIfAbsent(v, k -> {
            Set<Variable> s = new HashSet<>();
            s.add(k);
            return s;
        });
    }

    private static void merge(Map<Variable, Set<Variable>> equal, Variable a, Variable b) {
        Set<Variable> ga = group(equal, a);
        Set<Variable> gb = group(equal, b);
        if (ga == gb) return;
        ga.addAll(gb);
        for (Variable v : gb) equal.put(v, ga);
    }
}
