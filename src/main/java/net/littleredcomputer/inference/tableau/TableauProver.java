package net.littleredcomputer.inference.tableau;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.inference.AbstractTheoremTool;
import net.littleredcomputer.inference.ProofResult;
import net.littleredcomputer.inference.Prover;
import net.littleredcomputer.logic.AllExpression;
import net.littleredcomputer.logic.ApplicationExpression;
import net.littleredcomputer.logic.BinaryExpression;
import net.littleredcomputer.logic.EqualityExpression;
import net.littleredcomputer.logic.ExistsExpression;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.FreshVariables;
import net.littleredcomputer.logic.NegatedExpression;
import net.littleredcomputer.logic.Variable;
import net.littleredcomputer.logic.VariableExpression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Free-variable semantic tableau prover for first-order logic with equality.
 * <p>
 * To prove a goal from assumptions, the negated goal and the assumptions are placed on the
 * agenda of a single branch, and rules are applied until every branch closes (the goal is
 * proved) or some branch runs dry (it is not). Branches close when an atom is derived both
 * true and false, or when a term is derived unequal to itself.
 * <p>
 * Universal formulas are instantiated with the terms accessible on their branch, each term
 * once, and are revisited whenever the branch acquires a new term. Since first-order
 * validity is undecidable, a {@link SearchBudget} bounds the search; a search that runs out
 * of budget is reported as not proved.
 * <p>
 * Equalities are applied by substitution when one side is a variable. An equality between
 * two compound terms is dropped, which makes the prover incomplete for such problems.
 */
public class TableauProver extends AbstractTheoremTool implements Prover {
    private static final Logger log = LogManager.getFormatterLogger(TableauProver.class);
    private final FreshVariables fresh;
    private final SearchBudget budget;

    public TableauProver() {
        this(FreshVariables.shared(), SearchBudget.DEFAULT);
    }

    public TableauProver(SearchBudget budget) {
        this(FreshVariables.shared(), budget);
    }

    public TableauProver(FreshVariables fresh, SearchBudget budget) {
        super("tableau");
        this.fresh = fresh;
        this.budget = budget;
    }

    public SearchBudget budget() { return budget; }

    @Override
    public ProofResult prove(Optional<Expression> goal, List<Expression> assumptions, boolean trace) {
        Agenda agenda = new Agenda();
        goal.ifPresent(g -> agenda.insert(new NegatedExpression(g.simplify(fresh))));
        for (Expression a : assumptions) agenda.insert(a.simplify(fresh));
        ProofTrace proofTrace = new ProofTrace(trace);
        start();
        Outcome outcome = new Search(proofTrace).attempt(new Branch(agenda, ImmutableSet.of(), ImmutableMap.of(), 0, 0));
        stop();
        if (outcome == Outcome.BUDGET_EXCEEDED) {
            log.warn("%s: search budget (%s) exceeded after %d steps; reporting not proved", name(), budget, stepCount);
        }
        log.debug(() -> new FormattedMessage("%s: %s after %d steps in %s", name(), outcome, stepCount, stopwatch()));
        return new ProofResult(outcome == Outcome.CLOSED, outcome == Outcome.BUDGET_EXCEEDED, proofTrace.text(), stepCount);
    }

    /**
     * The state of one branch besides its agenda. The agenda is owned by the branch and
     * changed in place; the term set and the atom table are replaced on every extension so
     * that a split leaves both sides sharing them safely.
     */
    private static final class Branch {
        final Agenda agenda;
        final ImmutableSet<Expression> accessible;
        final ImmutableMap<Expression, Boolean> atoms;
        final int depth;
        final int indent;

        Branch(Agenda agenda, ImmutableSet<Expression> accessible, ImmutableMap<Expression, Boolean> atoms, int depth, int indent) {
            this.agenda = agenda;
            this.accessible = accessible;
            this.atoms = atoms;
            this.depth = depth;
            this.indent = indent;
        }

        Branch deeper() {
            return new Branch(agenda, accessible, atoms, depth + 1, indent);
        }

        Branch split() {
            return new Branch(agenda.duplicate(), accessible, atoms, depth + 1, indent + 1);
        }

        Branch withAccessible(Iterable<? extends Expression> terms) {
            ImmutableSet<Expression> more = ImmutableSet.<Expression>builder().addAll(accessible).addAll(terms).build();
            return more.size() == accessible.size() ? this : new Branch(agenda, more, atoms, depth, indent);
        }

        Branch withAtom(Expression atom, boolean value) {
            if (atoms.containsKey(atom)) return this;
            ImmutableMap<Expression, Boolean> more = ImmutableMap.<Expression, Boolean>builder().putAll(atoms).put(atom, value).build();
            return new Branch(agenda, accessible, more, depth, indent);
        }
    }

    /**
     * What a rule leaves to do: either a finished outcome or the branch to continue with.
     * Non-branching rules hand back their branch instead of recursing, so only splits use
     * stack.
     */
    private static final class Step {
        final Outcome outcome;
        final Branch next;

        private Step(Outcome outcome, Branch next) {
            this.outcome = outcome;
            this.next = next;
        }

        static Step done(Outcome outcome) { return new Step(outcome, null); }

        static Step then(Branch next) { return new Step(null, next); }
    }

    private final class Search implements Category.Rules<Branch, Step> {
        private final ProofTrace trace;

        Search(ProofTrace trace) {
            this.trace = trace;
        }

        Outcome attempt(Branch branch) {
            Branch b = branch;
            while (true) {
                ++stepCount;
                if (stepCount % logCheckSteps == 0) {
                    final Branch current = b;
                    maybeReportProgress(() -> String.format("depth %d agenda %d terms %d",
                            current.depth, current.agenda.size(), current.accessible.size()));
                }
                if (b.depth > budget.maxDepth() || stepCount > budget.maxSteps()) {
                    trace.line("BUDGET EXCEEDED", b.indent);
                    return Outcome.BUDGET_EXCEEDED;
                }
                Optional<AgendaItem> next = b.agenda.takeNext();
                if (!next.isPresent()) {
                    trace.line("AGENDA EMPTY", b.indent);
                    return Outcome.OPEN;
                }
                AgendaItem item = next.get();
                trace.line(item, b.indent);
                Step step = item.category().dispatch(this, item, b);
                if (step.outcome != null) return step.outcome;
                b = step.next;
            }
        }

        private Step closed(Branch b) {
            trace.line("CLOSED", b.indent, 1);
            return Step.done(Outcome.CLOSED);
        }

        private Step alpha(Branch b, Expression... conclusions) {
            for (Expression e : conclusions) b.agenda.insert(e);
            return Step.then(b.deeper());
        }

        private Step beta(Branch b, List<Expression> left, List<Expression> right) {
            Branch r = b.split();
            b.agenda.insertAll(left);
            r.agenda.insertAll(right);
            Outcome outcome = attempt(new Branch(b.agenda, b.accessible, b.atoms, b.depth + 1, b.indent + 1));
            if (outcome != Outcome.CLOSED) return Step.done(outcome);
            return Step.done(attempt(r));
        }

        private Step literal(Branch b, Expression atom, boolean value) {
            Boolean known = b.atoms.get(atom);
            if (known != null && known != value) return closed(b);
            b.agenda.refreshUniversals();
            return Step.then(b.withAtom(atom, value).withAccessible(arguments(atom)).deeper());
        }

        @Override
        public Step atom(AgendaItem item, Branch b) {
            return literal(b, item.expression(), true);
        }

        @Override
        public Step negatedAtom(AgendaItem item, Branch b) {
            return literal(b, body(item.expression()), false);
        }

        @Override
        public Step negatedEquality(AgendaItem item, Branch b) {
            EqualityExpression q = (EqualityExpression) body(item.expression());
            if (q.first().equals(q.second())) return closed(b);
            item.markExhausted();
            b.agenda.putBack(item);
            Branch extended = b.withAccessible(ImmutableList.of(q.first(), q.second()));
            if (extended != b) b.agenda.refreshUniversals();
            return Step.then(extended.deeper());
        }

        @Override
        public Step doubleNegation(AgendaItem item, Branch b) {
            return alpha(b, body(body(item.expression())));
        }

        @Override
        public Step negatedAll(AgendaItem item, Branch b) {
            AllExpression a = (AllExpression) body(item.expression());
            return alpha(b, new ExistsExpression(a.variable(), new NegatedExpression(a.body())));
        }

        @Override
        public Step negatedExists(AgendaItem item, Branch b) {
            ExistsExpression e = (ExistsExpression) body(item.expression());
            return alpha(b, new AllExpression(e.variable(), new NegatedExpression(e.body())));
        }

        @Override
        public Step and(AgendaItem item, Branch b) {
            BinaryExpression e = (BinaryExpression) item.expression();
            return alpha(b, e.first(), e.second());
        }

        @Override
        public Step negatedOr(AgendaItem item, Branch b) {
            BinaryExpression e = (BinaryExpression) body(item.expression());
            return alpha(b, new NegatedExpression(e.first()), new NegatedExpression(e.second()));
        }

        @Override
        public Step negatedImplies(AgendaItem item, Branch b) {
            BinaryExpression e = (BinaryExpression) body(item.expression());
            return alpha(b, e.first(), new NegatedExpression(e.second()));
        }

        @Override
        public Step or(AgendaItem item, Branch b) {
            BinaryExpression e = (BinaryExpression) item.expression();
            return beta(b, ImmutableList.of(e.first()), ImmutableList.of(e.second()));
        }

        @Override
        public Step implies(AgendaItem item, Branch b) {
            BinaryExpression e = (BinaryExpression) item.expression();
            return beta(b, ImmutableList.of(new NegatedExpression(e.first())), ImmutableList.of(e.second()));
        }

        @Override
        public Step negatedAnd(AgendaItem item, Branch b) {
            BinaryExpression e = (BinaryExpression) body(item.expression());
            return beta(b, ImmutableList.of(new NegatedExpression(e.first())), ImmutableList.of(new NegatedExpression(e.second())));
        }

        @Override
        public Step iff(AgendaItem item, Branch b) {
            BinaryExpression e = (BinaryExpression) item.expression();
            return beta(b, ImmutableList.of(e.first(), e.second()),
                    ImmutableList.of(new NegatedExpression(e.first()), new NegatedExpression(e.second())));
        }

        @Override
        public Step negatedIff(AgendaItem item, Branch b) {
            BinaryExpression e = (BinaryExpression) body(item.expression());
            return beta(b, ImmutableList.of(e.first(), new NegatedExpression(e.second())),
                    ImmutableList.of(new NegatedExpression(e.first()), e.second()));
        }

        @Override
        public Step equality(AgendaItem item, Branch b) {
            EqualityExpression q = (EqualityExpression) item.expression();
            if (q.first().equals(q.second())) return Step.then(b.deeper());
            final Variable v;
            final Expression replacement;
            if (q.first() instanceof VariableExpression) {
                v = ((VariableExpression) q.first()).variable();
                replacement = q.second();
            } else if (q.second() instanceof VariableExpression) {
                v = ((VariableExpression) q.second()).variable();
                replacement = q.first();
            } else {
                log.debug("%s: dropping equality between compound terms: %s", name(), q);
                return Step.then(b.deeper());
            }
            // Atoms go back on the agenda so the substitution reaches them too.
            b.agenda.insertAtoms(b.atoms);
            b.agenda.replaceAll(v, replacement, fresh);
            b.agenda.refreshNegatedEqualities();
            VariableExpression replaced = new VariableExpression(v);
            ImmutableSet.Builder<Expression> accessible = ImmutableSet.builder();
            for (Expression t : b.accessible) {
                if (!t.equals(replaced)) accessible.add(t.replace(v, replacement, false, fresh));
            }
            return Step.then(new Branch(b.agenda, accessible.build(), ImmutableMap.of(), b.depth + 1, b.indent));
        }

        @Override
        public Step exists(AgendaItem item, Branch b) {
            ExistsExpression e = (ExistsExpression) item.expression();
            VariableExpression witness = new VariableExpression(fresh.next());
            b.agenda.insert(e.body().replace(e.variable(), witness, false, fresh));
            b.agenda.refreshUniversals();
            return Step.then(b.withAccessible(ImmutableList.of(witness)).deeper());
        }

        @Override
        public Step all(AgendaItem item, Branch b) {
            AllExpression a = (AllExpression) item.expression();
            Branch extended = b;
            Optional<Expression> term;
            if (b.accessible.isEmpty()) {
                Expression z = new VariableExpression(fresh.next());
                extended = b.withAccessible(ImmutableList.of(z));
                b.agenda.refreshUniversals();
                term = Optional.of(z);
            } else {
                term = b.accessible.stream().filter(t -> !item.usedWith().contains(t)).findFirst();
            }
            if (term.isPresent()) {
                Expression t = term.get();
                trace.line(String.format("--> Using '%s'", t), b.indent, 2);
                item.use(t);
                b.agenda.insert(a.body().replace(a.variable(), t, false, fresh));
            } else {
                trace.line("--> Variables Exhausted", b.indent, 2);
                item.markExhausted();
            }
            b.agenda.putBack(item);
            return Step.then(extended.deeper());
        }
    }

    private static Expression body(Expression negation) {
        return ((NegatedExpression) negation).body();
    }

    private static List<Expression> arguments(Expression atom) {
        if (atom instanceof ApplicationExpression) return ((ApplicationExpression) atom).arguments();
        return Collections.emptyList();
    }
}
