package net.littleredcomputer.inference.tableau;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.inference.ProofResult;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.FreshVariables;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class TableauProverTest extends TableauTestBase {
    @Test public void instantiateUniversal() { assertProves("P(x)", "all x.P(x)"); }
    @Test public void socrates() { assertProves("mortal(socrates)", "all x.(man(x) -> mortal(x))", "man(socrates)"); }
    @Test public void existentialGoal() { assertProves("exists y.walks(y)", "all x.(man(x) -> walks(x))", "man(john)"); }
    @Test public void noContradiction() { assertProves("-(man(x) & -man(x))"); }
    @Test public void equalityChain() { assertProves("x = w", "(x = y) & ((y = z) & (z = w))"); }

    @Test public void excludedMiddle() { assertProves("P | -P"); }
    @Test public void modusPonens() { assertProves("Q", "P", "P -> Q"); }
    @Test public void itself() { assertProves("man(x)", "man(x)"); }
    @Test public void biconditionalTautology() { assertProves("man(x) <-> man(x)"); }
    @Test public void negatedBiconditional() { assertProves("-(man(x) <-> -man(x))"); }
    @Test public void contraposition() { assertProves("(P -> Q) <-> (-Q -> -P)"); }
    @Test public void deMorgan() { assertProves("-(P & Q) <-> (-P | -Q)"); }
    @Test public void universalExcludedMiddle() { assertProves("all x.(P(x) | -P(x))"); }
    @Test public void equalitySymmetric() { assertProves("all x y.((x = y) -> (y = x))"); }
    @Test public void equalityTransitive() { assertProves("all x y z.(((x = y) & (y = z)) -> (x = z))"); }
    @Test public void substituteEquals() { assertProves("walks(x)", "(x = y) & walks(y)"); }
    @Test public void namedEquals() { assertProves("walks(Bill)", "William = Bill", "walks(William)"); }
    @Test public void iffForward() { assertProves("Q", "P <-> Q", "P"); }
    @Test public void negatedIff() { assertProves("-Q", "-(P <-> Q)", "P"); }
    @Test public void quantifierExchange() { assertProves("all y.exists x.love(x,y)", "exists x.all y.love(x,y)"); }
    @Test public void negatedQuantifiers() { assertProves("exists x.-P(x)", "-all x.P(x)"); }
    @Test public void events() { assertProves("exists e y.(walk(e) & subj(e,y))", "exists e0.(walk(e0) & subj(e0,mary))"); }
    @Test public void lambdaInInput() { assertProves("walk(john)", "(\\x.walk(x))(john)"); }
    @Test public void dogs() { assertProves("animal(fido)", "all x.(dog(x) -> animal(x))", "dog(fido)"); }
    @Test public void propositionalDilemma() { assertProves("R", "P | Q", "P -> R", "Q -> R"); }

    @Test public void unprovableAtom() { assertDoesNotProve("P"); }
    @Test public void unrelated() { assertDoesNotProve("mortal(socrates)", "man(socrates)"); }
    @Test public void someIsNotAll() { assertDoesNotProve("all x.P(x)", "exists x.P(x)"); }
    @Test public void affirmingTheConsequent() { assertDoesNotProve("P", "P -> Q", "Q"); }
    @Test public void distinctNamesMayCorefer() { assertDoesNotProve("-(john = mary)", "walk(john)", "walk(mary)"); }

    @Test public void contradictoryAssumptions() { assertUnsatisfiable("P | Q", "-P", "-Q"); }
    @Test public void contradictoryQuantifiers() { assertUnsatisfiable("all x.P(x)", "exists x.-P(x)"); }
    @Test public void consistentAssumptions() { assertSatisfiable("P | Q", "-P"); }
    @Test public void selfInequality() { assertUnsatisfiable("exists x.(x != x)"); }

    @Test
    public void budgetExceededIsNotProved() {
        TableauProver p = new TableauProver(new FreshVariables(), new SearchBudget(200, 100_000));
        ProofResult r = p.prove(Optional.of(parse("R(a,b)")), parseAll("all x.exists y.R(x,y)"), false);
        assertThat(r.proved(), is(false));
        assertThat(r.budgetExceeded(), is(true));
    }

    @Test
    public void stepBudget() {
        TableauProver p = new TableauProver(new FreshVariables(), new SearchBudget(10_000, 50));
        ProofResult r = p.prove(Optional.of(parse("R(a,b)")), parseAll("all x.exists y.R(x,y)"), false);
        assertThat(r.budgetExceeded(), is(true));
        assertThat(r.steps() <= 51, is(true));
    }

    @Test
    public void traceRecordsTheSearch() {
        ProofResult r = prover().prove(Optional.of(parse("mortal(socrates)")),
                parseAll("all x.(man(x) -> mortal(x))", "man(socrates)"), true);
        assertThat(r.proved(), is(true));
        assertThat(r.proof(), containsString("--> Using 'socrates'"));
        assertThat(r.proof(), containsString("CLOSED"));
        assertThat(r.proof(), containsString("-mortal(socrates)"));
    }

    @Test
    public void traceOfOpenBranch() {
        ProofResult r = prover().prove(Optional.of(parse("P(a)")), parseAll("all x.Q(x)"), true);
        assertThat(r.proved(), is(false));
        assertThat(r.proof(), containsString("--> Variables Exhausted"));
        assertThat(r.proof(), containsString("AGENDA EMPTY"));
    }

    @Test
    public void untracedProofIsEmpty() {
        assertThat(attempt("P | -P").proof(), is(""));
    }

    @Test
    public void inputsAreNotChanged() {
        List<Expression> assumptions = ImmutableList.copyOf(parseAll("all x.(man(x) -> mortal(x))", "man(socrates)"));
        Expression goal = parse("mortal(socrates)");
        String before = assumptions.toString() + goal;
        TableauProver p = prover();
        assertThat(p.prove(goal, assumptions), is(true));
        assertThat(p.prove(goal, assumptions), is(true));
        assertThat(assumptions.toString() + goal, is(before));
    }

    @Test
    public void openBranchAfterSplits() {
        assertDoesNotProve("Q", "P | Q", "P -> -Q", "-P | R");
    }

    @Test
    public void manyFacts() {
        List<Expression> facts = new ArrayList<>();
        for (int i = 0; i < 600; ++i) facts.add(parse("P" + i));
        ProofResult r = prover().prove(Optional.of(parse("P599")), facts, false);
        assertThat(r.budgetExceeded(), is(false));
        assertThat(r.proved(), is(true));
    }

    @Test
    public void deeplyNestedSplits() {
        List<Expression> assumptions = new ArrayList<>();
        for (int i = 0; i < 300; ++i) {
            assumptions.add(parse("-P" + i));
            assumptions.add(parse("P" + i + " | S" + i));
        }
        ProofResult r = prover().prove(Optional.of(parse("S299")), assumptions, false);
        assertThat(r.budgetExceeded(), is(false));
        assertThat(r.proved(), is(true));
    }
}
