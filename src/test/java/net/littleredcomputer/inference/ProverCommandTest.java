package net.littleredcomputer.inference;

import net.littleredcomputer.logic.Expression;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ProverCommandTest extends InferenceTestBase {
    private static class CountingProver implements Prover {
        int calls = 0;

        @Override
        public ProofResult prove(Optional<Expression> goal, List<Expression> assumptions, boolean trace) {
            ++calls;
            return new ProofResult(assumptions.size() > 1, false, "attempt " + calls, 1);
        }
    }

    @Test
    public void provesSocrates() {
        BaseProverCommand c = command("mortal(socrates)", "all x.(man(x) -> mortal(x))", "man(socrates)");
        assertThat(c.prove(), is(true));
        assertThat(c.proof(), containsString("CLOSED"));
    }

    @Test
    public void doesNotProveWithoutTheRule() {
        assertThat(command("mortal(socrates)", "man(socrates)").prove(), is(false));
    }

    @Test(expected = IllegalStateException.class)
    public void proofBeforeProve() {
        command("P | -P").proof();
    }

    @Test
    public void resultIsCached() {
        CountingProver p = new CountingProver();
        BaseProverCommand c = new BaseProverCommand(p, parse("Q"), parseAll("P", "P -> Q"));
        assertThat(c.result(), isEmpty());
        c.prove();
        c.prove();
        assertThat(p.calls, is(1));
        assertThat(c.result(), isPresent());
        assertThat(c.proof(), is("attempt 1"));
    }

    @Test
    public void changingAssumptionsDiscardsTheResult() {
        CountingProver p = new CountingProver();
        BaseProverCommand c = new BaseProverCommand(p, parse("Q"), parseAll("P"));
        assertThat(c.prove(), is(false));
        c.addAssumptions(parseAll("P -> Q"));
        assertThat(c.result(), isEmpty());
        assertThat(c.prove(), is(true));
        assertThat(p.calls, is(2));
        c.retractAssumptions(parseAll("P"), true);
        assertThat(c.result(), isEmpty());
        assertThat(c.assumptions(), is(parseAll("P -> Q")));
    }

    @Test(expected = IllegalStateException.class)
    public void proofAfterChange() {
        BaseProverCommand c = command("Q", "P", "P -> Q");
        c.prove();
        c.addAssumptions(parseAll("R"));
        c.proof();
    }

    @Test
    public void addAndRetractWithTheTableau() {
        BaseProverCommand c = command("mortal(socrates)", "man(socrates)");
        assertThat(c.prove(), is(false));
        c.addAssumptions(parseAll("all x.(man(x) -> mortal(x))"));
        assertThat(c.prove(), is(true));
        c.retractAssumptions(parseAll("all y.(man(y) -> mortal(y))"), true);
        assertThat(c.prove(), is(false));
    }

    @Test
    public void retractingAnAbsentAssumptionIsHarmless() {
        BaseProverCommand c = command("Q", "P");
        c.retractAssumptions(parseAll("R"), true);
        c.retractAssumptions(parseAll("S"), false);
        assertThat(c.assumptions(), is(parseAll("P")));
    }

    @Test
    public void showProofLeavesTheCacheAlone() {
        CountingProver p = new CountingProver();
        BaseProverCommand c = new BaseProverCommand(p, parse("Q"), parseAll("P"));
        assertThat(c.showProof(), is("attempt 1"));
        assertThat(c.result(), isEmpty());
    }

    @Test
    public void showProofTracesTheSearch() {
        assertThat(command("P | -P").showProof(), containsString("CLOSED"));
    }
}
