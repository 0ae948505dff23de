package net.littleredcomputer.inference.tableau;

import net.littleredcomputer.inference.ProofResult;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.FreshVariables;
import net.littleredcomputer.logic.LogicParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class TableauTestBase {
    static Expression parse(String s) { return LogicParser.parseFrom(s); }

    static List<Expression> parseAll(String... ss) {
        List<Expression> out = new ArrayList<>();
        for (String s : ss) out.add(parse(s));
        return out;
    }

    static TableauProver prover() { return new TableauProver(new FreshVariables(), SearchBudget.DEFAULT); }

    static ProofResult attempt(String goal, String... assumptions) {
        return prover().prove(Optional.of(parse(goal)), parseAll(assumptions), false);
    }

    void assertProves(String goal, String... assumptions) {
        ProofResult r = attempt(goal, assumptions);
        assertThat(goal + " from " + String.join(", ", assumptions), r.proved(), is(true));
    }

    void assertDoesNotProve(String goal, String... assumptions) {
        ProofResult r = attempt(goal, assumptions);
        assertThat(goal + " from " + String.join(", ", assumptions), r.proved(), is(false));
        assertThat(r.budgetExceeded(), is(false));
    }

    void assertUnsatisfiable(String... assumptions) {
        assertThat(prover().prove(Optional.empty(), parseAll(assumptions), false).proved(), is(true));
    }

    void assertSatisfiable(String... assumptions) {
        assertThat(prover().prove(Optional.empty(), parseAll(assumptions), false).proved(), is(false));
    }
}
