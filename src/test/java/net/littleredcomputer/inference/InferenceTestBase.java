package net.littleredcomputer.inference;

import net.littleredcomputer.inference.tableau.SearchBudget;
import net.littleredcomputer.inference.tableau.TableauProver;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.FreshVariables;
import net.littleredcomputer.logic.LogicParser;

import java.util.ArrayList;
import java.util.List;

public class InferenceTestBase {
    static Expression parse(String s) { return LogicParser.parseFrom(s); }

    static List<Expression> parseAll(String... ss) {
        List<Expression> out = new ArrayList<>();
        for (String s : ss) out.add(parse(s));
        return out;
    }

    static Prover tableau() { return new TableauProver(new FreshVariables(), SearchBudget.DEFAULT); }

    static BaseProverCommand command(String goal, String... assumptions) {
        return new BaseProverCommand(tableau(), parse(goal), parseAll(assumptions));
    }
}
