package net.littleredcomputer.inference;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import com.google.common.io.CharStreams;
import net.littleredcomputer.inference.model.Model;
import net.littleredcomputer.inference.tableau.SearchBudget;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.LogicParser;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class Main {
    private static final Splitter lineSplitter = Splitter.on('\n').trimResults(CharMatcher.whitespace()).omitEmptyStrings();

    private static Options options() {
        return new Options()
                .addOption("task", true, "what to do: prove, model or parse")
                .addOption("goal", true, "formula to prove")
                .addOption("assumption", true, "an assumption (may be repeated)")
                .addOption("problem", true, "file of assumptions, one per line, # for comments, - for stdin")
                .addOption("prover", true, "prover to use (default tableau)")
                .addOption("modelbuilder", true, "model builder to use (default finite)")
                .addOption("maxdepth", true, "longest branch the prover may explore")
                .addOption("maxsteps", true, "most rule applications the prover may make")
                .addOption("domainsize", true, "largest domain the model builder tries")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format")
                .addOption("trace", false, "print the proof search")
                .addOption("closedworld", false, "assume predicates hold only where the assumptions say so")
                .addOption("closeddomain", false, "assume the named constants are the only individuals")
                .addOption("uniquenames", false, "assume distinct names denote distinct individuals");
    }

    private static Reader problem(CommandLine cmd) throws IOException {
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static List<Expression> assumptions(CommandLine cmd) throws IOException {
        List<Expression> out = new ArrayList<>();
        if (cmd.hasOption("problem")) {
            try (Reader r = problem(cmd)) {
                for (String line : lineSplitter.split(CharStreams.toString(r))) {
                    if (!line.startsWith("#")) out.add(LogicParser.parseFrom(line));
                }
            }
        }
        String[] given = cmd.getOptionValues("assumption");
        if (given != null) for (String a : given) out.add(LogicParser.parseFrom(a));
        return out;
    }

    private static Optional<Expression> goal(CommandLine cmd) {
        return cmd.hasOption("goal") ? Optional.of(LogicParser.parseFrom(cmd.getOptionValue("goal"))) : Optional.empty();
    }

    private static SearchBudget budget(CommandLine cmd) {
        SearchBudget b = SearchBudget.DEFAULT;
        if (cmd.hasOption("maxdepth")) b = b.withMaxDepth(Integer.parseInt(cmd.getOptionValue("maxdepth")));
        if (cmd.hasOption("maxsteps")) b = b.withMaxSteps(Long.parseLong(cmd.getOptionValue("maxsteps")));
        return b;
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    private static ProverCommand proverCommand(CommandLine cmd, Optional<Expression> goal, List<Expression> assumptions) {
        Prover prover = TheoremTools.prover(cmd.getOptionValue("prover", TheoremTools.TABLEAU), budget(cmd));
        if (prover instanceof AbstractTheoremTool) ((AbstractTheoremTool) prover).setLogInterval(logInterval(cmd));
        ProverCommand command = new BaseProverCommand(prover, goal, assumptions);
        if (cmd.hasOption("closedworld")) command = new ClosedWorldProverCommand(command);
        if (cmd.hasOption("uniquenames")) command = new UniqueNamesProverCommand(command);
        if (cmd.hasOption("closeddomain")) command = new ClosedDomainProverCommand(command);
        return command;
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        Optional<Expression> goal = goal(cmd);
        List<Expression> assumptions = assumptions(cmd);
        switch (task) {
            case "prove": {
                if (!goal.isPresent() && assumptions.isEmpty()) throw new IllegalArgumentException("Must specify -goal or assumptions");
                ProverCommand command = proverCommand(cmd, goal, assumptions);
                Stopwatch sw = Stopwatch.createStarted();
                boolean proved = command.prove();
                sw.stop();
                if (cmd.hasOption("trace")) System.out.println(command.proof());
                System.out.println(proved ? "proved" : "not proved");
                System.out.println("c " + sw);
                break;
            }
            case "model": {
                ModelBuilder builder = TheoremTools.modelBuilder(cmd.getOptionValue("modelbuilder", TheoremTools.FINITE),
                        Integer.parseInt(cmd.getOptionValue("domainsize", "4")));
                if (builder instanceof AbstractTheoremTool) ((AbstractTheoremTool) builder).setLogInterval(logInterval(cmd));
                ModelBuilderCommand command = new ModelBuilderCommand(builder, goal, assumptions);
                if (command.buildModel()) {
                    Model m = command.model().get();
                    System.out.print(m);
                } else {
                    System.out.println("no model found");
                }
                break;
            }
            case "parse":
                goal.ifPresent(g -> System.out.println("goal: " + g + "  simplified: " + g.simplify()));
                for (Expression a : assumptions) System.out.println(a + "  simplified: " + a.simplify());
                break;
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
    }
}
