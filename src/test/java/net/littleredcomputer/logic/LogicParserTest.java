package net.littleredcomputer.logic;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class LogicParserTest {
    private static VariableExpression v(String name) { return new VariableExpression(name); }

    private static Expression parse(String s) { return LogicParser.parseFrom(s); }

    private static void roundTrip(String s) {
        Expression e = parse(s);
        assertThat(parse(e.toString()), is(e));
    }

    @Test
    public void tokenize() {
        assertThat(new LogicParser().tokenize("all x.(man(x)->mortal(x))"),
                is(Arrays.asList("all", "x", ".", "(", "man", "(", "x", ")", "->", "mortal", "(", "x", ")", ")")));
        assertThat(new LogicParser().tokenize("-P<->Q"), is(Arrays.asList("-", "P", "<->", "Q")));
        assertThat(new LogicParser().tokenize("a!=b"), is(Arrays.asList("a", "!=", "b")));
        assertThat(new LogicParser().tokenize("  \\x y.  see(x,y) "),
                is(Arrays.asList("\\", "x", "y", ".", "see", "(", "x", ",", "y", ")")));
    }

    @Test
    public void universalImplication() {
        Expression expected = new AllExpression(new Variable("x"),
                new ImpliesExpression(
                        new ApplicationExpression(v("man"), v("x")),
                        new ApplicationExpression(v("mortal"), v("x"))));
        assertThat(parse("all x.(man(x) implies mortal(x))"), is(expected));
        assertThat(parse("all x.(man(x) -> mortal(x))"), is(expected));
    }

    @Test
    public void universalImplicationIsExactlyTheCurriedStructure() {
        Expression e = parse("all x.(man(x) implies mortal(x))");
        assertThat(e, instanceOf(AllExpression.class));
        AllExpression a = (AllExpression) e;
        assertThat(a.variable(), is(new Variable("x")));
        assertThat(a.body(), instanceOf(ImpliesExpression.class));
        ImpliesExpression i = (ImpliesExpression) a.body();
        ApplicationExpression man = (ApplicationExpression) i.first();
        assertThat(((VariableExpression) man.function()).variable(), is(new Variable("man")));
        assertThat(((VariableExpression) man.argument()).variable(), is(new Variable("x")));
    }

    @Test
    public void applicationsAreCurried() {
        assertThat(parse("see(john,mary)"),
                is(new ApplicationExpression(new ApplicationExpression(v("see"), v("john")), v("mary"))));
        assertThat(((ApplicationExpression) parse("give(a,b,c)")).uncurry(),
                is(ImmutableList.<Expression>of(v("give"), v("a"), v("b"), v("c"))));
    }

    @Test
    public void wordsAndSymbolsAgree() {
        assertThat(parse("not P and Q or R"), is(parse("-P & (Q | R)")));
        assertThat(parse("P iff Q"), is(parse("P <-> Q")));
        assertThat(parse("some x.P(x)"), is(parse("exists x.P(x)")));
    }

    @Test
    public void connectivesAssociateToTheRight() {
        assertThat(parse("P & Q & R"), is(new AndExpression(v("P"), new AndExpression(v("Q"), v("R")))));
        assertThat(parse("P -> Q -> R"), is(new ImpliesExpression(v("P"), new ImpliesExpression(v("Q"), v("R")))));
    }

    @Test
    public void negationAndQuantifiersBindTightly() {
        assertThat(parse("-P & Q"), is(new AndExpression(new NegatedExpression(v("P")), v("Q"))));
        assertThat(parse("all x.P(x) & Q"),
                is(new AndExpression(new AllExpression(new Variable("x"), new ApplicationExpression(v("P"), v("x"))), v("Q"))));
    }

    @Test
    public void multipleBinderVariables() {
        assertThat(parse("all x y.see(x,y)"), is(parse("all x.all y.see(x,y)")));
        assertThat(parse("\\x y.see(x,y)"), is(parse("\\x.\\y.see(x,y)")));
    }

    @Test
    public void equality() {
        assertThat(parse("x = y"), is(new EqualityExpression(v("x"), v("y"))));
        assertThat(parse("f(x) = y"), is(new EqualityExpression(new ApplicationExpression(v("f"), v("x")), v("y"))));
        assertThat(parse("(x = y) -> (y = x)"),
                is(new ImpliesExpression(new EqualityExpression(v("x"), v("y")), new EqualityExpression(v("y"), v("x")))));
    }

    @Test
    public void inequality() {
        assertThat(parse("a != b"), is(new NegatedExpression(new EqualityExpression(v("a"), v("b")))));
        assertThat(parse("exists x y.(x != y)").toString(), is("exists x y.-(x = y)"));
    }

    @Test
    public void lambdaApplication() {
        Expression e = parse("(\\x.walk(x))(john)");
        assertThat(e, instanceOf(ApplicationExpression.class));
        assertThat(e.simplify(), is(parse("walk(john)")));
    }

    @Test
    public void printing() {
        assertThat(parse("all x.(man(x) implies mortal(x))").toString(), is("all x.(man(x) -> mortal(x))"));
        assertThat(parse("not (P and Q)").toString(), is("-(P & Q)"));
        assertThat(parse("all x.all y.see(x,y)").toString(), is("all x y.see(x,y)"));
        assertThat(parse("all x.exists y.see(x,y)").toString(), is("all x.exists y.see(x,y)"));
        assertThat(parse("(P iff Q) or R").toString(), is("((P <-> Q) | R)"));
    }

    @Test
    public void printedFormsReadBack() {
        roundTrip("all x.(man(x) -> mortal(x))");
        roundTrip("exists x.(dog(x) & -barks(x))");
        roundTrip("-((\\x.walk(x))(john))");
        roundTrip("\\P x.P(x)");
        roundTrip("all x y.((x = y) -> (y = x))");
        roundTrip("((P -> Q) <-> (-Q -> -P))");
        roundTrip("a != b");
        roundTrip("(-P) = Q");
        roundTrip("(all x.P(x)) = Q");
        roundTrip("(\\x.P(x)) = Q");
        roundTrip("Q = (exists x.P(x))");
        roundTrip("Q = (-(P = R))");
    }

    @Test
    public void bracketedEqualityOperands() {
        Expression e = parse("(-P) = Q");
        assertThat(e, instanceOf(EqualityExpression.class));
        assertThat(e.toString(), is("((-P) = Q)"));
    }

    @Test(expected = TypeMisuseException.class)
    public void individualVariableAsPredicate() {
        parse("x(y)");
    }

    @Test(expected = TypeMisuseException.class)
    public void argumentsToQuantifiedExpression() {
        parse("(all x.P(x))(john)");
    }

    @Test(expected = LogicParseException.class)
    public void quantifiedConstant() {
        parse("all John.P(John)");
    }

    @Test(expected = LogicParseException.class)
    public void quantifiedPredicateAfterIndividual() {
        parse("exists x P.P(x)");
    }

    @Test
    public void lambdaMayBindPredicates() {
        assertThat(parse("\\P.P(john)"), instanceOf(LambdaExpression.class));
    }

    @Test(expected = LogicParseException.class)
    public void endOfInput() {
        parse("all x.");
    }

    @Test(expected = LogicParseException.class)
    public void emptyInput() {
        parse("");
    }

    @Test(expected = UnexpectedTokenException.class)
    public void trailingTokens() {
        parse("P(x) Q");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unbalancedParentheses() {
        parse("(P & Q");
    }

    @Test
    public void unexpectedTokenNamesWhatWasExpected() {
        try {
            parse("all x (P(x))");
            fail("expected a parse error");
        } catch (UnexpectedTokenException e) {
            assertThat(e.token(), is("("));
            assertThat(e.expected().isPresent(), is(true));
            assertThat(e.expected().get(), is("."));
        }
    }
}
