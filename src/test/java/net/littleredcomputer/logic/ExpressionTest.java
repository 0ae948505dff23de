package net.littleredcomputer.logic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

public class ExpressionTest {
    private static Expression parse(String s) { return LogicParser.parseFrom(s); }

    private static VariableExpression v(String name) { return new VariableExpression(name); }

    private static Variable var(String name) { return new Variable(name); }

    private static final String[] formulas = {
            "P",
            "walk(john)",
            "see(x,y)",
            "\\x.walk(x)",
            "\\P x.P(x)",
            "(\\x y.see(x,y))(john,mary)",
            "all x.(man(x) -> mortal(x))",
            "exists x.(dog(x) & -barks(x))",
            "all x.exists y.love(x,y)",
            "-(P | Q)",
            "(P <-> -Q)",
            "(x = john)",
            "a != b",
            "(-P) = Q",
            "(all x.P(x)) = Q",
            "(\\x.P(x)) = Q",
            "Q = (exists x.P(x))",
            "-((\\P.P(john))(\\x.walk(x)))",
            "all x y.((x = y) -> (y = x))",
    };

    @Test
    public void individualNames() {
        assertThat(Variable.isIndividualName("x"), is(true));
        assertThat(Variable.isIndividualName("z12"), is(true));
        assertThat(Variable.isIndividualName("john"), is(false));
        assertThat(Variable.isIndividualName("X"), is(false));
        assertThat(Variable.isIndividualName("x1y"), is(false));
    }

    @Test
    public void freeVariables() {
        assertThat(parse("all x.see(x,y)").free(), is(ImmutableSet.of(var("y"))));
        assertThat(parse("all x.see(x,y)").free(false), is(ImmutableSet.of(var("see"), var("y"))));
        assertThat(parse("exists x.P(x)").free(), is(ImmutableSet.of()));
        assertThat(parse("(x = john)").free(), is(ImmutableSet.of(var("x"))));
    }

    @Test
    public void alphaEquivalentExpressionsAreEqual() {
        Expression a = parse("all x.P(x)");
        Expression b = parse("all y.P(y)");
        assertThat(a, is(b));
        assertThat(a.hashCode(), is(b.hashCode()));
        assertThat(parse("\\x y.see(x,y)"), is(parse("\\a b.see(a,b)")));
    }

    @Test
    public void bindingStructureMatters() {
        assertThat(parse("all x y.see(x,y)"), is(not(parse("all y x.see(x,y)"))));
        assertThat(parse("all x.see(x,y)"), is(not(parse("all y.see(y,y)"))));
        assertThat(parse("all x.P(x)"), is(not(parse("exists x.P(x)"))));
        assertThat(parse("P(x)"), is(not(parse("P(y)"))));
    }

    @Test
    public void replaceLeavesBoundOccurrencesAlone() {
        Expression e = parse("(P(x) & all x.Q(x))");
        assertThat(e.replace(var("x"), v("john")), is(parse("(P(john) & all x.Q(x))")));
    }

    @Test
    public void replaceAvoidsCapture() {
        FreshVariables fresh = new FreshVariables();
        Expression e = parse("exists y.see(x,y)").replace(var("x"), v("y"), false, fresh);
        assertThat(e, is(parse("exists w.see(y,w)")));
        assertThat(e.free(), is(ImmutableSet.of(var("y"))));
        assertThat(fresh.issued(), is(1L));
    }

    @Test
    public void replaceBoundRenamesBinders() {
        Expression e = parse("all x.P(x)").replace(var("x"), v("y"), true, new FreshVariables());
        assertThat(e.toString(), is("all y.P(y)"));
    }

    @Test
    public void alphaConvert() {
        BinderExpression b = (BinderExpression) parse("exists x.(P(x) & Q(x))");
        assertThat(b.alphaConvert(var("z")).toString(), is("exists z.(P(z) & Q(z))"));
    }

    @Test
    public void simplifyBetaReduces() {
        assertThat(parse("(\\x y.see(x,y))(john,mary)").simplify(), is(parse("see(john,mary)")));
        assertThat(parse("-((\\P.P(john))(\\x.walk(x)))").simplify(), is(parse("-walk(john)")));
    }

    @Test
    public void simplifyAvoidsCapture() {
        Expression e = parse("(\\x.\\y.see(x,y))(y)").simplify(new FreshVariables());
        assertThat(e, is(parse("\\w.see(y,w)")));
    }

    @Test
    public void simplifyIsIdempotent() {
        Expression e = parse("(\\x.walk(x))(john) & all y.((\\z.P(z))(y))").simplify();
        assertThat(e.simplify(), is(e));
    }

    @Test
    public void propertiesOfEveryVariant() {
        Expression anything = parse("f(a)");
        for (String f : formulas) {
            Expression e = parse(f);
            assertThat(f, parse(e.toString()), is(e));
            assertThat(f, e.simplify().simplify(), is(e.simplify()));
            assertThat(f, e.replace(var("w7"), anything), is(e));
            for (Variable bound : e.variables()) {
                if (!e.free(false).contains(bound)) assertThat(f, e.replace(bound, anything), is(e));
            }
            if (e instanceof BinderExpression) {
                assertThat(f, ((BinderExpression) e).alphaConvert(var("w9")), is(e));
            }
        }
    }

    @Test
    public void negate() {
        assertThat(parse("-P(x)").negate(), is(parse("P(x)")));
        assertThat(parse("P(x)").negate(), is(parse("-P(x)")));
        assertThat(parse("--P").negate(), is(parse("-P")));
    }

    @Test
    public void builders() {
        assertThat(v("P").and(v("Q")), is(parse("P & Q")));
        assertThat(v("P").or(v("Q")).implies(v("R")), is(parse("(P | Q) -> R")));
        assertThat(v("P").iff(v("Q")), is(parse("P <-> Q")));
        assertThat(v("x").isEqualTo(v("y")), is(parse("x = y")));
        assertThat(v("see").applyTo(v("john"), v("mary")), is(parse("see(john,mary)")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void applyToNothing() {
        v("see").applyTo();
    }

    @Test
    public void constants() {
        assertThat(parse("all x.(see(x,john) & (mary = x))").constants(), is(ImmutableSet.of(var("john"), var("mary"))));
        assertThat(parse("walk(x) & P").constants(), is(ImmutableSet.of()));
    }

    @Test
    public void variables() {
        assertThat(parse("all x.see(x,john)").variables(), is(ImmutableList.of(var("x"), var("see"), var("john"))));
    }

    @Test
    public void normalizeRenumbersFreshVariables() {
        assertThat(parse("see(z17,z4)").normalize().toString(), is("see(z2,z1)"));
        assertThat(parse("all z9.P(z9,z3)").normalize().toString(), is("all z2.P(z2,z1)"));
        assertThat(parse("see(john,z)").normalize(), is(parse("see(john,z)")));
    }

    @Test
    public void freshVariablesAreIndividualsAndDistinct() {
        FreshVariables fresh = new FreshVariables();
        Variable a = fresh.next();
        Variable b = fresh.next();
        assertThat(a.isIndividual(), is(true));
        assertThat(a, is(not(b)));
        assertThat(fresh.issued(), is(2L));
    }
}
