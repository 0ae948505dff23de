package net.littleredcomputer.inference.tableau;

import net.littleredcomputer.logic.AllExpression;
import net.littleredcomputer.logic.AndExpression;
import net.littleredcomputer.logic.ApplicationExpression;
import net.littleredcomputer.logic.EqualityExpression;
import net.littleredcomputer.logic.ExistsExpression;
import net.littleredcomputer.logic.Expression;
import net.littleredcomputer.logic.ExpressionVisitor;
import net.littleredcomputer.logic.IffExpression;
import net.littleredcomputer.logic.ImpliesExpression;
import net.littleredcomputer.logic.LambdaExpression;
import net.littleredcomputer.logic.NegatedExpression;
import net.littleredcomputer.logic.OrExpression;
import net.littleredcomputer.logic.VariableExpression;

/**
 * The shape of a formula as far as the tableau rules care. Constants are declared in the
 * order the agenda serves them: closing checks and non-branching rules first, branching
 * rules next, and the rules that introduce terms last.
 */
public enum Category {
    ATOM {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.atom(item, state); }
    },
    NEGATED_ATOM {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.negatedAtom(item, state); }
    },
    NEGATED_EQUALITY {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.negatedEquality(item, state); }
    },
    DOUBLE_NEGATION {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.doubleNegation(item, state); }
    },
    NEGATED_ALL {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.negatedAll(item, state); }
    },
    NEGATED_EXISTS {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.negatedExists(item, state); }
    },
    AND {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.and(item, state); }
    },
    NEGATED_OR {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.negatedOr(item, state); }
    },
    NEGATED_IMPLIES {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.negatedImplies(item, state); }
    },
    OR {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.or(item, state); }
    },
    IMPLIES {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.implies(item, state); }
    },
    NEGATED_AND {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.negatedAnd(item, state); }
    },
    IFF {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.iff(item, state); }
    },
    NEGATED_IFF {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.negatedIff(item, state); }
    },
    EQUALITY {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.equality(item, state); }
    },
    EXISTS {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.exists(item, state); }
    },
    ALL {
        @Override
        public <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state) { return rules.all(item, state); }
    };

    /**
     * Apply the rule for this category.
     */
    public abstract <S, R> R dispatch(Rules<S, R> rules, AgendaItem item, S state);

    /**
     * One method per category. Implementing this interface is how a rule set guarantees it
     * covers every shape of formula.
     */
    public interface Rules<S, R> {
        R atom(AgendaItem item, S state);
        R negatedAtom(AgendaItem item, S state);
        R negatedEquality(AgendaItem item, S state);
        R doubleNegation(AgendaItem item, S state);
        R negatedAll(AgendaItem item, S state);
        R negatedExists(AgendaItem item, S state);
        R and(AgendaItem item, S state);
        R negatedOr(AgendaItem item, S state);
        R negatedImplies(AgendaItem item, S state);
        R or(AgendaItem item, S state);
        R implies(AgendaItem item, S state);
        R negatedAnd(AgendaItem item, S state);
        R iff(AgendaItem item, S state);
        R negatedIff(AgendaItem item, S state);
        R equality(AgendaItem item, S state);
        R exists(AgendaItem item, S state);
        R all(AgendaItem item, S state);
    }

    /**
     * Items of these categories stay on the agenda after use and are re-enabled when new
     * terms or new equalities appear on the branch.
     */
    boolean isReusable() {
        return this == ALL || this == NEGATED_EQUALITY;
    }

    /**
     * @throws IllegalArgumentException if the expression is a lambda abstraction (or the
     *                                  negation of one), which has no truth value
     */
    public static Category of(Expression e) {
        return e.accept(positive);
    }

    private static IllegalArgumentException uncategorizable(Expression e) {
        return new IllegalArgumentException("cannot categorize expression: " + e);
    }

    private static final ExpressionVisitor<Category> negative = new ExpressionVisitor<Category>() {
        @Override public Category visitVariable(VariableExpression v) { return NEGATED_ATOM; }
        @Override public Category visitApplication(ApplicationExpression a) { return NEGATED_ATOM; }
        @Override public Category visitLambda(LambdaExpression l) { throw uncategorizable(new NegatedExpression(l)); }
        @Override public Category visitAll(AllExpression a) { return NEGATED_ALL; }
        @Override public Category visitExists(ExistsExpression e) { return NEGATED_EXISTS; }
        @Override public Category visitNegated(NegatedExpression n) { return DOUBLE_NEGATION; }
        @Override public Category visitAnd(AndExpression a) { return NEGATED_AND; }
        @Override public Category visitOr(OrExpression o) { return NEGATED_OR; }
        @Override public Category visitImplies(ImpliesExpression i) { return NEGATED_IMPLIES; }
        @Override public Category visitIff(IffExpression i) { return NEGATED_IFF; }
        @Override public Category visitEquality(EqualityExpression e) { return NEGATED_EQUALITY; }
    };

    private static final ExpressionVisitor<Category> positive = new ExpressionVisitor<Category>() {
        @Override public Category visitVariable(VariableExpression v) { return ATOM; }
        @Override public Category visitApplication(ApplicationExpression a) { return ATOM; }
        @Override public Category visitLambda(LambdaExpression l) { throw uncategorizable(l); }
        @Override public Category visitAll(AllExpression a) { return ALL; }
        @Override public Category visitExists(ExistsExpression e) { return EXISTS; }
        @Override public Category visitNegated(NegatedExpression n) { return n.body().accept(negative); }
        @Override public Category visitAnd(AndExpression a) { return AND; }
        @Override public Category visitOr(OrExpression o) { return OR; }
        @Override public Category visitImplies(ImpliesExpression i) { return IMPLIES; }
        @Override public Category visitIff(IffExpression i) { return IFF; }
        @Override public Category visitEquality(EqualityExpression e) { return EQUALITY; }
    };
}
