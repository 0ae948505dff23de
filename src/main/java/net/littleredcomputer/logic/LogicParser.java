package net.littleredcomputer.logic;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;

/**
 * Recursive descent parser for formulas, e.g. {@code all x.(man(x) -> mortal(x))}.
 * <p>
 * Applications are curried as they are read. After a primary expression the parser extends
 * it with trailing argument lists, then an optional equality, then an optional binary
 * connective whose right operand is everything that follows (so connectives associate to
 * the right). Negation, quantifier and lambda bodies are primary expressions only:
 * {@code all x.P(x) & Q} is {@code (all x.P(x)) & Q}.
 * <p>
 * The token-to-operator mapping is taken from overridable hooks, so a subclass can accept
 * a different concrete syntax without touching the recursion. Instances are not thread safe.
 */
public class LogicParser {
    private static final Splitter whitespaceSplitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private SymbolTrie trie;
    private List<String> tokens = ImmutableList.of();
    private int index = 0;

    public static Expression parseFrom(String text) {
        return new LogicParser().parse(text);
    }

    public Expression parse(String text) {
        tokens = tokenize(text);
        index = 0;
        Expression result = parseExpression(true);
        if (inRange(0)) throw new UnexpectedTokenException(peek());
        return result;
    }

    /**
     * Surround every symbol with whitespace (preferring the longest symbol at each position)
     * and split the result on whitespace.
     */
    List<String> tokenize(String text) {
        if (trie == null) trie = new SymbolTrie(symbols());
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            int n = trie.longestMatch(text, i);
            if (n > 0) {
                out.append(' ').append(text, i, i + n).append(' ');
                i += n;
            } else {
                out.append(text.charAt(i));
                ++i;
            }
        }
        return whitespaceSplitter.splitToList(out);
    }

    protected Set<String> symbols() {
        return Tokens.SYMBOLS;
    }

    protected boolean isVariable(String token) {
        return !Tokens.RESERVED.contains(token);
    }

    protected boolean isNegation(String token) {
        return Tokens.NOTS.contains(token);
    }

    protected boolean isEquality(String token) {
        return token.equals(Tokens.EQ);
    }

    protected boolean isInequality(String token) {
        return token.equals(Tokens.NEQ);
    }

    protected Optional<BinaryOperator<Expression>> booleanConnective(String token) {
        if (Tokens.ANDS.contains(token)) return Optional.of(AndExpression::new);
        if (Tokens.ORS.contains(token)) return Optional.of(OrExpression::new);
        if (Tokens.IMPLICATIONS.contains(token)) return Optional.of(ImpliesExpression::new);
        if (Tokens.BICONDITIONALS.contains(token)) return Optional.of(IffExpression::new);
        return Optional.empty();
    }

    protected Optional<BiFunction<Variable, Expression, Expression>> quantifier(String token) {
        if (Tokens.UNIVERSALS.contains(token)) return Optional.of(AllExpression::new);
        if (Tokens.EXISTENTIALS.contains(token)) return Optional.of(ExistsExpression::new);
        return Optional.empty();
    }

    private boolean inRange(int offset) {
        return index + offset < tokens.size();
    }

    private String peek() {
        if (!inRange(0)) throw new LogicParseException("More tokens expected.");
        return tokens.get(index);
    }

    private String next() {
        String t = peek();
        ++index;
        return t;
    }

    private static void expect(String token, String expected) {
        if (!token.equals(expected)) throw new UnexpectedTokenException(token, expected);
    }

    protected Expression parseExpression(boolean allowAdjuncts) {
        Expression accum = handle(next());
        if (allowAdjuncts) {
            accum = attemptApplication(accum);
            accum = attemptEquality(accum);
            accum = attemptBoolean(accum);
        }
        return accum;
    }

    protected Expression handle(String token) {
        if (isVariable(token)) return handleVariable(token);
        if (isNegation(token)) return new NegatedExpression(parseExpression(false));
        if (token.equals(Tokens.LAMBDA)) return handleBinder(LambdaExpression::new, false);
        Optional<BiFunction<Variable, Expression, Expression>> q = quantifier(token);
        if (q.isPresent()) return handleBinder(q.get(), true);
        if (token.equals(Tokens.OPEN)) {
            Expression e = parseExpression(true);
            expect(next(), Tokens.CLOSE);
            return e;
        }
        throw new UnexpectedTokenException(token);
    }

    // A bare variable, or a predicate applied to arguments: john, x, sees(x,y)
    private Expression handleVariable(String token) {
        VariableExpression v = new VariableExpression(token);
        Expression accum = v;
        if (inRange(0) && peek().equals(Tokens.OPEN)) {
            if (v.isIndividual()) {
                throw new TypeMisuseException(String.format(
                        "'%s' is an illegal predicate name. Individual variables may not be used as predicates.", token));
            }
            next();
            accum = parseArguments(accum);
        }
        return attemptEquality(accum);
    }

    // The opening parenthesis has been consumed.
    private Expression parseArguments(Expression function) {
        Expression accum = new ApplicationExpression(function, parseExpression(true));
        while (peek().equals(Tokens.COMMA)) {
            next();
            accum = new ApplicationExpression(accum, parseExpression(true));
        }
        expect(next(), Tokens.CLOSE);
        return accum;
    }

    // \x y.M is \x.\y.M, and likewise for the quantifiers. Only lambdas may bind predicates.
    private Expression handleBinder(BiFunction<Variable, Expression, Expression> factory, boolean individualsOnly) {
        Deque<Variable> vars = new ArrayDeque<>();
        String first = next();
        if (!isVariable(first)) throw new UnexpectedTokenException(first);
        vars.push(boundVariable(first, individualsOnly));
        while (isVariable(peek())) vars.push(boundVariable(next(), individualsOnly));
        expect(next(), Tokens.DOT);
        Expression accum = parseExpression(false);
        while (!vars.isEmpty()) accum = factory.apply(vars.pop(), accum);
        return accum;
    }

    private static Variable boundVariable(String token, boolean individualsOnly) {
        if (individualsOnly && !Variable.isIndividualName(token)) {
            throw new LogicParseException(String.format(
                    "'%s' is an illegal variable name. Constant expressions may not be quantified.", token));
        }
        return new Variable(token);
    }

    private Expression attemptApplication(Expression expression) {
        if (!inRange(0) || !peek().equals(Tokens.OPEN)) return expression;
        if (expression instanceof VariableExpression) {
            if (((VariableExpression) expression).isIndividual()) {
                throw new TypeMisuseException(String.format(
                        "'%s' is an illegal predicate name. Individual variables may not be used as predicates.", expression));
            }
        } else if (!(expression instanceof LambdaExpression) && !(expression instanceof ApplicationExpression)) {
            throw new TypeMisuseException(String.format(
                    "The function '%s' is not a lambda expression or an application expression, so it may not take arguments",
                    expression));
        }
        next();
        return attemptApplication(parseArguments(expression));
    }

    private Expression attemptEquality(Expression expression) {
        if (!inRange(0)) return expression;
        String token = peek();
        if (isEquality(token)) {
            next();
            return new EqualityExpression(expression, attemptApplication(parseExpression(false)));
        }
        if (isInequality(token)) {
            next();
            return new NegatedExpression(new EqualityExpression(expression, attemptApplication(parseExpression(false))));
        }
        return expression;
    }

    private Expression attemptBoolean(Expression expression) {
        if (!inRange(0)) return expression;
        Optional<BinaryOperator<Expression>> connective = booleanConnective(peek());
        if (!connective.isPresent()) return expression;
        next();
        return connective.get().apply(expression, parseExpression(true));
    }

    @Override
    public String toString() {
        return "<" + getClass().getSimpleName() + ": " + (inRange(0) ? "Next token: " + tokens.get(index) : "No more tokens") + ">";
    }
}
