package net.littleredcomputer.logic;

import com.google.common.collect.ImmutableSet;

/**
 * The surface syntax. Printing uses the symbolic forms; the parser also accepts the words.
 */
public final class Tokens {
    public static final String LAMBDA = "\\";
    public static final String ALL = "all";
    public static final String EXISTS = "exists";
    public static final String SOME = "some";
    public static final String DOT = ".";
    public static final String OPEN = "(";
    public static final String CLOSE = ")";
    public static final String COMMA = ",";
    public static final String NOT = "-";
    public static final String AND = "&";
    public static final String OR = "|";
    public static final String IMPLIES = "->";
    public static final String IFF = "<->";
    public static final String EQ = "=";
    public static final String NEQ = "!=";

    public static final ImmutableSet<String> NOTS = ImmutableSet.of(NOT, "not");
    public static final ImmutableSet<String> ANDS = ImmutableSet.of(AND, "and");
    public static final ImmutableSet<String> ORS = ImmutableSet.of(OR, "or");
    public static final ImmutableSet<String> IMPLICATIONS = ImmutableSet.of(IMPLIES, "implies");
    public static final ImmutableSet<String> BICONDITIONALS = ImmutableSet.of(IFF, "iff");
    public static final ImmutableSet<String> UNIVERSALS = ImmutableSet.of(ALL);
    public static final ImmutableSet<String> EXISTENTIALS = ImmutableSet.of(EXISTS, SOME);

    /** Tokens that need no surrounding whitespace. */
    public static final ImmutableSet<String> SYMBOLS = ImmutableSet.of(
            LAMBDA, DOT, OPEN, CLOSE, COMMA, EQ, NEQ, NOT, AND, OR, IMPLIES, IFF);

    public static final ImmutableSet<String> RESERVED = ImmutableSet.<String>builder()
            .addAll(SYMBOLS).addAll(NOTS).addAll(ANDS).addAll(ORS).addAll(IMPLICATIONS)
            .addAll(BICONDITIONALS).addAll(UNIVERSALS).addAll(EXISTENTIALS)
            .build();

    private Tokens() {}
}
