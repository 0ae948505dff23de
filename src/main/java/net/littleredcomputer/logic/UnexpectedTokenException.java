package net.littleredcomputer.logic;

import java.util.Optional;

public class UnexpectedTokenException extends LogicParseException {
    private final String token;
    private final String expected;

    public UnexpectedTokenException(String token) {
        super(String.format("parse error, unexpected token: '%s'", token));
        this.token = token;
        this.expected = null;
    }

    public UnexpectedTokenException(String token, String expected) {
        super(String.format("parse error, unexpected token: '%s'. Expected token: '%s'", token, expected));
        this.token = token;
        this.expected = expected;
    }

    public String token() { return token; }

    public Optional<String> expected() { return Optional.ofNullable(expected); }
}
