package net.littleredcomputer.logic;

/**
 * Raised when formula text is malformed.
 */
public class LogicParseException extends IllegalArgumentException {
    public LogicParseException(String message) {
        super(message);
    }
}
