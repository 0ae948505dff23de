package net.littleredcomputer.logic;

/**
 * Raised when something that cannot be a function is given arguments, e.g. {@code x(y)}
 * where {@code x} is an individual variable.
 */
public class TypeMisuseException extends LogicParseException {
    public TypeMisuseException(String message) {
        super(message);
    }
}
