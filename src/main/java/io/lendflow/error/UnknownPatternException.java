package io.lendflow.error;

public class UnknownPatternException extends SecurityViolationException {
    public UnknownPatternException(String message) {
        super(message);
    }

    public UnknownPatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
