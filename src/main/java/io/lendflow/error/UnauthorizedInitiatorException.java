package io.lendflow.error;

public class UnauthorizedInitiatorException extends SecurityViolationException {
    public UnauthorizedInitiatorException(String message) {
        super(message);
    }

    public UnauthorizedInitiatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
