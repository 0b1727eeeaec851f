package io.lendflow.error;

public class SecurityViolationException extends LendFlowException {
    public SecurityViolationException(String message) {
        super(message);
    }

    public SecurityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
