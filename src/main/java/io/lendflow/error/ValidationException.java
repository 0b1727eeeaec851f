package io.lendflow.error;

public class ValidationException extends LendFlowException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
