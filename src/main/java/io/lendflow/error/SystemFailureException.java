package io.lendflow.error;

public class SystemFailureException extends LendFlowException {
    public SystemFailureException(String message) {
        super(message);
    }

    public SystemFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
