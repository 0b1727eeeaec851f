package io.lendflow.error;

public class IntegrationException extends LendFlowException {
    public IntegrationException(String message) {
        super(message);
    }

    public IntegrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
