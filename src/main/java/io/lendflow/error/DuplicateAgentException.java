package io.lendflow.error;

public class DuplicateAgentException extends LendFlowException {
    public DuplicateAgentException(String message) {
        super(message);
    }

    public DuplicateAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
