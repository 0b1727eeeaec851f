package io.lendflow.error;

public class AgentTimeoutException extends AgentFailureException {
    public AgentTimeoutException(String message) {
        super(message);
    }

    public AgentTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
