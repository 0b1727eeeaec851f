package io.lendflow.error;

/**
 * An agent failed to execute a step: it threw, returned an error result or
 * returned something the engine could not interpret.
 */
public class AgentFailureException extends LendFlowException {
    public AgentFailureException(String message) {
        super(message);
    }

    public AgentFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
