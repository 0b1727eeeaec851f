package io.lendflow.error;

public class WorkflowException extends LendFlowException {
    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
