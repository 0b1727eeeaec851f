package io.lendflow.error;

/**
 * Root of the failures raised by the workflow core. All of them are unchecked;
 * step-level failures are captured by the engine and never reach its callers.
 */
public class LendFlowException extends RuntimeException {
    public LendFlowException(String message) {
        super(message);
    }

    public LendFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
