package io.lendflow.error;

public class DataIntegrityException extends LendFlowException {
    public DataIntegrityException(String message) {
        super(message);
    }

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
