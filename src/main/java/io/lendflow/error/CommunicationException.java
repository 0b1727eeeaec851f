package io.lendflow.error;

public class CommunicationException extends LendFlowException {
    public CommunicationException(String message) {
        super(message);
    }

    public CommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
