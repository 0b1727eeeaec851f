package io.lendflow.error;

public class DocumentProcessingException extends LendFlowException {
    public DocumentProcessingException(String message) {
        super(message);
    }

    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
