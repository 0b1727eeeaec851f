package io.lendflow.model;

public enum WorkflowStage {
    APPLICATION_INTAKE("application_intake"),
    DOCUMENT_PROCESSING("document_processing"),
    UNDERWRITING("underwriting"),
    DECISION("decision"),
    POST_DECISION("post_decision");

    private final String wireName;

    WorkflowStage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
