package io.lendflow.model;

public enum ApplicationState {
    INITIATED("initiated", WorkflowStage.APPLICATION_INTAKE),
    DOCUMENT_COLLECTION("document_collection", WorkflowStage.DOCUMENT_PROCESSING),
    DOCUMENT_VALIDATION("document_validation", WorkflowStage.DOCUMENT_PROCESSING),
    DOCUMENT_ANALYSIS("document_analysis", WorkflowStage.DOCUMENT_PROCESSING),
    UNDERWRITING("underwriting", WorkflowStage.UNDERWRITING),
    COMPLIANCE_CHECK("compliance_check", WorkflowStage.UNDERWRITING),
    DECISION_PENDING("decision_pending", WorkflowStage.DECISION),
    APPROVED("approved", WorkflowStage.DECISION),
    CONDITIONALLY_APPROVED("conditionally_approved", WorkflowStage.DECISION),
    DECLINED("declined", WorkflowStage.DECISION),
    SUSPENDED("suspended", WorkflowStage.DECISION),
    COMPLETED("completed", WorkflowStage.POST_DECISION);

    private final String wireName;
    private final WorkflowStage stage;

    ApplicationState(String wireName, WorkflowStage stage) {
        this.wireName = wireName;
        this.stage = stage;
    }

    public String wireName() {
        return wireName;
    }

    public WorkflowStage stage() {
        return stage;
    }

    public static ApplicationState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Application state must not be blank");
        }
        for (ApplicationState value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown application state: " + raw);
    }
}
