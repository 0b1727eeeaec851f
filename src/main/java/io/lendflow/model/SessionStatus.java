package io.lendflow.model;

public enum SessionStatus {
    INITIALIZED("initialized"),
    STEP_IN_PROGRESS("step_in_progress"),
    WAITING_FOR_EVENT("waiting_for_event"),
    AWAITING_CONFIRMATION("awaiting_confirmation"),
    RETRYING_STEP("retrying_step"),
    AWAITING_ORCHESTRATOR_INSTRUCTION("awaiting_orchestrator_instruction"),
    AWAITING_HUMAN_INTERVENTION("awaiting_human_intervention"),
    ABORTED("aborted"),
    COMPLETED("completed");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean terminal() {
        return this == ABORTED || this == COMPLETED;
    }

    public boolean awaitingInstruction() {
        return this == AWAITING_ORCHESTRATOR_INSTRUCTION || this == AWAITING_HUMAN_INTERVENTION;
    }
}
