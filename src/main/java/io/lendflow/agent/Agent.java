package io.lendflow.agent;

import io.lendflow.model.AgentMessage;

import java.util.Map;
import java.util.Set;

public interface Agent {
    StepResult executeStep(String stepName, Map<String, Object> inputs) throws Exception;

    void receiveMessage(AgentMessage message) throws Exception;

    default boolean canHandleStep(String stepName) {
        return capabilities().contains(stepName);
    }

    Set<String> capabilities();
}
