package io.lendflow.pattern;

import io.lendflow.pattern.condition.Expression;

import java.util.List;

public record StepDefinition(
        String name,
        String agent,
        String description,
        List<String> inputs,
        List<String> outputs,
        boolean required,
        int timeoutSeconds,
        int retryCount,
        boolean requiresConfirmation,
        boolean eventTriggered,
        String triggerEvent,
        String conditionSource,
        Expression condition
) {
    public StepDefinition {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public boolean hasCondition() {
        return condition != null;
    }
}
