package io.lendflow.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record StepResult(
        boolean success,
        Map<String, Object> output,
        String error
) {
    public StepResult {
        output = output == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(output));
    }

    public static StepResult ok(Map<String, Object> output) {
        return new StepResult(true, output, null);
    }

    public static StepResult fail(String error) {
        return new StepResult(false, Map.of(), error);
    }
}
