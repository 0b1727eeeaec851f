package io.lendflow.pattern;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record CollaborationPattern(
        String name,
        String description,
        String initiator,
        Set<String> agents,
        List<StepDefinition> steps,
        Map<String, ErrorPolicy> errorHandling
) {
    public CollaborationPattern {
        agents = agents == null ? Set.of() : Set.copyOf(agents);
        steps = steps == null ? List.of() : List.copyOf(steps);
        errorHandling = errorHandling == null ? Map.of() : Map.copyOf(errorHandling);
    }

    public int stepCount() {
        return steps.size();
    }

    public StepDefinition step(int index) {
        return steps.get(index);
    }

    public Optional<ErrorPolicy> policyFor(String stepName) {
        return Optional.ofNullable(errorHandling.get(stepName));
    }
}
