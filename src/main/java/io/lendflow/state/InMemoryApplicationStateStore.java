package io.lendflow.state;

import io.lendflow.error.WorkflowException;
import io.lendflow.model.ApplicationState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryApplicationStateStore implements ApplicationStateStore {
    private final Map<String, List<StateTransition>> histories = new LinkedHashMap<>();

    @Override
    public synchronized boolean create(String applicationId, StateTransition initial) {
        if (histories.containsKey(applicationId)) {
            return false;
        }
        List<StateTransition> history = new ArrayList<>();
        history.add(initial);
        histories.put(applicationId, history);
        return true;
    }

    @Override
    public synchronized Optional<ApplicationState> currentState(String applicationId) {
        List<StateTransition> history = histories.get(applicationId);
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(history.get(history.size() - 1).to());
    }

    @Override
    public synchronized void recordTransition(String applicationId, StateTransition transition) {
        List<StateTransition> history = histories.get(applicationId);
        if (history == null) {
            throw new WorkflowException("Unknown application: " + applicationId);
        }
        history.add(transition);
    }

    @Override
    public synchronized List<StateTransition> history(String applicationId) {
        List<StateTransition> history = histories.get(applicationId);
        return history == null ? List.of() : List.copyOf(history);
    }

    @Override
    public synchronized List<String> applicationsIn(ApplicationState state) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, List<StateTransition>> entry : histories.entrySet()) {
            List<StateTransition> history = entry.getValue();
            if (!history.isEmpty() && history.get(history.size() - 1).to() == state) {
                out.add(entry.getKey());
            }
        }
        return out;
    }
}
