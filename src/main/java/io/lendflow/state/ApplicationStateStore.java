package io.lendflow.state;

import io.lendflow.model.ApplicationState;

import java.util.List;
import java.util.Optional;

public interface ApplicationStateStore {
    /**
     * Creates the application with its first history entry; false if it already exists.
     */
    boolean create(String applicationId, StateTransition initial);

    Optional<ApplicationState> currentState(String applicationId);

    void recordTransition(String applicationId, StateTransition transition);

    List<StateTransition> history(String applicationId);

    List<String> applicationsIn(ApplicationState state);
}
