package io.lendflow.state;

import io.lendflow.model.ApplicationState;

@FunctionalInterface
public interface StateActionHandler {
    void onEnter(String applicationId, ApplicationState from, ApplicationState to, String reason) throws Exception;
}
