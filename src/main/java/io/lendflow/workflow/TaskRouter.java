package io.lendflow.workflow;

import io.lendflow.config.EngineSettings;
import io.lendflow.model.ApplicationState;
import io.lendflow.model.MessageType;
import io.lendflow.model.Priority;
import io.lendflow.state.ApplicationStateMachine;
import io.lendflow.state.StateActionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands work to the responsible agent whenever an application enters a working
 * state. Routing needs both the orchestrator and the target agent to be registered;
 * otherwise the hand-off is skipped with a warning.
 */
public final class TaskRouter implements StateActionHandler {
    private static final Logger log = LoggerFactory.getLogger(TaskRouter.class);

    private final CollaborationManager manager;
    private final String orchestratorId;
    private final Map<ApplicationState, String> routes;

    public TaskRouter(CollaborationManager manager, EngineSettings settings) {
        this.manager = manager;
        this.orchestratorId = settings.orchestratorAgentId();
        Map<ApplicationState, String> r = new EnumMap<>(ApplicationState.class);
        r.put(ApplicationState.DOCUMENT_COLLECTION, "document_agent");
        r.put(ApplicationState.DOCUMENT_VALIDATION, "document_agent");
        r.put(ApplicationState.DOCUMENT_ANALYSIS, "document_agent");
        r.put(ApplicationState.UNDERWRITING, "underwriting_agent");
        r.put(ApplicationState.COMPLIANCE_CHECK, "compliance_agent");
        r.put(ApplicationState.DECISION_PENDING, orchestratorId);
        this.routes = Collections.unmodifiableMap(r);
    }

    /**
     * Registers this router on every routed state of the machine.
     */
    public void attachTo(ApplicationStateMachine stateMachine) {
        for (ApplicationState state : routes.keySet()) {
            stateMachine.registerHandler(state, this);
        }
    }

    public Map<ApplicationState, String> routes() {
        return routes;
    }

    @Override
    public void onEnter(String applicationId, ApplicationState from, ApplicationState to, String reason) {
        String target = routes.get(to);
        if (target == null) {
            return;
        }
        if (!manager.isAgentRegistered(orchestratorId) || !manager.isAgentRegistered(target)) {
            log.warn("Skipping {} task for application {}: agent {} or {} not registered",
                    to.wireName(), applicationId, orchestratorId, target);
            return;
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("task_type", to.wireName());
        content.put("application_id", applicationId);
        content.put("previous_state", from == null ? null : from.wireName());
        content.put("reason", reason);
        String messageId = manager.sendMessage(orchestratorId, target, MessageType.REQUEST, content,
                null, null, Priority.MEDIUM);
        log.debug("Routed {} task for application {} to {} ({})", to.wireName(), applicationId, target, messageId);
    }
}
