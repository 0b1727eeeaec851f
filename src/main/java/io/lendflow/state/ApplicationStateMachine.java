package io.lendflow.state;

import io.lendflow.error.WorkflowException;
import io.lendflow.model.ApplicationState;
import io.lendflow.model.WorkflowStage;
import io.lendflow.observability.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Lifecycle of mortgage applications over a fixed transition graph. Rejected
 * transitions are logged and reported as {@code false}; the current state is left
 * untouched.
 */
public final class ApplicationStateMachine {
    private static final Logger log = LoggerFactory.getLogger(ApplicationStateMachine.class);
    private static final Map<ApplicationState, Set<ApplicationState>> TRANSITIONS = buildTransitions();

    private final ApplicationStateStore store;
    private final AuditLog auditLog;
    private final Clock clock;
    private final Map<ApplicationState, List<StateActionHandler>> handlers = new EnumMap<>(ApplicationState.class);
    private final Map<String, Object> applicationLocks = new ConcurrentHashMap<>();

    public ApplicationStateMachine(ApplicationStateStore store, AuditLog auditLog, Clock clock) {
        this.store = store;
        this.auditLog = auditLog;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        for (ApplicationState state : ApplicationState.values()) {
            handlers.put(state, new CopyOnWriteArrayList<>());
        }
    }

    private static Map<ApplicationState, Set<ApplicationState>> buildTransitions() {
        Map<ApplicationState, Set<ApplicationState>> t = new EnumMap<>(ApplicationState.class);
        t.put(ApplicationState.INITIATED, EnumSet.of(ApplicationState.DOCUMENT_COLLECTION));
        t.put(ApplicationState.DOCUMENT_COLLECTION, EnumSet.of(ApplicationState.DOCUMENT_VALIDATION));
        t.put(ApplicationState.DOCUMENT_VALIDATION,
                EnumSet.of(ApplicationState.DOCUMENT_COLLECTION, ApplicationState.DOCUMENT_ANALYSIS));
        t.put(ApplicationState.DOCUMENT_ANALYSIS,
                EnumSet.of(ApplicationState.DOCUMENT_VALIDATION, ApplicationState.UNDERWRITING));
        t.put(ApplicationState.UNDERWRITING, EnumSet.of(ApplicationState.COMPLIANCE_CHECK));
        t.put(ApplicationState.COMPLIANCE_CHECK,
                EnumSet.of(ApplicationState.UNDERWRITING, ApplicationState.DECISION_PENDING));
        t.put(ApplicationState.DECISION_PENDING, EnumSet.of(
                ApplicationState.APPROVED,
                ApplicationState.CONDITIONALLY_APPROVED,
                ApplicationState.DECLINED,
                ApplicationState.SUSPENDED
        ));
        t.put(ApplicationState.APPROVED, EnumSet.of(ApplicationState.COMPLETED));
        t.put(ApplicationState.CONDITIONALLY_APPROVED, EnumSet.of(ApplicationState.COMPLETED));
        t.put(ApplicationState.DECLINED, EnumSet.of(ApplicationState.COMPLETED));
        t.put(ApplicationState.SUSPENDED,
                EnumSet.of(ApplicationState.DOCUMENT_COLLECTION, ApplicationState.UNDERWRITING));
        t.put(ApplicationState.COMPLETED, EnumSet.noneOf(ApplicationState.class));
        return Collections.unmodifiableMap(t);
    }

    public static Set<ApplicationState> allowedTransitions(ApplicationState from) {
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(from, EnumSet.noneOf(ApplicationState.class)));
    }

    public static boolean isAllowed(ApplicationState from, ApplicationState to) {
        return allowedTransitions(from).contains(to);
    }

    public static boolean isTerminal(ApplicationState state) {
        return allowedTransitions(state).isEmpty();
    }

    public void registerHandler(ApplicationState state, StateActionHandler handler) {
        handlers.get(state).add(handler);
    }

    public void createApplication(String applicationId) {
        if (applicationId == null || applicationId.isBlank()) {
            throw new IllegalArgumentException("applicationId must not be blank");
        }
        StateTransition initial = new StateTransition(null, ApplicationState.INITIATED, "application created", Instant.now(clock));
        if (!store.create(applicationId, initial)) {
            throw new IllegalArgumentException("Application already exists: " + applicationId);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("state", ApplicationState.INITIATED.wireName());
        auditLog.logEvent(AuditLog.STATE_TRANSITION, null, null, "application_created", applicationId, details, true);
        log.info("Created application {} in state {}", applicationId, ApplicationState.INITIATED.wireName());
    }

    public boolean exists(String applicationId) {
        return store.currentState(applicationId).isPresent();
    }

    /**
     * Moves the application to {@code newState} when the edge is registered, then runs
     * the handlers bound to the new state. Handler failures are logged and do not undo
     * the transition.
     */
    public boolean transition(String applicationId, ApplicationState newState, String reason) {
        if (newState == null) {
            throw new IllegalArgumentException("newState must not be null");
        }
        ApplicationState from;
        Object lock = applicationLocks.computeIfAbsent(applicationId, k -> new Object());
        synchronized (lock) {
            try {
                from = requireState(applicationId);
            } catch (WorkflowException e) {
                log.warn("Rejected transition to {}: {}", newState.wireName(), e.getMessage());
                return false;
            }
            if (!isAllowed(from, newState)) {
                log.warn("Rejected transition of application {} from {} to {}",
                        applicationId, from.wireName(), newState.wireName());
                return false;
            }
            String safeReason = reason == null ? "" : reason;
            store.recordTransition(applicationId, new StateTransition(from, newState, safeReason, Instant.now(clock)));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("from_state", from.wireName());
            details.put("to_state", newState.wireName());
            details.put("reason", safeReason);
            auditLog.logEvent(AuditLog.STATE_TRANSITION, null, null, "transition", applicationId, details, true);
        }
        log.info("Application {} moved {} -> {} ({})", applicationId, from.wireName(), newState.wireName(), reason);
        runHandlers(applicationId, from, newState, reason);
        return true;
    }

    /**
     * Steps back to the state held before the latest transition, when the graph allows
     * that edge.
     */
    public boolean revertToPrevious(String applicationId, String reason) {
        List<StateTransition> history = store.history(applicationId);
        if (history.isEmpty()) {
            log.warn("Cannot revert unknown application {}", applicationId);
            return false;
        }
        ApplicationState previous = history.get(history.size() - 1).from();
        if (previous == null) {
            log.warn("Application {} has no previous state to revert to", applicationId);
            return false;
        }
        return transition(applicationId, previous, reason == null ? "revert" : reason);
    }

    public Optional<ApplicationState> currentState(String applicationId) {
        return store.currentState(applicationId);
    }

    public List<StateTransition> history(String applicationId) {
        return store.history(applicationId);
    }

    public List<String> applicationsInState(ApplicationState state) {
        return store.applicationsIn(state);
    }

    public Optional<WorkflowStage> stageOf(String applicationId) {
        return store.currentState(applicationId).map(ApplicationState::stage);
    }

    private ApplicationState requireState(String applicationId) {
        return store.currentState(applicationId)
                .orElseThrow(() -> new WorkflowException("Unknown application: " + applicationId));
    }

    private void runHandlers(String applicationId, ApplicationState from, ApplicationState to, String reason) {
        for (StateActionHandler handler : handlers.get(to)) {
            try {
                handler.onEnter(applicationId, from, to, reason);
            } catch (Exception e) {
                log.error("State handler failed for application {} entering {}", applicationId, to.wireName(), e);
            }
        }
    }
}
