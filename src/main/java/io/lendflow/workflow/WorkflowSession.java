package io.lendflow.workflow;

import io.lendflow.model.AgentMessage;
import io.lendflow.model.SessionStatus;
import io.lendflow.pattern.CollaborationPattern;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one running pattern. Mutation happens only while {@link #lock()}
 * is held; readers get copies.
 */
final class WorkflowSession {
    private final String sessionId;
    private final CollaborationPattern pattern;
    private final String initiator;
    private final String applicationId;
    private final Instant startTime;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Object> context;
    private final List<StepExecution> completedSteps = new CopyOnWriteArrayList<>();
    private final List<StepExecution> failedSteps = new CopyOnWriteArrayList<>();
    private final List<AgentMessage> messages = new CopyOnWriteArrayList<>();
    private final List<String> errorIds = new CopyOnWriteArrayList<>();
    private final Map<Integer, Map<String, Object>> checkpoints = new HashMap<>();
    private final Map<String, Integer> retriesGranted = new HashMap<>();

    private volatile SessionStatus status = SessionStatus.INITIALIZED;
    private volatile int currentStepIndex;
    private volatile Instant endTime;
    private long executionSequence;
    private boolean eventDelivered;
    private String agentOverride;

    WorkflowSession(
            String sessionId,
            CollaborationPattern pattern,
            String initiator,
            String applicationId,
            Map<String, Object> initialContext,
            Instant startTime
    ) {
        this.sessionId = sessionId;
        this.pattern = pattern;
        this.initiator = initiator;
        this.applicationId = applicationId;
        this.startTime = startTime;
        this.context = Collections.synchronizedMap(new LinkedHashMap<>());
        if (initialContext != null) {
            this.context.putAll(initialContext);
        }
    }

    String sessionId() {
        return sessionId;
    }

    CollaborationPattern pattern() {
        return pattern;
    }

    String initiator() {
        return initiator;
    }

    String applicationId() {
        return applicationId;
    }

    Instant startTime() {
        return startTime;
    }

    Instant endTime() {
        return endTime;
    }

    ReentrantLock lock() {
        return lock;
    }

    SessionStatus status() {
        return status;
    }

    void status(SessionStatus next) {
        this.status = next;
    }

    /**
     * True while the drive loop may keep executing steps.
     */
    boolean runnable() {
        return status == SessionStatus.INITIALIZED
                || status == SessionStatus.STEP_IN_PROGRESS
                || status == SessionStatus.RETRYING_STEP;
    }

    int currentStepIndex() {
        return currentStepIndex;
    }

    void advance() {
        currentStepIndex++;
        eventDelivered = false;
        agentOverride = null;
    }

    /**
     * Moves the cursor back to {@code index} and restores the context captured right
     * before that step last ran.
     */
    void rewindTo(int index) {
        Map<String, Object> snapshot = checkpoints.get(index);
        if (snapshot != null) {
            synchronized (context) {
                context.clear();
                context.putAll(snapshot);
            }
        }
        currentStepIndex = index;
        eventDelivered = false;
        agentOverride = null;
    }

    void finish(SessionStatus terminal, Instant at) {
        this.status = terminal;
        this.endTime = at;
    }

    Map<String, Object> context() {
        return context;
    }

    Map<String, Object> contextSnapshot() {
        synchronized (context) {
            return new LinkedHashMap<>(context);
        }
    }

    void checkpoint(int index) {
        checkpoints.put(index, contextSnapshot());
    }

    long nextExecutionId() {
        return ++executionSequence;
    }

    int retriesGranted(String stepName) {
        return retriesGranted.getOrDefault(stepName, 0);
    }

    void grantRetry(String stepName) {
        retriesGranted.merge(stepName, 1, Integer::sum);
    }

    boolean eventDelivered() {
        return eventDelivered;
    }

    void markEventDelivered() {
        this.eventDelivered = true;
    }

    String agentOverride() {
        return agentOverride;
    }

    void agentOverride(String agentId) {
        this.agentOverride = agentId;
    }

    void recordCompleted(StepExecution execution) {
        completedSteps.add(execution);
    }

    void recordFailed(StepExecution execution) {
        failedSteps.add(execution);
    }

    void recordMessage(AgentMessage message) {
        messages.add(message);
    }

    void recordError(String errorId) {
        errorIds.add(errorId);
    }

    List<StepExecution> completedSteps() {
        return List.copyOf(completedSteps);
    }

    List<StepExecution> failedSteps() {
        return List.copyOf(failedSteps);
    }

    /**
     * Completed, skipped and failed executions ordered by execution id.
     */
    List<StepExecution> executions() {
        List<StepExecution> all = new ArrayList<>(completedSteps);
        all.addAll(failedSteps);
        all.sort((a, b) -> Long.compare(a.executionId(), b.executionId()));
        return all;
    }

    List<AgentMessage> messages() {
        return List.copyOf(messages);
    }

    List<String> errorIds() {
        return List.copyOf(errorIds);
    }
}
