package io.lendflow.workflow;

import io.lendflow.agent.Agent;
import io.lendflow.agent.AgentRegistry;
import io.lendflow.agent.StepResult;
import io.lendflow.config.EngineSettings;
import io.lendflow.error.AgentFailureException;
import io.lendflow.error.AgentTimeoutException;
import io.lendflow.error.ConfigurationException;
import io.lendflow.error.LendFlowException;
import io.lendflow.error.UnauthorizedInitiatorException;
import io.lendflow.error.UnknownPatternException;
import io.lendflow.error.ValidationException;
import io.lendflow.model.AgentMessage;
import io.lendflow.model.ApplicationState;
import io.lendflow.model.MessageType;
import io.lendflow.model.Priority;
import io.lendflow.model.SessionStatus;
import io.lendflow.model.SessionView;
import io.lendflow.observability.AuditLog;
import io.lendflow.pattern.CollaborationPattern;
import io.lendflow.pattern.ErrorPolicy;
import io.lendflow.pattern.PatternCatalog;
import io.lendflow.pattern.StepDefinition;
import io.lendflow.pattern.condition.ConditionEvaluationException;
import io.lendflow.recovery.ErrorRecord;
import io.lendflow.recovery.ErrorRecoveryManager;
import io.lendflow.recovery.RecoveryAction;
import io.lendflow.recovery.RecoveryContext;
import io.lendflow.state.ApplicationStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives workflow sessions through their collaboration pattern. Each session is
 * guarded by its own lock; steps of one session never overlap, while different
 * sessions run independently. Agent calls run on a bounded pool and are cut off at
 * the step's timeout.
 */
public final class CollaborationManager implements AutoCloseable {
    public static final String ENGINE_SENDER = "collaboration_manager";
    private static final Logger log = LoggerFactory.getLogger(CollaborationManager.class);

    private final PatternCatalog catalog;
    private final AgentRegistry registry;
    private final ErrorRecoveryManager recovery;
    private final ApplicationStateMachine stateMachine;
    private final AuditLog auditLog;
    private final EngineSettings settings;
    private final Clock clock;
    private final ExecutorService agentExecutor;
    private final Map<String, WorkflowSession> activeSessions = new ConcurrentHashMap<>();
    private final Map<String, WorkflowSession> finishedSessions = new ConcurrentHashMap<>();
    private final Map<String, FallbackHandler> fallbacks = new ConcurrentHashMap<>();

    public CollaborationManager(
            PatternCatalog catalog,
            AgentRegistry registry,
            ErrorRecoveryManager recovery,
            ApplicationStateMachine stateMachine,
            AuditLog auditLog,
            EngineSettings settings,
            Clock clock
    ) {
        this.catalog = catalog;
        this.registry = registry;
        this.recovery = recovery;
        this.stateMachine = stateMachine;
        this.auditLog = auditLog;
        this.settings = settings == null ? EngineSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        AtomicInteger workerSeq = new AtomicInteger();
        this.agentExecutor = Executors.newFixedThreadPool(this.settings.agentPoolSize(), r -> {
            Thread t = new Thread(r, "agent-worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        fallbacks.put(ErrorPolicy.ABORT_WORKFLOW, r -> FallbackOutcome.ABORT);
        fallbacks.put(ErrorPolicy.SKIP_STEP, r -> FallbackOutcome.ADVANCE);
        fallbacks.put(ErrorPolicy.MANUAL_INTERVENTION, r -> FallbackOutcome.AWAIT_HUMAN);
        fallbacks.put(ErrorPolicy.CONSERVATIVE_ASSESSMENT, new ConservativeAssessment());
    }

    public void registerAgent(String agentId, Agent agent) {
        registry.register(agentId, agent);
        if (catalog.capabilitiesOf(agentId).isEmpty()) {
            log.warn("Agent {} registered without declared capabilities in the pattern catalog", agentId);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("capabilities", List.copyOf(agent.capabilities()));
        auditLog.logAgentAction(agentId, "register_agent", agentId, details, true);
        log.info("Registered agent {}", agentId);
    }

    public boolean isAgentRegistered(String agentId) {
        return registry.isRegistered(agentId);
    }

    /**
     * Adds a named fallback that patterns may reference. Built-in names cannot be
     * replaced.
     */
    public void registerFallback(String name, FallbackHandler handler) {
        if (name == null || name.isBlank() || handler == null) {
            throw new IllegalArgumentException("fallback name and handler are required");
        }
        if (ErrorPolicy.ABORT_WORKFLOW.equals(name) || ErrorPolicy.SKIP_STEP.equals(name)
                || ErrorPolicy.MANUAL_INTERVENTION.equals(name) || ErrorPolicy.CONSERVATIVE_ASSESSMENT.equals(name)) {
            throw new IllegalArgumentException("Cannot replace built-in fallback: " + name);
        }
        fallbacks.put(name, handler);
    }

    public String createSession(String patternName, Map<String, Object> initialContext, String initiator) {
        CollaborationPattern pattern = catalog.find(patternName)
                .orElseThrow(() -> new UnknownPatternException("Unknown collaboration pattern: " + patternName));
        if (initiator == null || !initiator.equals(pattern.initiator())) {
            auditLog.logSecurityEvent("unauthorized_initiator", null, initiator, patternName,
                    Map.of("expected_initiator", pattern.initiator()), false);
            throw new UnauthorizedInitiatorException(
                    "Agent " + initiator + " is not authorized to initiate pattern " + patternName);
        }
        List<String> missing = new ArrayList<>();
        for (StepDefinition step : pattern.steps()) {
            if (!registry.isRegistered(step.agent()) && !missing.contains(step.agent())) {
                missing.add(step.agent());
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Pattern " + patternName + " uses unregistered agent(s): " + missing);
        }

        String sessionId = "ses_" + UUID.randomUUID();
        Object appId = initialContext == null ? null : initialContext.get("application_id");
        String applicationId = appId == null || appId.toString().isBlank() ? sessionId : appId.toString();
        WorkflowSession session = new WorkflowSession(
                sessionId, pattern, initiator, applicationId, initialContext, Instant.now(clock));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pattern", patternName);
        details.put("application_id", applicationId);
        details.put("steps", pattern.stepCount());
        auditLog.logEvent(AuditLog.WORKFLOW_SESSION, null, initiator, "create", sessionId, details, true);
        log.info("Created session {} for pattern {} (application {})", sessionId, patternName, applicationId);

        session.lock().lock();
        try {
            activeSessions.put(sessionId, session);
            drive(session);
        } finally {
            session.lock().unlock();
        }
        return sessionId;
    }

    public boolean confirmStep(String sessionId, boolean confirmed) {
        WorkflowSession session = activeSessions.get(sessionId);
        if (session == null) {
            log.warn("Cannot confirm step: session {} is not active", sessionId);
            return false;
        }
        session.lock().lock();
        try {
            if (session.status() != SessionStatus.AWAITING_CONFIRMATION) {
                log.warn("Session {} is not awaiting confirmation (status {})", sessionId, session.status().wireName());
                return false;
            }
            StepDefinition step = currentStep(session);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step", step.name());
            details.put("confirmed", confirmed);
            auditLog.logEvent(AuditLog.WORKFLOW_SESSION, null, null, "confirm_step", sessionId, details, confirmed);
            if (confirmed) {
                session.advance();
                session.status(SessionStatus.STEP_IN_PROGRESS);
            } else {
                log.info("Step {} rejected during confirmation in session {}", step.name(), sessionId);
                handleFailure(session, step, lastCompletedExecutionId(session, step),
                        new ValidationException("Step rejected during confirmation"));
            }
            drive(session);
            return true;
        } finally {
            session.lock().unlock();
        }
    }

    public boolean resume(String sessionId, String action, Map<String, Object> data) {
        return resume(sessionId, ResumeAction.fromString(action), data);
    }

    public boolean resume(String sessionId, ResumeAction action, Map<String, Object> data) {
        WorkflowSession session = activeSessions.get(sessionId);
        if (session == null) {
            log.warn("Cannot resume: session {} is not active", sessionId);
            return false;
        }
        session.lock().lock();
        try {
            if (!session.status().awaitingInstruction()) {
                log.warn("Session {} is not waiting for instructions (status {})", sessionId, session.status().wireName());
                return false;
            }
            if (data != null && !data.isEmpty()) {
                session.context().putAll(data);
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("action", action.name().toLowerCase(Locale.ROOT));
            details.put("step_index", session.currentStepIndex());
            auditLog.logEvent(AuditLog.WORKFLOW_SESSION, null, null, "resume", sessionId, details, true);
            switch (action) {
                case CONTINUE -> {
                    session.advance();
                    session.status(SessionStatus.STEP_IN_PROGRESS);
                }
                case SKIP -> skipCurrentStep(session, "skipped on resume");
                case RETRY -> session.status(SessionStatus.RETRYING_STEP);
                case ABORT -> abort(session, "aborted on instruction");
            }
            drive(session);
            return true;
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Resumes every session waiting on {@code eventType} and returns how many were
     * resumed.
     */
    public int handleEvent(String eventType, Map<String, Object> eventData) {
        int resumed = 0;
        for (WorkflowSession session : List.copyOf(activeSessions.values())) {
            if (session.status() != SessionStatus.WAITING_FOR_EVENT) {
                continue;
            }
            session.lock().lock();
            try {
                if (session.status() != SessionStatus.WAITING_FOR_EVENT) {
                    continue;
                }
                StepDefinition step = currentStep(session);
                if (!step.eventTriggered() || !step.triggerEvent().equals(eventType)) {
                    continue;
                }
                if (eventData != null) {
                    session.context().putAll(eventData);
                }
                session.markEventDelivered();
                session.status(SessionStatus.STEP_IN_PROGRESS);
                auditLog.logEvent(AuditLog.WORKFLOW_SESSION, null, null, "event_received", session.sessionId(),
                        Map.of("event_type", eventType, "step", step.name()), true);
                log.info("Event {} triggers step {} in session {}", eventType, step.name(), session.sessionId());
                drive(session);
                resumed++;
            } finally {
                session.lock().unlock();
            }
        }
        return resumed;
    }

    public String sendMessage(String sender, String recipient, MessageType type, Map<String, Object> content) {
        return sendMessage(sender, recipient, type, content, null, null, Priority.MEDIUM);
    }

    /**
     * Validates and queues a message for the recipient, returning its id without
     * waiting for the recipient to process it. Delivery failures are logged only.
     */
    public String sendMessage(
            String sender,
            String recipient,
            MessageType type,
            Map<String, Object> content,
            String sessionId,
            String inResponseTo,
            Priority priority
    ) {
        if (!registry.isRegistered(sender)) {
            throw new IllegalArgumentException("Unknown sender agent: " + sender);
        }
        if (!registry.isRegistered(recipient)) {
            throw new IllegalArgumentException("Unknown recipient agent: " + recipient);
        }
        if (type == null || !catalog.allowsMessageType(type)) {
            throw new IllegalArgumentException("Message type not allowed: " + type);
        }
        AgentMessage message = new AgentMessage(
                "msg_" + UUID.randomUUID(),
                sender,
                recipient,
                Instant.now(clock),
                type,
                content,
                sessionId,
                inResponseTo,
                priority
        );
        deliver(message);
        return message.messageId();
    }

    public Optional<SessionView> sessionStatus(String sessionId) {
        return findSession(sessionId).map(this::view);
    }

    public List<String> activeSessionIds() {
        return List.copyOf(activeSessions.keySet());
    }

    public List<String> finishedSessionIds() {
        return List.copyOf(finishedSessions.keySet());
    }

    public Optional<Map<String, Object>> sessionContext(String sessionId) {
        return findSession(sessionId).map(WorkflowSession::contextSnapshot);
    }

    public List<AgentMessage> sessionMessages(String sessionId) {
        return findSession(sessionId).map(WorkflowSession::messages).orElse(List.of());
    }

    public List<StepExecution> stepExecutions(String sessionId) {
        return findSession(sessionId).map(WorkflowSession::executions).orElse(List.of());
    }

    public List<ErrorRecord> sessionErrors(String sessionId) {
        Optional<WorkflowSession> session = findSession(sessionId);
        if (session.isEmpty()) {
            return List.of();
        }
        List<ErrorRecord> out = new ArrayList<>();
        for (String errorId : session.get().errorIds()) {
            recovery.findError(session.get().applicationId(), errorId).ifPresent(out::add);
        }
        return out;
    }

    private Optional<WorkflowSession> findSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        WorkflowSession session = activeSessions.get(sessionId);
        return Optional.ofNullable(session != null ? session : finishedSessions.get(sessionId));
    }

    private void drive(WorkflowSession session) {
        CollaborationPattern pattern = session.pattern();
        while (session.runnable()) {
            int index = session.currentStepIndex();
            if (index >= pattern.stepCount()) {
                complete(session);
                return;
            }
            StepDefinition step = pattern.step(index);
            if (step.hasCondition() && !step.required() && !conditionHolds(session, step)) {
                log.info("Skipping step {} in session {}: condition not met", step.name(), session.sessionId());
                skipCurrentStep(session, "condition not met");
                continue;
            }
            if (step.eventTriggered() && !session.eventDelivered()) {
                session.status(SessionStatus.WAITING_FOR_EVENT);
                log.info("Step {} in session {} waits for event {}", step.name(), session.sessionId(), step.triggerEvent());
                return;
            }
            runStep(session, step);
        }
    }

    private boolean conditionHolds(WorkflowSession session, StepDefinition step) {
        try {
            return step.condition().test(session.contextSnapshot());
        } catch (ConditionEvaluationException e) {
            log.error("Error evaluating condition '{}' of step {}: {}", step.conditionSource(), step.name(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected failure evaluating condition '{}' of step {}", step.conditionSource(), step.name(), e);
            return false;
        }
    }

    private void runStep(WorkflowSession session, StepDefinition step) {
        int index = session.currentStepIndex();
        String agentId = session.agentOverride() != null ? session.agentOverride() : step.agent();
        Map<String, Object> inputs = new LinkedHashMap<>();
        Map<String, Object> context = session.contextSnapshot();
        for (String key : step.inputs()) {
            if (context.containsKey(key)) {
                inputs.put(key, context.get(key));
            } else {
                log.warn("Input {} not found in context for step {} of session {}", key, step.name(), session.sessionId());
            }
        }
        session.checkpoint(index);
        session.status(SessionStatus.STEP_IN_PROGRESS);
        long executionId = session.nextExecutionId();
        int attempt = session.retriesGranted(step.name()) + 1;
        Instant start = Instant.now(clock);

        Map<String, Object> output;
        try {
            output = invokeAgent(agentId, step, inputs);
        } catch (ConfigurationException e) {
            session.recordFailed(new StepExecution(executionId, step.name(), agentId, inputs, start,
                    Instant.now(clock), attempt, StepExecution.Status.FAILED, e.getMessage()));
            ErrorRecord record = recovery.handleError(session.applicationId(), e, failureContext(session, step, agentId, executionId, attempt));
            session.recordError(record.errorId());
            abort(session, e.getMessage());
            return;
        } catch (LendFlowException e) {
            StepExecution failed = new StepExecution(executionId, step.name(), agentId, inputs, start,
                    Instant.now(clock), attempt, StepExecution.Status.FAILED, e.getMessage());
            session.recordFailed(failed);
            Map<String, Object> details = executionDetails(session, failed);
            details.put("error", e.getMessage());
            auditLog.logAgentAction(agentId, "execute_step", session.sessionId(), details, false);
            log.warn("Step {} failed in session {} (attempt {}): {}", step.name(), session.sessionId(), attempt, e.getMessage());
            handleFailure(session, step, executionId, e);
            return;
        }

        List<String> merged = new ArrayList<>();
        for (String key : step.outputs()) {
            if (output.containsKey(key)) {
                session.context().put(key, output.get(key));
                merged.add(key);
            }
        }
        StepExecution completed = new StepExecution(executionId, step.name(), agentId, inputs, start,
                Instant.now(clock), attempt, StepExecution.Status.COMPLETED, null);
        session.recordCompleted(completed);
        Map<String, Object> details = executionDetails(session, completed);
        details.put("outputs", merged);
        auditLog.logAgentAction(agentId, "execute_step", session.sessionId(), details, true);

        if (step.requiresConfirmation()) {
            session.status(SessionStatus.AWAITING_CONFIRMATION);
            log.info("Step {} in session {} awaits confirmation", step.name(), session.sessionId());
            return;
        }
        session.advance();
    }

    private Map<String, Object> invokeAgent(String agentId, StepDefinition step, Map<String, Object> inputs) {
        Agent agent = registry.findById(agentId)
                .orElseThrow(() -> new ConfigurationException("Agent " + agentId + " is not registered"));
        Future<StepResult> future = agentExecutor.submit(() -> agent.executeStep(step.name(), inputs));
        StepResult result;
        try {
            result = future.get(step.timeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AgentTimeoutException(
                    "Agent " + agentId + " timed out after " + step.timeoutSeconds() + "s on step " + step.name(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AgentFailureException("Interrupted while waiting for agent " + agentId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof LendFlowException) {
                throw (LendFlowException) cause;
            }
            throw new AgentFailureException(
                    "Agent " + agentId + " failed on step " + step.name() + ": " + cause.getMessage(), cause);
        }
        if (result == null) {
            throw new AgentFailureException("Agent " + agentId + " returned no result for step " + step.name());
        }
        if (!result.success()) {
            String error = result.error() == null ? "unspecified error" : result.error();
            throw new AgentFailureException("Agent " + agentId + " reported error on step " + step.name() + ": " + error);
        }
        return result.output();
    }

    private void handleFailure(WorkflowSession session, StepDefinition step, long executionId, LendFlowException error) {
        CollaborationPattern pattern = session.pattern();
        Optional<ErrorPolicy> policy = pattern.policyFor(step.name());
        int maxRetries = policy.map(ErrorPolicy::maxRetries)
                .orElse(step.retryCount() > 0 ? step.retryCount() : settings.defaultMaxRetries());
        String fallback = policy.map(ErrorPolicy::fallback).orElse(ErrorPolicy.ABORT_WORKFLOW);
        SessionRecoveryTarget.EscalationRoute route = policy
                .filter(p -> p.onError() == ErrorPolicy.OnError.NOTIFY_HUMAN)
                .map(p -> SessionRecoveryTarget.EscalationRoute.HUMAN)
                .orElse(SessionRecoveryTarget.EscalationRoute.ORCHESTRATOR);
        List<RecoveryAction> plan = policy.map(p -> switch (p.onError()) {
            case RETRY -> List.of(RecoveryAction.RETRY);
            case NOTIFY_ORCHESTRATOR, NOTIFY_HUMAN -> List.of(RecoveryAction.ESCALATE, RecoveryAction.FALLBACK);
        }).orElse(List.of());

        SessionRecoveryTarget target = new SessionRecoveryTarget(this, session, step, route, fallback);
        String agentId = session.agentOverride() != null ? session.agentOverride() : step.agent();
        ErrorRecord record = recovery.handleError(
                session.applicationId(),
                error,
                failureContext(session, step, agentId, executionId, session.retriesGranted(step.name()) + 1),
                null,
                null,
                new RecoveryContext(target, maxRetries, session.retriesGranted(step.name()), plan)
        );
        session.recordError(record.errorId());

        boolean settled = false;
        for (RecoveryAction action : record.plannedActions()) {
            boolean ok = recovery.executeRecovery(session.applicationId(), record.errorId(), action);
            // A diagnostic never settles the session by itself.
            if (ok && action != RecoveryAction.DIAGNOSTIC) {
                settled = true;
                break;
            }
        }
        recovery.release(record.errorId());
        if (!settled) {
            abort(session, "recovery options exhausted for step " + step.name());
        }
    }

    private static long lastCompletedExecutionId(WorkflowSession session, StepDefinition step) {
        List<StepExecution> completed = session.completedSteps();
        for (int i = completed.size() - 1; i >= 0; i--) {
            if (completed.get(i).stepName().equals(step.name())) {
                return completed.get(i).executionId();
            }
        }
        return 0L;
    }

    boolean applyFallback(WorkflowSession session, StepDefinition step, String name, ErrorRecord record) throws Exception {
        FallbackHandler handler = fallbacks.get(name);
        if (handler == null) {
            log.warn("Fallback '{}' for step {} is not registered", name, step.name());
            return false;
        }
        FallbackOutcome outcome = handler.apply(
                new FallbackRequest(session.sessionId(), session.applicationId(), step, session.context(), record));
        log.info("Fallback '{}' for step {} in session {} -> {}", name, step.name(), session.sessionId(), outcome);
        switch (outcome) {
            case ADVANCE -> skipCurrentStep(session, "fallback " + name);
            case ABORT -> abort(session, "fallback " + name);
            case AWAIT_HUMAN -> {
                notifyHuman(session, step, record);
                session.status(SessionStatus.AWAITING_HUMAN_INTERVENTION);
            }
            case FAILED -> {
                return false;
            }
        }
        return true;
    }

    Optional<String> alternateAgentFor(WorkflowSession session, StepDefinition step) {
        String current = session.agentOverride() != null ? session.agentOverride() : step.agent();
        return session.pattern().agents().stream()
                .sorted()
                .filter(id -> !id.equals(current) && !id.equals(step.agent()))
                .filter(id -> registry.findById(id).map(a -> a.canHandleStep(step.name())).orElse(false))
                .findFirst();
    }

    void recordDiagnostic(WorkflowSession session, StepDefinition step, ErrorRecord record) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_id", record.errorId());
        details.put("session_id", session.sessionId());
        details.put("step", step.name());
        details.put("agent", step.agent());
        details.put("agent_registered", registry.isRegistered(step.agent()));
        details.put("agent_capabilities", registry.findById(step.agent())
                .map(a -> List.copyOf(a.capabilities())).orElse(List.of()));
        details.put("completed_steps", session.completedSteps().size());
        details.put("failed_steps", session.failedSteps().size());
        details.put("retries_granted", session.retriesGranted(step.name()));
        auditLog.logSecurityEvent("diagnostic", null, step.agent(), session.applicationId(), details, true);
        log.info("Diagnostic for step {} in session {}: {}", step.name(), session.sessionId(), details);
    }

    boolean notifyOrchestrator(WorkflowSession session, StepDefinition step, ErrorRecord record) {
        String orchestrator = settings.orchestratorAgentId();
        if (!registry.isRegistered(orchestrator)) {
            log.error("Orchestrator agent {} not registered, cannot escalate error {}", orchestrator, record.errorId());
            return false;
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("session_id", session.sessionId());
        content.put("step_name", step.name());
        content.put("error_id", record.errorId());
        content.put("error", record.message());
        content.put("context", session.contextSnapshot());
        deliver(new AgentMessage(
                "msg_" + UUID.randomUUID(),
                ENGINE_SENDER,
                orchestrator,
                Instant.now(clock),
                MessageType.ERROR,
                content,
                session.sessionId(),
                null,
                Priority.HIGH
        ));
        return true;
    }

    void notifyHuman(WorkflowSession session, StepDefinition step, ErrorRecord record) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("session_id", session.sessionId());
        details.put("step", step.name());
        details.put("error_id", record.errorId());
        details.put("error", record.message());
        auditLog.logSecurityEvent("human_intervention_requested", null, step.agent(), session.applicationId(), details, true);
        log.warn("Human intervention required: session {} step {} failed: {}",
                session.sessionId(), step.name(), record.message());
    }

    boolean suspendApplication(WorkflowSession session, ErrorRecord record) {
        if (!stateMachine.exists(session.applicationId())) {
            log.warn("Application {} is not tracked by the state machine; cannot suspend", session.applicationId());
            return false;
        }
        return stateMachine.transition(session.applicationId(), ApplicationState.SUSPENDED,
                "suspended after error " + record.errorId());
    }

    void skipCurrentStep(WorkflowSession session, String reason) {
        int index = session.currentStepIndex();
        if (index < session.pattern().stepCount()) {
            StepDefinition step = session.pattern().step(index);
            Instant now = Instant.now(clock);
            session.recordCompleted(new StepExecution(session.nextExecutionId(), step.name(), step.agent(),
                    Map.of(), now, now, session.retriesGranted(step.name()) + 1, StepExecution.Status.SKIPPED, reason));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("step", step.name());
            details.put("reason", reason);
            auditLog.logEvent(AuditLog.WORKFLOW_SESSION, null, step.agent(), "step_skipped", session.sessionId(), details, true);
        }
        session.advance();
        session.status(SessionStatus.STEP_IN_PROGRESS);
    }

    private void complete(WorkflowSession session) {
        session.finish(SessionStatus.COMPLETED, Instant.now(clock));
        activeSessions.remove(session.sessionId());
        finishedSessions.put(session.sessionId(), session);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pattern", session.pattern().name());
        details.put("completed_steps", session.completedSteps().size());
        details.put("failed_steps", session.failedSteps().size());
        auditLog.logEvent(AuditLog.WORKFLOW_SESSION, null, null, "complete", session.sessionId(), details, true);
        log.info("Session {} completed", session.sessionId());
    }

    private void abort(WorkflowSession session, String reason) {
        session.finish(SessionStatus.ABORTED, Instant.now(clock));
        activeSessions.remove(session.sessionId());
        finishedSessions.put(session.sessionId(), session);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pattern", session.pattern().name());
        details.put("step_index", session.currentStepIndex());
        details.put("reason", reason);
        auditLog.logEvent(AuditLog.WORKFLOW_SESSION, null, null, "abort", session.sessionId(), details, false);
        log.warn("Session {} aborted: {}", session.sessionId(), reason);
    }

    private void deliver(AgentMessage message) {
        if (message.sessionId() != null) {
            findSession(message.sessionId()).ifPresent(s -> s.recordMessage(message));
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message_id", message.messageId());
        details.put("recipient", message.recipient());
        details.put("message_type", message.type().wireName());
        details.put("priority", message.priority().wireName());
        details.put("session_id", message.sessionId());
        auditLog.logEvent(AuditLog.AGENT_MESSAGE, null, message.sender(), "send_message",
                message.sessionId() == null ? message.recipient() : message.sessionId(), details, true);
        try {
            if (!registry.deliver(message)) {
                log.warn("Message {} to {} was not queued", message.messageId(), message.recipient());
            }
        } catch (RuntimeException e) {
            log.error("Failed to deliver message {} to {}", message.messageId(), message.recipient(), e);
        }
    }

    private static StepDefinition currentStep(WorkflowSession session) {
        return session.pattern().step(session.currentStepIndex());
    }

    private Map<String, Object> failureContext(
            WorkflowSession session,
            StepDefinition step,
            String agentId,
            long executionId,
            int attempt
    ) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("session_id", session.sessionId());
        ctx.put("pattern", session.pattern().name());
        ctx.put("step_name", step.name());
        ctx.put("agent_id", agentId);
        ctx.put("execution_id", executionId);
        ctx.put("attempt", attempt);
        return ctx;
    }

    private Map<String, Object> executionDetails(WorkflowSession session, StepExecution execution) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("session_id", session.sessionId());
        details.put("application_id", session.applicationId());
        details.put("step", execution.stepName());
        details.put("execution_id", execution.executionId());
        details.put("attempt", execution.attempt());
        return details;
    }

    private SessionView view(WorkflowSession session) {
        int total = session.pattern().stepCount();
        int index = session.currentStepIndex();
        List<StepExecution> completed = session.completedSteps();
        return new SessionView(
                session.sessionId(),
                session.pattern().name(),
                session.applicationId(),
                session.initiator(),
                session.status(),
                index < total ? session.pattern().step(index).name() : null,
                index,
                total,
                Math.min(index, total) + "/" + total,
                completed.size(),
                session.failedSteps().size(),
                session.messages().size(),
                session.startTime(),
                session.endTime()
        );
    }

    @Override
    public void close() {
        agentExecutor.shutdownNow();
        registry.close();
    }
}
