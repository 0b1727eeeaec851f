package io.lendflow.runtime;

import io.lendflow.agent.Agent;
import io.lendflow.agent.AgentRegistry;
import io.lendflow.config.EngineSettings;
import io.lendflow.config.LendFlowConfig;
import io.lendflow.model.ApplicationState;
import io.lendflow.model.WorkflowStage;
import io.lendflow.observability.AuditEntry;
import io.lendflow.observability.AuditIntegrityReport;
import io.lendflow.observability.AuditLog;
import io.lendflow.observability.AuditQuery;
import io.lendflow.observability.FileSegmentStore;
import io.lendflow.pattern.CollaborationPattern;
import io.lendflow.pattern.PatternCatalog;
import io.lendflow.pattern.StepDefinition;
import io.lendflow.recovery.ApplicationRecoveryTarget;
import io.lendflow.recovery.ErrorRecord;
import io.lendflow.recovery.ErrorRecoveryManager;
import io.lendflow.recovery.ErrorStatistics;
import io.lendflow.state.ApplicationStateMachine;
import io.lendflow.state.StateTransition;
import io.lendflow.storage.Database;
import io.lendflow.storage.SqliteApplicationStateStore;
import io.lendflow.storage.SqliteErrorRecordStore;
import io.lendflow.workflow.CollaborationManager;
import io.lendflow.workflow.TaskRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wires one data root into a working engine: SQLite-backed state and error stores, the
 * file audit log, the pattern catalog and the collaboration manager.
 */
public final class LendFlowRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LendFlowRuntime.class);

    private final LendFlowConfig config;
    private final EngineSettings settings;
    private final Database database;
    private final AuditLog auditLog;
    private final ApplicationStateMachine stateMachine;
    private final ErrorRecoveryManager recoveryManager;
    private final PatternCatalog catalog;
    private final CollaborationManager collaborationManager;

    public LendFlowRuntime(LendFlowConfig config) {
        this(config, Clock.systemUTC());
    }

    public LendFlowRuntime(LendFlowConfig config, Clock clock) {
        this.config = config;
        this.settings = EngineSettings.load(config.settingsFile());
        this.database = new Database(config);
        this.auditLog = new AuditLog(new FileSegmentStore(config.auditRoot()), settings.auditPolicy(), clock);
        this.stateMachine = new ApplicationStateMachine(new SqliteApplicationStateStore(database), auditLog, clock);
        this.recoveryManager = new ErrorRecoveryManager(
                auditLog,
                new SqliteErrorRecordStore(database),
                new ApplicationRecoveryTarget(stateMachine, auditLog),
                settings.defaultMaxRetries(),
                clock
        );
        this.catalog = Files.exists(config.patternsFile())
                ? PatternCatalog.load(config.patternsFile(), settings.defaultStepTimeoutSeconds())
                : PatternCatalog.of(List.of());
        this.collaborationManager = new CollaborationManager(
                catalog,
                new AgentRegistry(),
                recoveryManager,
                stateMachine,
                auditLog,
                settings,
                clock
        );
        new TaskRouter(collaborationManager, settings).attachTo(stateMachine);
    }

    public void init() {
        database.init();
        log.info("Initialized data root {} ({} pattern(s))", config.rootDir(), catalog.patternNames().size());
    }

    public LendFlowConfig config() {
        return config;
    }

    public EngineSettings settings() {
        return settings;
    }

    public AuditLog auditLog() {
        return auditLog;
    }

    public ApplicationStateMachine stateMachine() {
        return stateMachine;
    }

    public ErrorRecoveryManager recoveryManager() {
        return recoveryManager;
    }

    public PatternCatalog catalog() {
        return catalog;
    }

    public CollaborationManager collaborationManager() {
        return collaborationManager;
    }

    public void registerAgent(String agentId, Agent agent) {
        collaborationManager.registerAgent(agentId, agent);
    }

    public InitOutcome initOutcome() {
        return new InitOutcome(
                config.rootDir().toString(),
                config.dbFile().toString(),
                config.auditRoot().toString(),
                Files.exists(config.patternsFile()),
                List.copyOf(catalog.patternNames())
        );
    }

    /**
     * Loads and validates a pattern document without touching the runtime's own
     * catalog.
     */
    public List<PatternSummary> validatePatterns(Path file) {
        PatternCatalog candidate = PatternCatalog.load(file, settings.defaultStepTimeoutSeconds());
        List<PatternSummary> out = new ArrayList<>();
        for (CollaborationPattern pattern : candidate.patterns()) {
            List<String> steps = new ArrayList<>();
            for (StepDefinition step : pattern.steps()) {
                steps.add(step.name());
            }
            out.add(new PatternSummary(
                    pattern.name(),
                    pattern.initiator(),
                    pattern.agents().stream().sorted().toList(),
                    steps,
                    pattern.errorHandling().keySet().stream().sorted().toList()
            ));
        }
        return out;
    }

    public List<AuditIntegrityReport> verifyAudit(String segmentKey) {
        if (segmentKey == null || segmentKey.isBlank()) {
            return auditLog.verifyAll();
        }
        return List.of(auditLog.verifySegment(segmentKey));
    }

    public List<AuditEntry> searchAudit(AuditQuery query) {
        return auditLog.search(query);
    }

    public Map<String, Long> auditCounts(LocalDate start, LocalDate end) {
        return auditLog.eventCountsByType(start, end);
    }

    public List<String> purgeAudit() {
        return auditLog.purgeExpiredSegments();
    }

    public void createApplication(String applicationId) {
        stateMachine.createApplication(applicationId);
    }

    public TransitionOutcome transitionApplication(String applicationId, ApplicationState target, String reason) {
        String from = stateMachine.currentState(applicationId).map(ApplicationState::wireName).orElse(null);
        boolean accepted = stateMachine.transition(applicationId, target, reason);
        String current = stateMachine.currentState(applicationId).map(ApplicationState::wireName).orElse(null);
        return new TransitionOutcome(applicationId, from, target.wireName(), current, accepted);
    }

    public Optional<ApplicationView> application(String applicationId) {
        Optional<ApplicationState> state = stateMachine.currentState(applicationId);
        if (state.isEmpty()) {
            return Optional.empty();
        }
        List<String> allowed = ApplicationStateMachine.allowedTransitions(state.get()).stream()
                .map(ApplicationState::wireName)
                .sorted()
                .toList();
        return Optional.of(new ApplicationView(
                applicationId,
                state.get().wireName(),
                state.get().stage(),
                allowed,
                stateMachine.history(applicationId)
        ));
    }

    public List<ErrorRecord> errorHistory(String applicationId, int limit) {
        return recoveryManager.errorHistory(applicationId, limit);
    }

    public ErrorStatistics errorStatistics(String applicationId) {
        return recoveryManager.errorStatistics(applicationId);
    }

    @Override
    public void close() {
        collaborationManager.close();
    }

    public record InitOutcome(
            String rootDir,
            String dbFile,
            String auditDir,
            boolean patternsPresent,
            List<String> patterns
    ) {
    }

    public record PatternSummary(
            String name,
            String initiator,
            List<String> agents,
            List<String> steps,
            List<String> errorPolicies
    ) {
    }

    public record TransitionOutcome(
            String applicationId,
            String fromState,
            String requestedState,
            String currentState,
            boolean accepted
    ) {
    }

    public record ApplicationView(
            String applicationId,
            String state,
            WorkflowStage stage,
            List<String> allowedTransitions,
            List<StateTransition> history
    ) {
    }
}
