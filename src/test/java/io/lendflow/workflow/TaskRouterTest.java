package io.lendflow.workflow;

import io.lendflow.agent.AgentRegistry;
import io.lendflow.config.EngineSettings;
import io.lendflow.model.AgentMessage;
import io.lendflow.model.ApplicationState;
import io.lendflow.model.MessageType;
import io.lendflow.observability.AuditLog;
import io.lendflow.observability.InMemorySegmentStore;
import io.lendflow.pattern.PatternCatalog;
import io.lendflow.recovery.ApplicationRecoveryTarget;
import io.lendflow.recovery.ErrorRecoveryManager;
import io.lendflow.recovery.InMemoryErrorRecordStore;
import io.lendflow.state.ApplicationStateMachine;
import io.lendflow.state.InMemoryApplicationStateStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

final class TaskRouterTest {
    private static final String PATTERNS = """
            {
              "collaboration_patterns": {
                "noop": {"initiator": "orchestrator", "steps": [{"name": "s", "agent": "orchestrator"}]}
              }
            }
            """;

    @Test
    void enteringUnderwritingSendsRequestToUnderwritingAgent() throws Exception {
        AuditLog audit = new AuditLog(new InMemorySegmentStore());
        ApplicationStateMachine stateMachine = new ApplicationStateMachine(
                new InMemoryApplicationStateStore(), audit, Clock.systemUTC());
        AgentRegistry registry = new AgentRegistry();
        CollaborationManager manager = newManager(registry, stateMachine, audit);
        try {
            new TaskRouter(manager, EngineSettings.defaults()).attachTo(stateMachine);
            ScriptedAgent underwriting = new ScriptedAgent();
            manager.registerAgent("orchestrator", new ScriptedAgent("s"));
            manager.registerAgent("underwriting_agent", underwriting);

            stateMachine.createApplication("app-1");
            Assertions.assertTrue(stateMachine.transition("app-1", ApplicationState.DOCUMENT_COLLECTION, "start"));
            Assertions.assertTrue(stateMachine.transition("app-1", ApplicationState.DOCUMENT_VALIDATION, "uploaded"));
            Assertions.assertTrue(stateMachine.transition("app-1", ApplicationState.DOCUMENT_ANALYSIS, "valid"));
            Assertions.assertTrue(stateMachine.transition("app-1", ApplicationState.UNDERWRITING, "analysed"));

            Assertions.assertTrue(registry.mailbox("underwriting_agent").orElseThrow().awaitDrained(Duration.ofSeconds(5)));
            List<AgentMessage> received = underwriting.received();
            Assertions.assertEquals(1, received.size());
            AgentMessage request = received.get(0);
            Assertions.assertEquals("orchestrator", request.sender());
            Assertions.assertEquals(MessageType.REQUEST, request.type());
            Assertions.assertEquals("underwriting", request.content().get("task_type"));
            Assertions.assertEquals("app-1", request.content().get("application_id"));
            Assertions.assertEquals("document_analysis", request.content().get("previous_state"));
        } finally {
            manager.close();
        }
    }

    @Test
    void missingTargetAgentSkipsRoutingWithoutBlockingTransition() {
        AuditLog audit = new AuditLog(new InMemorySegmentStore());
        ApplicationStateMachine stateMachine = new ApplicationStateMachine(
                new InMemoryApplicationStateStore(), audit, Clock.systemUTC());
        CollaborationManager manager = newManager(new AgentRegistry(), stateMachine, audit);
        try {
            TaskRouter router = new TaskRouter(manager, EngineSettings.defaults());
            router.attachTo(stateMachine);
            manager.registerAgent("orchestrator", new ScriptedAgent("s"));

            stateMachine.createApplication("app-2");
            Assertions.assertTrue(stateMachine.transition("app-2", ApplicationState.DOCUMENT_COLLECTION, "start"));
            Assertions.assertEquals(ApplicationState.DOCUMENT_COLLECTION, stateMachine.currentState("app-2").orElseThrow());
            Assertions.assertEquals("document_agent", router.routes().get(ApplicationState.DOCUMENT_COLLECTION));
            Assertions.assertEquals("orchestrator", router.routes().get(ApplicationState.DECISION_PENDING));
            Assertions.assertFalse(router.routes().containsKey(ApplicationState.APPROVED));
        } finally {
            manager.close();
        }
    }

    private static CollaborationManager newManager(AgentRegistry registry, ApplicationStateMachine stateMachine, AuditLog audit) {
        Clock clock = Clock.systemUTC();
        ErrorRecoveryManager recovery = new ErrorRecoveryManager(
                audit, new InMemoryErrorRecordStore(), new ApplicationRecoveryTarget(stateMachine, audit), 1, clock);
        return new CollaborationManager(
                PatternCatalog.parse(PATTERNS, 60),
                registry,
                recovery,
                stateMachine,
                audit,
                EngineSettings.defaults(),
                clock
        );
    }
}
