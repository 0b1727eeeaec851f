package io.lendflow.pattern;

import io.lendflow.error.ConfigurationException;
import io.lendflow.model.MessageType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class PatternCatalogTest {

    @Test
    void loadsBundledMortgagePatterns() throws IOException {
        PatternCatalog catalog = PatternCatalog.parse(resource("/patterns/mortgage-patterns.json"), 60);

        Assertions.assertEquals(List.of("document_processing", "underwriting_review"), List.copyOf(catalog.patternNames()));

        CollaborationPattern docs = catalog.find("document_processing").orElseThrow();
        Assertions.assertEquals("orchestrator", docs.initiator());
        Assertions.assertEquals(3, docs.stepCount());
        StepDefinition validate = docs.step(1);
        Assertions.assertTrue(validate.eventTriggered());
        Assertions.assertEquals("documents_uploaded", validate.triggerEvent());
        Assertions.assertEquals(120, validate.timeoutSeconds());
        Assertions.assertEquals(60, docs.step(0).timeoutSeconds());
        Assertions.assertEquals(2, docs.step(2).retryCount());

        ErrorPolicy policy = docs.policyFor("validate_documents").orElseThrow();
        Assertions.assertEquals(ErrorPolicy.OnError.NOTIFY_ORCHESTRATOR, policy.onError());
        Assertions.assertEquals(1, policy.maxRetries());
        Assertions.assertEquals(ErrorPolicy.MANUAL_INTERVENTION, policy.fallback());
        Assertions.assertTrue(docs.policyFor("request_documents").isEmpty());

        StepDefinition review = catalog.find("underwriting_review").orElseThrow().step(2);
        Assertions.assertFalse(review.required());
        Assertions.assertTrue(review.hasCondition());
        Assertions.assertTrue(review.condition().test(Map.of("risk_assessment", "high")));
        Assertions.assertFalse(review.condition().test(Map.of("risk_assessment", "low", "compliance_results", "ok")));

        Assertions.assertEquals(List.of("validate_documents", "analyze_documents"),
                catalog.capabilitiesOf("document_agent").orElseThrow());
        Assertions.assertTrue(catalog.capabilitiesOf("unknown_agent").isEmpty());
        Assertions.assertTrue(catalog.allowsMessageType(MessageType.DECISION));
    }

    @Test
    void agentsDefaultToInitiatorAndStepAgents() {
        PatternCatalog catalog = PatternCatalog.parse("""
                {"collaboration_patterns": {"p": {
                  "initiator": "orchestrator",
                  "steps": [{"name": "a", "agent": "document_agent"}, {"name": "b", "agent": "underwriting_agent"}]
                }}}
                """, 30);
        CollaborationPattern p = catalog.find("p").orElseThrow();
        Assertions.assertEquals(Set.of("orchestrator", "document_agent", "underwriting_agent"), p.agents());
        Assertions.assertEquals(30, p.step(0).timeoutSeconds());
        Assertions.assertTrue(p.step(0).required());
        Assertions.assertEquals(Set.of(MessageType.values()), catalog.allowedMessageTypes());
    }

    @Test
    void collectsEveryProblemIntoOneError() {
        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class, () -> PatternCatalog.parse("""
                {"collaboration_patterns": {"broken": {
                  "initiator": "outsider",
                  "agents": ["orchestrator", "document_agent"],
                  "steps": [
                    {"name": "a", "agent": "document_agent", "condition": "x >"},
                    {"name": "a", "agent": "stranger", "timeout_seconds": 0},
                    {"name": "c", "agent": "document_agent", "event_triggered": true}
                  ],
                  "error_handling": {
                    "missing_step": {"on_error": "retry"},
                    "c": {"on_error": "panic"}
                  }
                }},
                "communication_protocols": {"agent_messaging": {"message_types": ["gossip"]}}}
                """, 60));

        String message = e.getMessage();
        Assertions.assertTrue(message.contains("initiator 'outsider' is not one of the pattern agents"), message);
        Assertions.assertTrue(message.contains("step 'a' condition"), message);
        Assertions.assertTrue(message.contains("duplicate step name 'a'"), message);
        Assertions.assertTrue(message.contains("uses agent 'stranger' outside the pattern agents"), message);
        Assertions.assertTrue(message.contains("timeout_seconds must be positive"), message);
        Assertions.assertTrue(message.contains("event_triggered without trigger_event"), message);
        Assertions.assertTrue(message.contains("unknown step 'missing_step'"), message);
        Assertions.assertTrue(message.contains("Unknown on_error value: panic"), message);
        Assertions.assertTrue(message.contains("Unknown message type: gossip"), message);
    }

    @Test
    void rejectsEmptyOrUnreadableDocuments() throws IOException {
        Assertions.assertThrows(ConfigurationException.class, () -> PatternCatalog.parse("{}", 60));
        Assertions.assertThrows(ConfigurationException.class, () -> PatternCatalog.parse("[1, 2]", 60));
        Assertions.assertThrows(ConfigurationException.class, () -> PatternCatalog.parse("{not json", 60));

        Path dir = Files.createTempDirectory("lendflow-test-patterns-");
        try {
            Assertions.assertThrows(ConfigurationException.class,
                    () -> PatternCatalog.load(dir.resolve("missing.json"), 60));
        } finally {
            Files.deleteIfExists(dir);
        }
    }

    @Test
    void programmaticCatalogRejectsDuplicates() {
        CollaborationPattern p = new CollaborationPattern("p", "", "orchestrator", Set.of("orchestrator"),
                List.of(), Map.of());
        Assertions.assertEquals(Set.of("p"), PatternCatalog.of(List.of(p)).patternNames());
        Assertions.assertThrows(ConfigurationException.class, () -> PatternCatalog.of(List.of(p, p)));
    }

    private static String resource(String path) throws IOException {
        try (InputStream in = PatternCatalogTest.class.getResourceAsStream(path)) {
            Assertions.assertNotNull(in, path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
