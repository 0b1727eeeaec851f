package io.lendflow.runtime;

import io.lendflow.config.LendFlowConfig;
import io.lendflow.error.ValidationException;
import io.lendflow.model.ApplicationState;
import io.lendflow.model.WorkflowStage;
import io.lendflow.observability.AuditIntegrityReport;
import io.lendflow.recovery.ErrorRecord;
import io.lendflow.recovery.ErrorStatistics;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class LendFlowRuntimeTest {
    private static final LocalDate DAY = LocalDate.of(2026, 10, 19);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void initReportsLayoutAndLoadedPatterns() throws Exception {
        Path root = Files.createTempDirectory("lendflow-test-runtime-");
        try {
            LendFlowConfig config = LendFlowConfig.fromRoot(root.toString());
            copyPatterns(config.patternsFile());
            try (LendFlowRuntime runtime = new LendFlowRuntime(config, CLOCK)) {
                runtime.init();
                LendFlowRuntime.InitOutcome outcome = runtime.initOutcome();
                Assertions.assertTrue(outcome.patternsPresent());
                Assertions.assertEquals(List.of("document_processing", "underwriting_review"), outcome.patterns());
                Assertions.assertEquals(config.dbFile().toString(), outcome.dbFile());
                Assertions.assertTrue(Files.exists(config.dbFile()));

                List<LendFlowRuntime.PatternSummary> summaries = runtime.validatePatterns(config.patternsFile());
                Assertions.assertEquals(2, summaries.size());
                LendFlowRuntime.PatternSummary underwriting = summaries.get(1);
                Assertions.assertEquals("underwriting_review", underwriting.name());
                Assertions.assertEquals(List.of("assess_risk", "check_compliance", "manual_review"), underwriting.steps());
                Assertions.assertEquals(List.of("assess_risk", "check_compliance"), underwriting.errorPolicies());
                Assertions.assertEquals(List.of("compliance_agent", "orchestrator", "underwriting_agent"), underwriting.agents());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runtimeWithoutPatternFileStartsEmpty() throws Exception {
        Path root = Files.createTempDirectory("lendflow-test-runtime-");
        try (LendFlowRuntime runtime = new LendFlowRuntime(LendFlowConfig.fromRoot(root.toString()), CLOCK)) {
            runtime.init();
            Assertions.assertFalse(runtime.initOutcome().patternsPresent());
            Assertions.assertTrue(runtime.catalog().patternNames().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void applicationLifecycleIsAuditedAndPersisted() throws Exception {
        Path root = Files.createTempDirectory("lendflow-test-runtime-");
        try {
            LendFlowConfig config = LendFlowConfig.fromRoot(root.toString());
            try (LendFlowRuntime runtime = new LendFlowRuntime(config, CLOCK)) {
                runtime.init();
                runtime.createApplication("app-100");

                LendFlowRuntime.TransitionOutcome accepted = runtime.transitionApplication(
                        "app-100", ApplicationState.DOCUMENT_COLLECTION, "borrower submitted");
                Assertions.assertTrue(accepted.accepted());
                Assertions.assertEquals("initiated", accepted.fromState());
                Assertions.assertEquals("document_collection", accepted.currentState());

                LendFlowRuntime.TransitionOutcome rejected = runtime.transitionApplication(
                        "app-100", ApplicationState.APPROVED, "skip ahead");
                Assertions.assertFalse(rejected.accepted());
                Assertions.assertEquals("document_collection", rejected.currentState());

                LendFlowRuntime.ApplicationView view = runtime.application("app-100").orElseThrow();
                Assertions.assertEquals(WorkflowStage.DOCUMENT_PROCESSING, view.stage());
                Assertions.assertEquals(2, view.history().size());
                Assertions.assertTrue(view.allowedTransitions().contains("document_validation"));
                Assertions.assertTrue(runtime.application("app-404").isEmpty());

                ErrorRecord record = runtime.recoveryManager().handleError(
                        "app-100", new ValidationException("income statement unreadable"), Map.of("step_name", "validate_documents"));
                List<ErrorRecord> history = runtime.errorHistory("app-100", 10);
                Assertions.assertEquals(1, history.size());
                Assertions.assertEquals(record.errorId(), history.get(0).errorId());
                ErrorStatistics stats = runtime.errorStatistics("app-100");
                Assertions.assertEquals(1L, stats.totalErrors());
                Assertions.assertEquals(Map.of("validation", 1L), stats.byCategory());

                Map<String, Long> counts = runtime.auditCounts(DAY, DAY);
                Assertions.assertEquals(2L, counts.get("state_transition"));
                Assertions.assertEquals(1L, counts.get("security_event"));
                List<AuditIntegrityReport> reports = runtime.verifyAudit(null);
                Assertions.assertEquals(1, reports.size());
                Assertions.assertTrue(reports.get(0).intact());
                Assertions.assertTrue(runtime.verifyAudit("audit_2026-10-19.log").get(0).intact());
                Assertions.assertTrue(runtime.purgeAudit().isEmpty());
            }

            try (LendFlowRuntime reopened = new LendFlowRuntime(config, CLOCK)) {
                Assertions.assertEquals("document_collection", reopened.application("app-100").orElseThrow().state());
                Assertions.assertEquals(1, reopened.errorHistory("app-100", 0).size());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static void copyPatterns(Path target) throws IOException {
        try (InputStream in = LendFlowRuntimeTest.class.getResourceAsStream("/patterns/mortgage-patterns.json")) {
            Assertions.assertNotNull(in);
            Files.createDirectories(target.getParent());
            Files.copy(in, target);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(root)) {
            stream.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount()))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException ignored) {
                        }
                    });
        }
    }
}
