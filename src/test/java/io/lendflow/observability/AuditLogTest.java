package io.lendflow.observability;

import io.lendflow.security.SensitiveDataMasker;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class AuditLogTest {
    private static final LocalDate DAY = LocalDate.of(2024, 3, 14);

    @Test
    void entriesChainAndVerify() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        AuditLog audit = new AuditLog(store, AuditPolicy.defaults(), clockAt(DAY));

        String first = audit.logApplicationAccess("loan_officer_7", "app-1", "view", Map.of("section", "summary"));
        audit.logAgentAction("document_agent", "extract", "app-1", Map.of("pages", 4), true);
        audit.logDecision("app-1", "approved", "orchestrator", Map.of("rate", 6.5));

        Assertions.assertFalse(first.isEmpty());
        Assertions.assertEquals(List.of("audit_2024-03-14.log"), audit.auditSegments());
        AuditIntegrityReport report = audit.verifySegment(AuditLog.segmentKey(DAY));
        Assertions.assertTrue(report.intact());
        Assertions.assertEquals(3, report.checkedEntries());
        Assertions.assertEquals(0, report.brokenLine());
        Assertions.assertTrue(audit.verifyIntegrity());

        List<AuditEntry> entries = audit.search(AuditQuery.all());
        Assertions.assertEquals(3, entries.size());
        Assertions.assertEquals(first, entries.get(0).entryId());
        Assertions.assertEquals("loan_officer_7", entries.get(0).userId());
        Assertions.assertNull(entries.get(0).agentId());
        Assertions.assertEquals("make_decision", entries.get(2).action());
        Assertions.assertEquals("approved", entries.get(2).details().get("decision"));
    }

    @Test
    void editedEntryBreaksChainAtThatLine() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        AuditLog audit = new AuditLog(store, AuditPolicy.defaults(), clockAt(DAY));
        audit.logAgentAction("underwriting_agent", "score", "app-1", Map.of("score", 710), true);
        audit.logDecision("app-1", "declined", "orchestrator", Map.of());
        audit.logAgentAction("orchestrator", "notify", "app-1", Map.of(), true);

        String segment = AuditLog.segmentKey(DAY);
        String content = new String(store.read(segment), StandardCharsets.UTF_8);
        store.overwrite(segment, content.replace("declined", "approved").getBytes(StandardCharsets.UTF_8));

        AuditIntegrityReport report = audit.verifySegment(segment);
        Assertions.assertFalse(report.intact());
        Assertions.assertEquals(2, report.brokenLine());
        Assertions.assertEquals(1, report.checkedEntries());
        Assertions.assertEquals("hash_mismatch", report.reason());
        Assertions.assertFalse(audit.verifyIntegrity(segment));
    }

    @Test
    void deletedAndTruncatedLinesAreDetected() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        AuditLog audit = new AuditLog(store, AuditPolicy.defaults(), clockAt(DAY));
        audit.logAgentAction("a", "one", "r", Map.of(), true);
        audit.logAgentAction("a", "two", "r", Map.of(), true);
        audit.logAgentAction("a", "three", "r", Map.of(), true);
        String segment = AuditLog.segmentKey(DAY);
        String[] lines = new String(store.read(segment), StandardCharsets.UTF_8).split("\n");

        store.overwrite(segment, (lines[0] + "\n" + lines[2] + "\n").getBytes(StandardCharsets.UTF_8));
        Assertions.assertEquals("hash_mismatch", audit.verifySegment(segment).reason());

        store.overwrite(segment, (lines[0] + "\n" + lines[1]).getBytes(StandardCharsets.UTF_8));
        AuditIntegrityReport truncated = audit.verifySegment(segment);
        Assertions.assertFalse(truncated.intact());
        Assertions.assertEquals("unterminated_line", truncated.reason());

        store.overwrite(segment, ("garbage\n").getBytes(StandardCharsets.UTF_8));
        Assertions.assertEquals("malformed_entry", audit.verifySegment(segment).reason());

        Assertions.assertTrue(audit.verifySegment("audit_2000-01-01.log").intact());
    }

    @Test
    void sensitiveDetailsAreMaskedAndSeparatorsEscaped() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        AuditLog audit = new AuditLog(store, AuditPolicy.defaults(), clockAt(DAY));
        audit.logEvent(AuditLog.APPLICATION_ACCESS, "officer", "doc|agent", "view", "app-1",
                Map.of("borrower", Map.of("SSN", "123-45-6789", "name", "Pat"), "note", "a|b"), true);

        String raw = new String(store.read(AuditLog.segmentKey(DAY)), StandardCharsets.UTF_8);
        Assertions.assertFalse(raw.contains("123-45-6789"));

        AuditEntry entry = audit.search(AuditQuery.all()).get(0);
        Assertions.assertEquals("doc_agent", entry.agentId());
        Map<?, ?> borrower = (Map<?, ?>) entry.details().get("borrower");
        Assertions.assertEquals(SensitiveDataMasker.MASK, borrower.get("SSN"));
        Assertions.assertEquals("Pat", borrower.get("name"));
        Assertions.assertEquals("a|b", entry.details().get("note"));
        Assertions.assertTrue(audit.verifyIntegrity());
    }

    @Test
    void restrictedPolicyRecordsOnlySensitiveEvents() {
        AuditLog audit = new AuditLog(new InMemorySegmentStore(),
                new AuditPolicy(false, Set.of(AuditLog.DECISION), 30), clockAt(DAY));

        Assertions.assertEquals("", audit.logAgentAction("a", "noise", "r", Map.of(), true));
        Assertions.assertFalse(audit.logDecision("app-1", "approved", "orchestrator", Map.of()).isEmpty());
        Assertions.assertEquals(1, audit.search(AuditQuery.all()).size());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> audit.logEvent(" ", null, null, "x", null, Map.of(), true));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> audit.logEvent(AuditLog.DECISION, null, null, "", null, Map.of(), true));
    }

    @Test
    void searchAndCountsFilterByDayAndFields() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        LocalDate nextDay = DAY.plusDays(1);
        AuditLog first = new AuditLog(store, AuditPolicy.defaults(), clockAt(DAY));
        first.logApplicationAccess("officer", "app-1", "view", Map.of());
        first.logAgentAction("document_agent", "extract", "app-1", Map.of(), true);
        AuditLog second = new AuditLog(store, AuditPolicy.defaults(), clockAt(nextDay));
        second.logAgentAction("document_agent", "extract", "app-2", Map.of(), false);
        second.logSecurityEvent("login_failed", "officer", null, null, Map.of(), false);

        Assertions.assertEquals(2, second.auditSegments().size());
        Assertions.assertEquals(2, second.search(AuditQuery.all().withAgentId("document_agent")).size());
        Assertions.assertEquals(1, second.search(AuditQuery.all().withResourceId("app-2")).size());
        Assertions.assertEquals(2, second.search(AuditQuery.all().withUserId("officer")).size());
        Assertions.assertEquals(1, second.search(AuditQuery.all().between(nextDay, nextDay)
                .withEventTypes(Set.of(AuditLog.AGENT_ACTION))).size());
        Assertions.assertEquals(1, second.search(AuditQuery.all().withAction("login_failed")).size());

        Map<String, Long> counts = second.eventCountsByType(DAY, DAY);
        Assertions.assertEquals(Map.of(AuditLog.APPLICATION_ACCESS, 1L, AuditLog.AGENT_ACTION, 1L), counts);
        Assertions.assertEquals(4L, second.eventCountsByType(null, null).values().stream().mapToLong(Long::longValue).sum());
        Assertions.assertTrue(second.verifyIntegrity());
    }

    @Test
    void purgeRemovesSegmentsOutsideRetention() {
        InMemorySegmentStore store = new InMemorySegmentStore();
        AuditPolicy policy = new AuditPolicy(true, Set.of(), 30);
        new AuditLog(store, policy, clockAt(DAY.minusDays(45))).logAgentAction("a", "old", "r", Map.of(), true);
        new AuditLog(store, policy, clockAt(DAY.minusDays(10))).logAgentAction("a", "recent", "r", Map.of(), true);

        AuditLog today = new AuditLog(store, policy, clockAt(DAY));
        List<String> removed = today.purgeExpiredSegments();

        Assertions.assertEquals(List.of(AuditLog.segmentKey(DAY.minusDays(45))), removed);
        Assertions.assertEquals(List.of(AuditLog.segmentKey(DAY.minusDays(10))), today.auditSegments());
        Assertions.assertTrue(today.purgeExpiredSegments().isEmpty());
    }

    @Test
    void fileSegmentsSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("lendflow-test-audit-");
        try {
            AuditLog audit = new AuditLog(new FileSegmentStore(root), AuditPolicy.defaults(), clockAt(DAY));
            audit.logAgentAction("a", "one", "r", Map.of(), true);
            audit.logAgentAction("a", "two", "r", Map.of(), true);
            Files.writeString(root.resolve("notes.txt"), "not a segment");

            AuditLog reopened = new AuditLog(new FileSegmentStore(root), AuditPolicy.defaults(), clockAt(DAY));
            reopened.logAgentAction("a", "three", "r", Map.of(), true);

            Assertions.assertTrue(Files.exists(root.resolve("audit_2024-03-14.log")));
            Assertions.assertEquals(List.of("audit_2024-03-14.log"), reopened.auditSegments());
            AuditIntegrityReport report = reopened.verifySegment(AuditLog.segmentKey(DAY));
            Assertions.assertTrue(report.intact());
            Assertions.assertEquals(3, report.checkedEntries());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void segmentKeysRoundTripToDays() {
        Assertions.assertEquals(DAY, AuditLog.segmentDay(AuditLog.segmentKey(DAY)).orElseThrow());
        Assertions.assertTrue(AuditLog.segmentDay("audit_yesterday.log").isEmpty());
        Assertions.assertTrue(AuditLog.segmentDay("notes.txt").isEmpty());
    }

    private static Clock clockAt(LocalDate day) {
        Instant noon = day.atTime(12, 0).toInstant(ZoneOffset.UTC);
        return Clock.fixed(noon, ZoneOffset.UTC);
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
