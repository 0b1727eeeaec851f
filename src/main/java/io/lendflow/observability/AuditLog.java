package io.lendflow.observability;

import io.lendflow.security.SensitiveDataMasker;
import io.lendflow.util.Hashing;
import io.lendflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only audit trail, one segment per UTC day. Each stored line is
 * {@code timestamp|id|event_type|user_id|agent_id|action|resource_id|json_details|success|hash}
 * where {@code hash = sha256(previous_hash + "|" + line_without_hash)} and the first
 * entry of a segment chains from {@code sha256("initial")}.
 */
public final class AuditLog {
    public static final String APPLICATION_ACCESS = "application_access";
    public static final String AGENT_ACTION = "agent_action";
    public static final String AGENT_MESSAGE = "agent_message";
    public static final String DECISION = "decision";
    public static final String SECURITY_EVENT = "security_event";
    public static final String STATE_TRANSITION = "state_transition";
    public static final String WORKFLOW_SESSION = "workflow_session";
    public static final String RECOVERY_ATTEMPT = "recovery_attempt";

    static final String INITIAL_HASH = Hashing.sha256Hex("initial");
    private static final String SEGMENT_PREFIX = "audit_";
    private static final String SEGMENT_SUFFIX = ".log";
    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final SegmentStore store;
    private final AuditPolicy policy;
    private final Clock clock;
    private final Map<String, Chain> chains = new ConcurrentHashMap<>();

    public AuditLog(SegmentStore store, AuditPolicy policy, Clock clock) {
        this.store = store;
        this.policy = policy == null ? AuditPolicy.defaults() : policy;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public AuditLog(SegmentStore store) {
        this(store, AuditPolicy.defaults(), Clock.systemUTC());
    }

    public static String segmentKey(LocalDate day) {
        return SEGMENT_PREFIX + day + SEGMENT_SUFFIX;
    }

    public static Optional<LocalDate> segmentDay(String segmentKey) {
        if (segmentKey == null || !segmentKey.startsWith(SEGMENT_PREFIX) || !segmentKey.endsWith(SEGMENT_SUFFIX)) {
            return Optional.empty();
        }
        String raw = segmentKey.substring(SEGMENT_PREFIX.length(), segmentKey.length() - SEGMENT_SUFFIX.length());
        try {
            return Optional.of(LocalDate.parse(raw));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Appends one entry and returns its id, or an empty string when the policy
     * filters the event type out.
     */
    public String logEvent(
            String eventType,
            String userId,
            String agentId,
            String action,
            String resourceId,
            Map<String, Object> details,
            boolean success
    ) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be blank");
        }
        if (!policy.records(eventType)) {
            return "";
        }
        Instant now = clock.instant();
        String entryId = UUID.randomUUID().toString();
        Map<String, Object> sanitized = SensitiveDataMasker.masked(details);
        String entryData = String.join("|",
                now.toString(),
                entryId,
                field(eventType),
                field(userId),
                field(agentId),
                field(action),
                field(resourceId),
                Jsons.toCompactJson(sanitized),
                Boolean.toString(success)
        );
        String segment = segmentKey(LocalDate.ofInstant(now, ZoneOffset.UTC));
        Chain chain = chains.computeIfAbsent(segment, k -> new Chain());
        synchronized (chain) {
            if (chain.lastHash == null) {
                chain.lastHash = loadLastHash(segment);
            }
            String hash = Hashing.sha256Hex(chain.lastHash + "|" + entryData);
            store.append(segment, (entryData + "|" + hash + "\n").getBytes(StandardCharsets.UTF_8));
            chain.lastHash = hash;
        }
        return entryId;
    }

    public String logApplicationAccess(String userId, String applicationId, String action, Map<String, Object> details) {
        return logEvent(APPLICATION_ACCESS, userId, null, action, applicationId, details, true);
    }

    public String logAgentAction(String agentId, String action, String resourceId, Map<String, Object> details, boolean success) {
        return logEvent(AGENT_ACTION, null, agentId, action, resourceId, details, success);
    }

    public String logSecurityEvent(
            String securityEventType,
            String userId,
            String agentId,
            String resourceId,
            Map<String, Object> details,
            boolean success
    ) {
        Map<String, Object> enriched = new LinkedHashMap<>();
        if (details != null) {
            enriched.putAll(details);
        }
        enriched.put("security_event_type", securityEventType);
        return logEvent(SECURITY_EVENT, userId, agentId, securityEventType, resourceId, enriched, success);
    }

    public String logDecision(String applicationId, String decision, String agentId, Map<String, Object> details) {
        Map<String, Object> enriched = new LinkedHashMap<>();
        if (details != null) {
            enriched.putAll(details);
        }
        enriched.put("decision", decision);
        return logEvent(DECISION, null, agentId, "make_decision", applicationId, enriched, true);
    }

    /**
     * True when every segment (or only {@code segmentKey}, when given) replays cleanly.
     */
    public boolean verifyIntegrity(String segmentKey) {
        if (segmentKey != null) {
            return verifySegment(segmentKey).intact();
        }
        for (String segment : auditSegments()) {
            if (!verifySegment(segment).intact()) {
                return false;
            }
        }
        return true;
    }

    public boolean verifyIntegrity() {
        return verifyIntegrity(null);
    }

    public List<AuditIntegrityReport> verifyAll() {
        return auditSegments().stream().map(this::verifySegment).toList();
    }

    public AuditIntegrityReport verifySegment(String segmentKey) {
        String content = new String(store.read(segmentKey), StandardCharsets.UTF_8);
        if (content.isEmpty()) {
            return new AuditIntegrityReport(segmentKey, true, 0, 0, "");
        }
        String[] lines = content.split("\n", -1);
        String expectedPrev = INITIAL_HASH;
        int checked = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty()) {
                if (i == lines.length - 1) {
                    break;
                }
                return broken(segmentKey, checked, i + 1, "empty_line");
            }
            if (i == lines.length - 1) {
                return broken(segmentKey, checked, i + 1, "unterminated_line");
            }
            int hashSep = line.lastIndexOf('|');
            if (hashSep < 0 || AuditEntry.parse(line).isEmpty()) {
                return broken(segmentKey, checked, i + 1, "malformed_entry");
            }
            String entryData = line.substring(0, hashSep);
            String storedHash = line.substring(hashSep + 1);
            String expectedHash = Hashing.sha256Hex(expectedPrev + "|" + entryData);
            if (!expectedHash.equals(storedHash)) {
                return broken(segmentKey, checked, i + 1, "hash_mismatch");
            }
            expectedPrev = storedHash;
            checked++;
        }
        return new AuditIntegrityReport(segmentKey, true, checked, 0, "");
    }

    public List<AuditEntry> search(AuditQuery query) {
        AuditQuery q = query == null ? AuditQuery.all() : query;
        List<AuditEntry> out = new ArrayList<>();
        for (String segment : auditSegments()) {
            LocalDate day = segmentDay(segment).orElseThrow();
            if (!q.coversDay(day)) {
                continue;
            }
            for (AuditEntry entry : readEntries(segment)) {
                if (q.matches(entry)) {
                    out.add(entry);
                }
            }
        }
        return out;
    }

    public Map<String, Long> eventCountsByType(LocalDate startDate, LocalDate endDate) {
        Map<String, Long> counts = new TreeMap<>();
        for (AuditEntry entry : search(AuditQuery.all().between(startDate, endDate))) {
            counts.merge(entry.eventType(), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * Deletes segments older than the policy's retention window and returns the
     * removed segment keys.
     */
    public List<String> purgeExpiredSegments() {
        LocalDate cutoff = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(policy.retentionDays());
        List<String> removed = new ArrayList<>();
        for (String segment : auditSegments()) {
            LocalDate day = segmentDay(segment).orElseThrow();
            if (day.isBefore(cutoff) && store.delete(segment)) {
                chains.remove(segment);
                removed.add(segment);
            }
        }
        if (!removed.isEmpty()) {
            log.info("Purged {} audit segment(s) older than {}", removed.size(), cutoff);
        }
        return removed;
    }

    public List<String> auditSegments() {
        return store.listSegments().stream()
                .filter(k -> segmentDay(k).isPresent())
                .toList();
    }

    public AuditPolicy policy() {
        return policy;
    }

    private List<AuditEntry> readEntries(String segment) {
        String content = new String(store.read(segment), StandardCharsets.UTF_8);
        List<AuditEntry> out = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (line.isEmpty()) {
                continue;
            }
            Optional<AuditEntry> entry = AuditEntry.parse(line);
            if (entry.isPresent()) {
                out.add(entry.get());
            } else {
                log.warn("Skipping malformed audit line in segment {}", segment);
            }
        }
        return out;
    }

    private String loadLastHash(String segment) {
        String content = new String(store.read(segment), StandardCharsets.UTF_8);
        String last = "";
        for (String line : content.split("\n")) {
            if (!line.isBlank()) {
                last = line;
            }
        }
        if (last.isEmpty()) {
            return INITIAL_HASH;
        }
        return last.substring(last.lastIndexOf('|') + 1);
    }

    private static AuditIntegrityReport broken(String segment, int checked, int line, String reason) {
        log.warn("Audit segment {} failed verification at line {}: {}", segment, line, reason);
        return new AuditIntegrityReport(segment, false, checked, line, reason);
    }

    private static String field(String value) {
        if (value == null || value.isBlank()) {
            return AuditEntry.ABSENT;
        }
        return value.replace('|', '_').replace('\n', '_').replace('\r', '_');
    }

    private static final class Chain {
        private String lastHash;
    }
}
