package io.lendflow.observability;

import io.lendflow.util.Jsons;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

public record AuditEntry(
        Instant timestamp,
        String entryId,
        String eventType,
        String userId,
        String agentId,
        String action,
        String resourceId,
        Map<String, Object> details,
        boolean success,
        String hash
) {
    static final String ABSENT = "-";
    private static final int LEADING_FIELDS = 7;

    /**
     * Parses one stored line. The details column is JSON and may itself contain the
     * field separator, so seven fields are taken from the left, two from the right,
     * and whatever sits between them is the details payload.
     */
    public static Optional<AuditEntry> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        String[] leading = new String[LEADING_FIELDS];
        int cursor = 0;
        for (int i = 0; i < LEADING_FIELDS; i++) {
            int sep = line.indexOf('|', cursor);
            if (sep < 0) {
                return Optional.empty();
            }
            leading[i] = line.substring(cursor, sep);
            cursor = sep + 1;
        }
        int hashSep = line.lastIndexOf('|');
        if (hashSep <= cursor) {
            return Optional.empty();
        }
        int successSep = line.lastIndexOf('|', hashSep - 1);
        if (successSep < cursor) {
            return Optional.empty();
        }
        try {
            String detailsJson = line.substring(cursor, successSep);
            return Optional.of(new AuditEntry(
                    Instant.parse(leading[0]),
                    leading[1],
                    leading[2],
                    optional(leading[3]),
                    optional(leading[4]),
                    leading[5],
                    optional(leading[6]),
                    Jsons.toMap(detailsJson),
                    Boolean.parseBoolean(line.substring(successSep + 1, hashSep)),
                    line.substring(hashSep + 1)
            ));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    private static String optional(String raw) {
        return ABSENT.equals(raw) ? null : raw;
    }
}
