package io.lendflow.observability;

/**
 * Result of replaying a segment's hash chain. {@code brokenLine} is 1-based and
 * zero when the chain is intact.
 */
public record AuditIntegrityReport(
        String segment,
        boolean intact,
        int checkedEntries,
        int brokenLine,
        String reason
) {
}
