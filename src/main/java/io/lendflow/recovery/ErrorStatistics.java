package io.lendflow.recovery;

import java.util.Map;

public record ErrorStatistics(
        long totalErrors,
        Map<String, Long> bySeverity,
        Map<String, Long> byCategory,
        Map<String, Long> byStatus,
        double recoverySuccessRate
) {
}
