package io.lendflow.recovery;

import java.util.List;

@FunctionalInterface
public interface RecoveryStrategy {
    List<RecoveryAction> plan(ErrorRecord record);
}
