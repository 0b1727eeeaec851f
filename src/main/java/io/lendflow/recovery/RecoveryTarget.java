package io.lendflow.recovery;

/**
 * Whatever a recovery action acts upon: a running workflow session, or the bare
 * application when the failure happened outside any session. Each method returns
 * whether the action took effect.
 */
public interface RecoveryTarget {
    boolean retry(ErrorRecord record) throws Exception;

    boolean fallback(ErrorRecord record) throws Exception;

    boolean revert(ErrorRecord record) throws Exception;

    boolean restart(ErrorRecord record) throws Exception;

    boolean alternate(ErrorRecord record) throws Exception;

    boolean diagnostic(ErrorRecord record) throws Exception;

    boolean escalate(ErrorRecord record) throws Exception;

    boolean suspend(ErrorRecord record) throws Exception;

    default boolean ignore(ErrorRecord record) {
        return true;
    }
}
