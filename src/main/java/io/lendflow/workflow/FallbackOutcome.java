package io.lendflow.workflow;

public enum FallbackOutcome {
    /** Move past the failed step. */
    ADVANCE,
    /** End the session as aborted. */
    ABORT,
    /** Park the session until a human resumes it. */
    AWAIT_HUMAN,
    /** The fallback could not be applied. */
    FAILED
}
