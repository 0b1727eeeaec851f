package io.lendflow.workflow;

@FunctionalInterface
public interface FallbackHandler {
    FallbackOutcome apply(FallbackRequest request) throws Exception;
}
