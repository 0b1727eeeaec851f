package io.lendflow.workflow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Denial-leaning defaults substituted for a failed underwriting or compliance step.
 */
final class ConservativeAssessment implements FallbackHandler {
    static final String UNDERWRITING_AGENT = "underwriting_agent";
    static final String COMPLIANCE_AGENT = "compliance_agent";

    @Override
    public FallbackOutcome apply(FallbackRequest request) {
        Map<String, Object> context = request.context();
        String agent = request.step().agent();
        if (UNDERWRITING_AGENT.equals(agent)) {
            Map<String, Object> terms = new LinkedHashMap<>();
            terms.put("approved", false);
            terms.put("reason", "Conservative assessment due to error");
            context.put("risk_assessment", "high");
            context.put("loan_terms", terms);
        } else if (COMPLIANCE_AGENT.equals(agent)) {
            context.put("compliance_results", "needs_review");
            context.put("compliance_issues", List.of("Automatic compliance check failed"));
        }
        return FallbackOutcome.ADVANCE;
    }
}
