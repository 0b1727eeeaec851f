package io.lendflow.pattern.condition;

public class ConditionEvaluationException extends RuntimeException {
    public ConditionEvaluationException(String message) {
        super(message);
    }
}
