package io.lendflow.pattern.condition;

import java.util.Map;

/**
 * Node of a parsed step condition. Evaluation only reads the session context; there
 * is no way to call methods or reach anything outside the supplied map.
 */
public interface Expression {
    Object evaluate(Map<String, Object> context);

    default boolean test(Map<String, Object> context) {
        return Values.truthy(evaluate(context));
    }
}
