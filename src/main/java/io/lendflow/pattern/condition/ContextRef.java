package io.lendflow.pattern.condition;

import java.util.List;
import java.util.Map;

/**
 * Reads a context value by dotted path; a missing key anywhere along the path
 * yields null.
 */
public record ContextRef(List<String> path) implements Expression {
    public ContextRef {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        path = List.copyOf(path);
    }

    @Override
    public Object evaluate(Map<String, Object> context) {
        Object current = context;
        for (String segment : path) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return current;
    }
}
