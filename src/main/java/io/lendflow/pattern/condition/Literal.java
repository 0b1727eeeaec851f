package io.lendflow.pattern.condition;

import java.util.Map;

public record Literal(Object value) implements Expression {
    @Override
    public Object evaluate(Map<String, Object> context) {
        return value;
    }
}
