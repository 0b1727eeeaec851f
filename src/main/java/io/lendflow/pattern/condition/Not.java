package io.lendflow.pattern.condition;

import java.util.Map;

public record Not(Expression operand) implements Expression {
    @Override
    public Object evaluate(Map<String, Object> context) {
        return !operand.test(context);
    }
}
