package io.lendflow.pattern.condition;

import java.util.Map;

public record Or(Expression left, Expression right) implements Expression {
    @Override
    public Object evaluate(Map<String, Object> context) {
        return left.test(context) || right.test(context);
    }
}
