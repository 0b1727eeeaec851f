package io.lendflow.pattern.condition;

import java.util.Map;

public record Comparison(Operator operator, Expression left, Expression right) implements Expression {
    public enum Operator {
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        IN("in"),
        NOT_IN("not in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    @Override
    public Object evaluate(Map<String, Object> context) {
        Object l = left.evaluate(context);
        Object r = right.evaluate(context);
        return switch (operator) {
            case EQ -> Values.same(l, r);
            case NE -> !Values.same(l, r);
            case LT -> Values.compare(l, r) < 0;
            case LE -> Values.compare(l, r) <= 0;
            case GT -> Values.compare(l, r) > 0;
            case GE -> Values.compare(l, r) >= 0;
            case IN -> Values.contains(r, l);
            case NOT_IN -> !Values.contains(r, l);
        };
    }
}
