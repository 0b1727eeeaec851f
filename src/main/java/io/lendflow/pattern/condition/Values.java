package io.lendflow.pattern.condition;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

final class Values {
    private Values() {
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return toDecimal(value).signum() != 0;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    static boolean same(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return toDecimal(left).compareTo(toDecimal(right)) == 0;
        }
        return Objects.equals(left, right);
    }

    @SuppressWarnings("unchecked")
    static int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return toDecimal(left).compareTo(toDecimal(right));
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        if (left != null && right != null && left.getClass().equals(right.getClass()) && left instanceof Comparable) {
            return ((Comparable<Object>) left).compareTo(right);
        }
        throw new ConditionEvaluationException("Cannot order " + describe(left) + " and " + describe(right));
    }

    static boolean contains(Object container, Object item) {
        if (container instanceof Collection) {
            for (Object candidate : (Collection<?>) container) {
                if (same(candidate, item)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof Map) {
            return ((Map<?, ?>) container).containsKey(item);
        }
        if (container instanceof String && item instanceof String) {
            return ((String) container).contains((String) item);
        }
        throw new ConditionEvaluationException("Cannot test membership in " + describe(container));
    }

    private static BigDecimal toDecimal(Object number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof Double || number instanceof Float) {
            double d = ((Number) number).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ConditionEvaluationException("Cannot compare non-finite number " + number);
            }
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            throw new ConditionEvaluationException("Not a decimal number: " + number);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
