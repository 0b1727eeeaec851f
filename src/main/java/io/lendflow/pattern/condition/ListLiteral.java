package io.lendflow.pattern.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record ListLiteral(List<Expression> elements) implements Expression {
    public ListLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public Object evaluate(Map<String, Object> context) {
        List<Object> out = new ArrayList<>(elements.size());
        for (Expression element : elements) {
            out.add(element.evaluate(context));
        }
        return out;
    }
}
