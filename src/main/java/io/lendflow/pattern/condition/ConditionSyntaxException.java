package io.lendflow.pattern.condition;

public class ConditionSyntaxException extends RuntimeException {
    private final int position;

    public ConditionSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
