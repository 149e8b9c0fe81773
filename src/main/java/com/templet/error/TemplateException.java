package com.templet.error;

public abstract class TemplateException extends RuntimeException {
    private final ErrorKind kind;

    protected TemplateException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static TemplateException of(ErrorKind kind, String message) {
        return switch (kind) {
            case INVALID_TAG -> new InvalidTagException(message);
            case MISSING_TAG -> new MissingTagException(message);
            case EXPRESSION_SYNTAX -> new ExpressionSyntaxException(message);
        };
    }
}
