package com.templet.error;

public class ExpressionSyntaxException extends TemplateException {
    public ExpressionSyntaxException(String message) {
        super(ErrorKind.EXPRESSION_SYNTAX, message);
    }
}
