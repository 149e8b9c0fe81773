package com.templet.error;

public class MissingTagException extends TemplateException {
    public MissingTagException(String message) {
        super(ErrorKind.MISSING_TAG, message);
    }
}
