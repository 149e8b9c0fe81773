package com.templet.error;

public class InvalidTagException extends TemplateException {
    public InvalidTagException(String message) {
        super(ErrorKind.INVALID_TAG, message);
    }
}
