package com.templet.error;

public enum ErrorKind {
    INVALID_TAG,
    MISSING_TAG,
    EXPRESSION_SYNTAX
}
