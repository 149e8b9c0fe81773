package com.templet.name;

import com.templet.data.Entity;
import com.templet.error.ErrorKind;
import com.templet.error.TemplateException;

public sealed interface Resolution {
    record Found(Entity entity) implements Resolution {}
    record Failed(ErrorKind kind, String message) implements Resolution {}

    static Resolution found(Entity entity) {
        return new Found(entity);
    }

    static Resolution missing(String message) {
        return new Failed(ErrorKind.MISSING_TAG, message);
    }

    static Resolution invalid(String message) {
        return new Failed(ErrorKind.INVALID_TAG, message);
    }

    default boolean isMissing() {
        return this instanceof Failed failed && failed.kind() == ErrorKind.MISSING_TAG;
    }

    default Entity orElseThrow() {
        if (this instanceof Found found) {
            return found.entity();
        }
        Failed failed = (Failed) this;
        throw TemplateException.of(failed.kind(), failed.message());
    }
}
