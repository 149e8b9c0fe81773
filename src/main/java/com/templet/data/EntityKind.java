package com.templet.data;

public enum EntityKind {
    STRING,
    LIST,
    MAP
}
