package com.my.notegraph.domain.model;

public enum FsEventType {
    ADDED,
    CHANGED,
    DELETED
}
