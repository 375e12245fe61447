package com.github.salilvnair.chatflow.engine.model;

public enum InboundEventType {
    TEXT,
    IMAGE,
    DOCUMENT,
    INTERACTIVE_REPLY;

    public boolean isMedia() {
        return this == IMAGE || this == DOCUMENT;
    }
}
