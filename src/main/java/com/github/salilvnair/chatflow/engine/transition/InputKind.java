package com.github.salilvnair.chatflow.engine.transition;

public enum InputKind {
    NUMERIC_CHOICE,
    CONFIRMATION,
    FREE_TEXT,
    MEDIA
}
