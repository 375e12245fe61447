package com.github.salilvnair.chatflow.engine.exception;

public enum ChatFlowErrorCode {

    // =========================
    // User input
    // =========================
    INVALID_INPUT(
            "Input could not be accepted in the current state",
            true
    ),

    INVALID_IDENTIFIER(
            "Identifier failed format validation",
            true
    ),

    // =========================
    // Session
    // =========================
    SESSION_VERSION_CONFLICT(
            "Session was modified concurrently",
            true
    ),

    SESSION_CONFLICT_RETRIES_EXHAUSTED(
            "Session could not be saved after repeated conflicts",
            false
    ),

    UNKNOWN_STATE(
            "Session refers to an unknown conversation state",
            false
    ),

    // =========================
    // Domain services
    // =========================
    DOMAIN_SERVICE_FAILED(
            "Domain service call failed",
            true
    ),

    SERVICE_UNAVAILABLE(
            "Domain service is not configured",
            false
    ),

    // =========================
    // Delivery
    // =========================
    DELIVERY_TRANSIENT_FAILURE(
            "Outbound send failed transiently",
            true
    ),

    DELIVERY_PERMANENT_FAILURE(
            "Outbound send was rejected permanently",
            false
    ),

    DEAD_LETTER_NOT_FOUND(
            "Dead letter entry not found",
            false
    ),

    // =========================
    // Engine wiring
    // =========================
    DUPLICATE_ENGINE_STEP(
            "Duplicate engine step bean",
            false
    ),

    MISSING_TERMINAL_STEP(
            "Exactly one terminal step is required",
            false
    ),

    MISSING_DEPENDENT_STEP(
            "Engine step depends on a step that is not registered",
            false
    ),

    PIPELINE_CYCLE(
            "Engine step ordering constraints contain a cycle",
            false
    ),

    PIPELINE_NO_RESULT(
            "Pipeline finished without producing a result",
            false
    ),

    DUPLICATE_TRANSITION_RULE(
            "Transition rule registered twice for the same key",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    ChatFlowErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
