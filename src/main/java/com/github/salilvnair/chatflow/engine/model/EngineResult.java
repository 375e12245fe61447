package com.github.salilvnair.chatflow.engine.model;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.engine.state.ConversationState;

import java.util.List;

public record EngineResult(
        String userId,
        ConversationState state,
        List<OutboundPayload> replies,
        long version,
        boolean duplicate
) {
}
