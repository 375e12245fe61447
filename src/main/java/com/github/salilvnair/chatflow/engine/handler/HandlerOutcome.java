package com.github.salilvnair.chatflow.engine.handler;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;

import java.util.List;

public sealed interface HandlerOutcome permits HandlerOutcome.Handled, HandlerOutcome.Pass {

    record Handled(List<OutboundPayload> replies) implements HandlerOutcome {
        public Handled {
            replies = replies == null ? List.of() : List.copyOf(replies);
        }
    }

    record Pass() implements HandlerOutcome {}

    static HandlerOutcome handled(OutboundPayload... replies) {
        return new Handled(List.of(replies));
    }

    static HandlerOutcome pass() {
        return new Pass();
    }
}
