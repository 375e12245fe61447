package com.github.salilvnair.chatflow.engine.handler;

import java.util.List;
import java.util.Objects;

/**
 * Fixed, ordered handler registry. Order is part of the routing contract.
 */
public final class HandlerChain {

    private final List<FlowHandler> handlers;

    public HandlerChain(List<FlowHandler> handlers) {
        this.handlers = List.copyOf(Objects.requireNonNull(handlers, "handlers"));
    }

    public static HandlerChain of(FlowHandler... handlers) {
        return new HandlerChain(List.of(handlers));
    }

    public List<FlowHandler> handlers() {
        return handlers;
    }
}
