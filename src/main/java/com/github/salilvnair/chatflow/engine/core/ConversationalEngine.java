package com.github.salilvnair.chatflow.engine.core;

import com.github.salilvnair.chatflow.engine.model.EngineResult;
import com.github.salilvnair.chatflow.engine.model.InboundEvent;

public interface ConversationalEngine {
    EngineResult process(InboundEvent event);
}
