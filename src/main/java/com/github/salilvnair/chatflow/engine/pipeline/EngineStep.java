package com.github.salilvnair.chatflow.engine.pipeline;

import com.github.salilvnair.chatflow.engine.session.EngineSession;

public interface EngineStep {
    StepResult execute(EngineSession session);
}
