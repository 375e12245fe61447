package com.github.salilvnair.chatflow.engine.steps;

import com.github.salilvnair.chatflow.engine.pipeline.EngineStep;
import com.github.salilvnair.chatflow.engine.pipeline.StepResult;
import com.github.salilvnair.chatflow.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.transition.StateTransitionCore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@TerminalStep
public class StateTransitionStep implements EngineStep {

    private final StateTransitionCore core;

    @Override
    public StepResult execute(EngineSession session) {
        core.apply(session);
        return new StepResult.Stop(session.toResult());
    }
}
