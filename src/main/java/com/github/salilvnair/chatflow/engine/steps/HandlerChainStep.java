package com.github.salilvnair.chatflow.engine.steps;

import com.github.salilvnair.chatflow.engine.handler.HandlerChainDispatcher;
import com.github.salilvnair.chatflow.engine.handler.HandlerOutcome;
import com.github.salilvnair.chatflow.engine.pipeline.EngineStep;
import com.github.salilvnair.chatflow.engine.pipeline.StepResult;
import com.github.salilvnair.chatflow.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@MustRunAfter(IdleResumeStep.class)
public class HandlerChainStep implements EngineStep {

    private final HandlerChainDispatcher dispatcher;

    @Override
    public StepResult execute(EngineSession session) {
        Optional<HandlerOutcome.Handled> handled = dispatcher.dispatch(session);
        if (handled.isEmpty()) {
            return new StepResult.Continue();
        }
        session.addReplies(handled.get().replies());
        return new StepResult.Stop(session.toResult());
    }
}
