package com.github.salilvnair.chatflow.engine.pipeline;

import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowException;
import com.github.salilvnair.chatflow.engine.model.EngineResult;
import com.github.salilvnair.chatflow.engine.session.EngineSession;

import java.util.List;

public final class EnginePipeline {

    private final List<EngineStep> steps;

    public EnginePipeline(List<EngineStep> steps) {
        this.steps = steps;
    }

    public EngineResult execute(EngineSession session) {
        for (EngineStep step : steps) {
            StepResult r = step.execute(session);
            if (r instanceof StepResult.Stop) {
                return ((StepResult.Stop) r).result();
            }
        }
        // the terminal step always stops
        throw new ChatFlowException(ChatFlowErrorCode.PIPELINE_NO_RESULT);
    }

    public List<EngineStep> steps() {
        return steps;
    }
}
