package com.github.salilvnair.chatflow.engine.hook;

import com.github.salilvnair.chatflow.engine.pipeline.StepResult;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingStepHook implements EngineStepHook {

    @Override
    public boolean supports(String stepName, EngineSession session) {
        return log.isDebugEnabled();
    }

    @Override
    public void beforeStep(String stepName, EngineSession session) {
        log.debug("step={} enter userId={} state={}", stepName, session.getUserId(), session.getState());
    }

    @Override
    public void afterStep(String stepName, EngineSession session, StepResult result) {
        log.debug("step={} exit userId={} state={} outcome={}",
                stepName, session.getUserId(), session.getState(), result.getClass().getSimpleName());
    }

    @Override
    public void onStepError(String stepName, EngineSession session, Throwable error) {
        log.debug("step={} error userId={} state={} error={}",
                stepName, session.getUserId(), session.getState(), error.toString());
    }
}
