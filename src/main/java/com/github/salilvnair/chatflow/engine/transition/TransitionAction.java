package com.github.salilvnair.chatflow.engine.transition;

import com.github.salilvnair.chatflow.engine.session.EngineSession;

/**
 * Work done when a rule fires. May call domain facades and add replies to the session;
 * failures are thrown as {@code ValidationException} or {@code DomainServiceException}.
 */
@FunctionalInterface
public interface TransitionAction {

    TransitionAction NONE = (session, input) -> ActionResult.proceed();

    ActionResult execute(EngineSession session, ClassifiedInput input);
}
