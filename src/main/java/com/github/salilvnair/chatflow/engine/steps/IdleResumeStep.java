package com.github.salilvnair.chatflow.engine.steps;

import com.github.salilvnair.chatflow.config.ChatFlowSessionConfig;
import com.github.salilvnair.chatflow.engine.pipeline.EngineStep;
import com.github.salilvnair.chatflow.engine.pipeline.StepResult;
import com.github.salilvnair.chatflow.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * After a long idle gap the user is asked whether to continue where they left off.
 * Pending confirmations are never resumed silently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@MustRunAfter(GlobalCommandStep.class)
public class IdleResumeStep implements EngineStep {

    private static final Set<ConversationState> EXEMPT = EnumSet.of(
            ConversationState.MAIN_MENU,
            ConversationState.SESSION_RESUME_PROMPT,
            ConversationState.SENSITIVE_CONFIRM_EXPIRED
    );

    private final ChatFlowSessionConfig sessionConfig;
    private final ReplyComposer replies;

    @Override
    public StepResult execute(EngineSession session) {
        ChatSession chat = session.getSession();
        if (session.isNewSession() || EXEMPT.contains(chat.getState()) || !idle(chat.getLastActive(), session.getNow())) {
            return new StepResult.Continue();
        }
        ConversationState previous = chat.getState();
        ConversationState prompt = previous.isConfirmation()
                ? ConversationState.SENSITIVE_CONFIRM_EXPIRED
                : ConversationState.SESSION_RESUME_PROMPT;
        log.info("Idle session resumed userId={} state={} lastActive={}", chat.getUserId(), previous, chat.getLastActive());
        chat.put(SessionKeys.PRE_EXPIRY_STATE, previous.name());
        chat.transitionTo(prompt, false);
        session.addReply(replies.prompt(chat));
        return new StepResult.Stop(session.toResult());
    }

    private boolean idle(Instant lastActive, Instant now) {
        Duration threshold = sessionConfig.getIdleResumeAfter();
        return threshold != null && lastActive != null && lastActive.plus(threshold).isBefore(now);
    }
}
