package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.engine.handler.AbstractFlowHandler;
import com.github.salilvnair.chatflow.engine.handler.HandlerOutcome;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import org.springframework.stereotype.Component;

/**
 * Resume prompt shown after a long idle gap, and the re-review step for confirmations
 * that went stale while the user was away.
 */
@Component
public class SessionExpiryHandler extends AbstractFlowHandler {

    public SessionExpiryHandler(ReplyComposer replies) {
        super(replies, ConversationState.SESSION_RESUME_PROMPT, ConversationState.SENSITIVE_CONFIRM_EXPIRED);
    }

    @Override
    public HandlerOutcome handle(EngineSession session) {
        ChatSession chat = session.getSession();
        ConversationState previous = ConversationState.fromName(chat.getString(SessionKeys.PRE_EXPIRY_STATE))
                .orElse(ConversationState.MAIN_MENU);

        if (chat.getState() == ConversationState.SENSITIVE_CONFIRM_EXPIRED) {
            chat.remove(SessionKeys.PRE_EXPIRY_STATE);
            return HandlerOutcome.handled(enter(session, previous, false));
        }

        switch (session.userText()) {
            case "1":
                chat.remove(SessionKeys.PRE_EXPIRY_STATE);
                return HandlerOutcome.handled(enter(session, previous, false));
            case "2":
                chat.remove(SessionKeys.PRE_EXPIRY_STATE);
                chat.clearFlowData();
                chat.restartAt(previous.module().menuState());
                return HandlerOutcome.handled(replies.prompt(chat));
            case "3":
                chat.remove(SessionKeys.PRE_EXPIRY_STATE);
                chat.clearFlowData();
                return HandlerOutcome.handled(enter(session, ConversationState.MAIN_MENU, false));
            default:
                return HandlerOutcome.pass();
        }
    }
}
