package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.domain.NotificationScheduler;
import com.github.salilvnair.chatflow.engine.handler.AbstractFlowHandler;
import com.github.salilvnair.chatflow.engine.handler.HandlerOutcome;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import org.springframework.stereotype.Component;

@Component
public class ConnectCaHandler extends AbstractFlowHandler {

    static final int MAX_QUESTION_LENGTH = 1000;

    private final NotificationScheduler notificationScheduler;

    public ConnectCaHandler(ReplyComposer replies, NotificationScheduler notificationScheduler) {
        super(replies, ConversationState.CONNECT_CA_MENU, ConversationState.CONNECT_CA_ASK_TEXT);
        this.notificationScheduler = notificationScheduler;
    }

    @Override
    public HandlerOutcome handle(EngineSession session) {
        ChatSession chat = session.getSession();
        if (chat.getState() == ConversationState.CONNECT_CA_MENU) {
            switch (session.userText()) {
                case "1":
                    return HandlerOutcome.handled(enter(session, ConversationState.CONNECT_CA_ASK_TEXT, true));
                case "2":
                    notificationScheduler.requestCaCallback(chat.getUserId(), null);
                    chat.put(SessionKeys.CA_HANDOFF, Boolean.TRUE);
                    return HandlerOutcome.handled(message(session, "ca.callback_requested"));
                default:
                    return HandlerOutcome.pass();
            }
        }

        String question = session.userText();
        if (question.isEmpty()) {
            return HandlerOutcome.pass();
        }
        if (question.length() > MAX_QUESTION_LENGTH) {
            question = question.substring(0, MAX_QUESTION_LENGTH);
        }
        notificationScheduler.requestCaCallback(chat.getUserId(), question);
        chat.put(SessionKeys.CA_HANDOFF, Boolean.TRUE);
        return HandlerOutcome.handled(
                message(session, "ca.question_sent"),
                enter(session, ConversationState.CONNECT_CA_MENU, false)
        );
    }
}
