package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.engine.handler.AbstractFlowHandler;
import com.github.salilvnair.chatflow.engine.handler.HandlerOutcome;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import org.springframework.stereotype.Component;

@Component
public class ModuleSwitchHandler extends AbstractFlowHandler {

    public ModuleSwitchHandler(ReplyComposer replies) {
        super(replies, ConversationState.CONFIRM_SWITCH_MODULE);
    }

    @Override
    public HandlerOutcome handle(EngineSession session) {
        ChatSession chat = session.getSession();
        ConversationState target = ConversationState.fromName(chat.getString(SessionKeys.SWITCH_TARGET))
                .orElse(ConversationState.MAIN_MENU);
        ConversationState source = ConversationState.fromName(chat.getString(SessionKeys.SWITCH_SOURCE))
                .orElse(ConversationState.MAIN_MENU);

        switch (session.userText()) {
            case "1":
                chat.clearFlowData();
                chat.restartAt(target);
                return HandlerOutcome.handled(replies.prompt(chat));
            case "2":
                clearSwitch(chat);
                return HandlerOutcome.handled(enter(session, source, false));
            default:
                return HandlerOutcome.pass();
        }
    }

    private void clearSwitch(ChatSession chat) {
        chat.remove(SessionKeys.SWITCH_SOURCE);
        chat.remove(SessionKeys.SWITCH_TARGET);
        chat.remove(SessionKeys.SWITCH_SOURCE_LABEL);
        chat.remove(SessionKeys.SWITCH_TARGET_LABEL);
    }
}
