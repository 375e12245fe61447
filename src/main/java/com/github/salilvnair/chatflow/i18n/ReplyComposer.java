package com.github.salilvnair.chatflow.i18n;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.template.ThymeleafTemplateRenderer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class ReplyComposer {

    public static final String DID_NOT_UNDERSTAND = "notice.did_not_understand";
    public static final String APOLOGY = "error.apology";

    private final MessageCatalog catalog;
    private final ThymeleafTemplateRenderer renderer;

    public String text(ChatSession session, String key, Map<String, Object> variables) {
        return renderer.render(catalog.template(key, session.getLanguage()), session, variables);
    }

    public OutboundPayload message(ChatSession session, String key) {
        return message(session, key, Map.of());
    }

    public OutboundPayload message(ChatSession session, String key, Map<String, Object> variables) {
        return OutboundPayload.text(text(session, key, variables));
    }

    public OutboundPayload prompt(ChatSession session) {
        return prompt(session, session.getState());
    }

    public OutboundPayload prompt(ChatSession session, ConversationState state) {
        return message(session, state.promptKey());
    }

    /** Notice line followed by the prompt of the current state, as a single message. */
    public OutboundPayload noticeWithPrompt(ChatSession session, String noticeKey, Map<String, Object> variables) {
        String notice = text(session, noticeKey, variables);
        String prompt = text(session, session.getState().promptKey(), Map.of());
        return OutboundPayload.text(notice + "\n\n" + prompt);
    }
}
