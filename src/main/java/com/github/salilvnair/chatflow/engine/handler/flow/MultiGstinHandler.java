package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.domain.IdentifierValidator;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ValidationException;
import com.github.salilvnair.chatflow.engine.handler.AbstractFlowHandler;
import com.github.salilvnair.chatflow.engine.handler.HandlerOutcome;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Several GSTINs under one account; one of them is the active {@code gstin}.
 */
@Component
public class MultiGstinHandler extends AbstractFlowHandler {

    static final int MAX_LABEL_LENGTH = 40;

    private final IdentifierValidator identifierValidator;

    public MultiGstinHandler(ReplyComposer replies, IdentifierValidator identifierValidator) {
        super(
                replies,
                ConversationState.MULTI_GSTIN_MENU,
                ConversationState.MULTI_GSTIN_ADD,
                ConversationState.MULTI_GSTIN_LABEL,
                ConversationState.MULTI_GSTIN_SWITCH,
                ConversationState.MULTI_GSTIN_SUMMARY
        );
        this.identifierValidator = identifierValidator;
    }

    @Override
    public HandlerOutcome handle(EngineSession session) {
        ChatSession chat = session.getSession();
        return switch (chat.getState()) {
            case MULTI_GSTIN_MENU -> menu(session, chat);
            case MULTI_GSTIN_ADD -> add(session, chat);
            case MULTI_GSTIN_LABEL -> label(session, chat);
            case MULTI_GSTIN_SWITCH -> switchActive(session, chat);
            default -> HandlerOutcome.handled(enter(session, ConversationState.MULTI_GSTIN_MENU, false));
        };
    }

    private HandlerOutcome menu(EngineSession session, ChatSession chat) {
        switch (session.userText()) {
            case "1":
                return HandlerOutcome.handled(enter(session, ConversationState.MULTI_GSTIN_ADD, true));
            case "2":
                if (entries(chat).isEmpty()) {
                    return HandlerOutcome.handled(noticeWithPrompt(session, "multi.none"));
                }
                chat.transitionTo(ConversationState.MULTI_GSTIN_SWITCH, true);
                return HandlerOutcome.handled(message(session, ConversationState.MULTI_GSTIN_SWITCH.promptKey(), listVariables(chat)));
            case "3":
                chat.transitionTo(ConversationState.MULTI_GSTIN_SUMMARY, true);
                return HandlerOutcome.handled(message(session, ConversationState.MULTI_GSTIN_SUMMARY.promptKey(), listVariables(chat)));
            default:
                return HandlerOutcome.pass();
        }
    }

    private HandlerOutcome add(EngineSession session, ChatSession chat) {
        String gstin = identifierValidator.normalize(session.userText());
        if (!identifierValidator.isValidGstin(gstin)) {
            throw new ValidationException(ChatFlowErrorCode.INVALID_IDENTIFIER, "error.invalid_gstin", Map.of());
        }
        boolean duplicate = entries(chat).stream().anyMatch(e -> gstin.equals(e.get("gstin")));
        if (duplicate) {
            throw new ValidationException(ChatFlowErrorCode.INVALID_INPUT, "multi.duplicate", Map.of("gstin", gstin));
        }
        chat.put(SessionKeys.MULTI_PENDING_GSTIN, gstin);
        return HandlerOutcome.handled(enter(session, ConversationState.MULTI_GSTIN_LABEL, false));
    }

    private HandlerOutcome label(EngineSession session, ChatSession chat) {
        String label = session.userText();
        if (label.isEmpty()) {
            return HandlerOutcome.pass();
        }
        if (label.length() > MAX_LABEL_LENGTH) {
            label = label.substring(0, MAX_LABEL_LENGTH);
        }
        String gstin = (String) chat.remove(SessionKeys.MULTI_PENDING_GSTIN);
        if (gstin == null) {
            return HandlerOutcome.handled(enter(session, ConversationState.MULTI_GSTIN_MENU, false));
        }
        List<Map<String, String>> updated = new ArrayList<>(entries(chat));
        Map<String, String> entry = new LinkedHashMap<>();
        entry.put("gstin", gstin);
        entry.put("label", label);
        updated.add(entry);
        chat.put(SessionKeys.MULTI_GSTIN, updated);
        if (chat.getString(SessionKeys.GSTIN) == null) {
            chat.put(SessionKeys.GSTIN, gstin);
            chat.put(SessionKeys.GST_ONBOARDED, Boolean.TRUE);
        }
        return HandlerOutcome.handled(
                message(session, "multi.added", Map.of("gstin", gstin, "label", label)),
                enter(session, ConversationState.MULTI_GSTIN_MENU, false)
        );
    }

    private HandlerOutcome switchActive(EngineSession session, ChatSession chat) {
        List<Map<String, String>> entries = entries(chat);
        int index;
        try {
            index = Integer.parseInt(session.userText()) - 1;
        }
        catch (NumberFormatException e) {
            index = -1;
        }
        if (index < 0 || index >= entries.size()) {
            throw new ValidationException(ChatFlowErrorCode.INVALID_INPUT, "multi.invalid_choice", Map.of("count", entries.size()));
        }
        Map<String, String> chosen = entries.get(index);
        chat.put(SessionKeys.GSTIN, chosen.get("gstin"));
        return HandlerOutcome.handled(
                message(session, "multi.switched", Map.of("gstin", chosen.get("gstin"), "label", chosen.get("label"))),
                enter(session, ConversationState.MULTI_GSTIN_MENU, false)
        );
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, String>> entries(ChatSession chat) {
        Object value = chat.get(SessionKeys.MULTI_GSTIN);
        return value instanceof List ? (List<Map<String, String>>) value : List.of();
    }

    private Map<String, Object> listVariables(ChatSession chat) {
        List<Map<String, String>> entries = entries(chat);
        String active = chat.getString(SessionKeys.GSTIN);
        StringBuilder lines = new StringBuilder();
        for (int i = 0; i < entries.size(); i++) {
            Map<String, String> entry = entries.get(i);
            if (i > 0) {
                lines.append('\n');
            }
            lines.append(i + 1).append(". ").append(entry.get("label")).append(" - ").append(entry.get("gstin"));
            if (entry.get("gstin").equals(active)) {
                lines.append(" *");
            }
        }
        return Map.of("gstin_list", lines.toString(), "count", entries.size());
    }
}
