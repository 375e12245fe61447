package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.domain.TaxComputationService;
import com.github.salilvnair.chatflow.engine.handler.AbstractFlowHandler;
import com.github.salilvnair.chatflow.engine.handler.HandlerOutcome;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.engine.transition.InputClassifier;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class NilFilingHandler extends AbstractFlowHandler {

    private static final Map<String, List<String>> CHOICES = Map.of(
            "1", List.of("GSTR-3B"),
            "2", List.of("GSTR-1"),
            "3", List.of("GSTR-3B", "GSTR-1")
    );

    private final TaxComputationService taxService;

    public NilFilingHandler(ReplyComposer replies, TaxComputationService taxService) {
        super(replies, ConversationState.NIL_FILING_MENU, ConversationState.NIL_FILING_CONFIRM);
        this.taxService = taxService;
    }

    @Override
    public HandlerOutcome handle(EngineSession session) {
        ChatSession chat = session.getSession();
        if (chat.getString(SessionKeys.GSTIN) == null) {
            chat.put(SessionKeys.AFTER_GSTIN, ConversationState.NIL_FILING_MENU.name());
            return HandlerOutcome.handled(
                    message(session, "gst.gstin_required"),
                    enter(session, ConversationState.WAIT_GSTIN, true)
            );
        }
        if (chat.getState() == ConversationState.NIL_FILING_MENU) {
            return selectReturns(session, chat);
        }
        return confirm(session, chat);
    }

    private HandlerOutcome selectReturns(EngineSession session, ChatSession chat) {
        List<String> returns = CHOICES.get(session.userText());
        if (returns == null) {
            return HandlerOutcome.pass();
        }
        chat.put(SessionKeys.NIL_RETURNS, returns);
        chat.put(SessionKeys.NIL_RETURNS_LABEL, String.join(" + ", returns));
        return HandlerOutcome.handled(enter(session, ConversationState.NIL_FILING_CONFIRM, false));
    }

    @SuppressWarnings("unchecked")
    private HandlerOutcome confirm(EngineSession session, ChatSession chat) {
        if (!InputClassifier.isAffirmative(session.userText())) {
            chat.remove(SessionKeys.NIL_RETURNS);
            chat.remove(SessionKeys.NIL_RETURNS_LABEL);
            return HandlerOutcome.handled(
                    message(session, "nil.cancelled"),
                    enter(session, ConversationState.NIL_FILING_MENU, false)
            );
        }
        List<String> returns = (List<String>) chat.get(SessionKeys.NIL_RETURNS);
        String gstin = chat.getString(SessionKeys.GSTIN);
        TaxComputationService.FilingReceipt receipt = taxService.prepareNilReturns(gstin, returns);
        log.info("NIL returns prepared userId={} returns={} ref={}", chat.getUserId(), returns, receipt.reference());
        String label = chat.getString(SessionKeys.NIL_RETURNS_LABEL);
        chat.clearFlowData();
        return HandlerOutcome.handled(
                message(session, "nil.prepared", Map.of("reference", receipt.reference(), "returns", label)),
                enter(session, ConversationState.MAIN_MENU, false)
        );
    }
}
