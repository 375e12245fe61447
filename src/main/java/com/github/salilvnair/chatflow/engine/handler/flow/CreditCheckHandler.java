package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.domain.NotificationScheduler;
import com.github.salilvnair.chatflow.domain.TaxComputationService;
import com.github.salilvnair.chatflow.engine.handler.AbstractFlowHandler;
import com.github.salilvnair.chatflow.engine.handler.HandlerOutcome;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Input tax credit reconciliation against supplier filings.
 */
@Component
public class CreditCheckHandler extends AbstractFlowHandler {

    private final TaxComputationService taxService;
    private final NotificationScheduler notificationScheduler;

    public CreditCheckHandler(ReplyComposer replies,
                              TaxComputationService taxService,
                              NotificationScheduler notificationScheduler) {
        super(replies, ConversationState.MEDIUM_CREDIT_CHECK, ConversationState.MEDIUM_CREDIT_RESULT);
        this.taxService = taxService;
        this.notificationScheduler = notificationScheduler;
    }

    @Override
    public HandlerOutcome handle(EngineSession session) {
        ChatSession chat = session.getSession();
        String gstin = chat.getString(SessionKeys.GSTIN);
        if (gstin == null) {
            chat.put(SessionKeys.AFTER_GSTIN, ConversationState.MEDIUM_CREDIT_CHECK.name());
            return HandlerOutcome.handled(
                    message(session, "gst.gstin_required"),
                    enter(session, ConversationState.WAIT_GSTIN, true)
            );
        }
        if (chat.getState() == ConversationState.MEDIUM_CREDIT_CHECK) {
            return runCheck(session, chat, gstin);
        }
        return result(session, chat, gstin);
    }

    private HandlerOutcome runCheck(EngineSession session, ChatSession chat, String gstin) {
        if (!"1".equals(session.userText())) {
            return HandlerOutcome.pass();
        }
        TaxComputationService.CreditReconciliation reconciliation = taxService.reconcileCredit(gstin);
        chat.put(SessionKeys.CREDIT_MATCHED, reconciliation.matchedCredit().toPlainString());
        chat.put(SessionKeys.CREDIT_MISMATCHED, reconciliation.mismatchedCredit().toPlainString());
        chat.put(SessionKeys.CREDIT_ADDITIONAL, reconciliation.additionalCredit().toPlainString());
        chat.put(SessionKeys.CREDIT_MISMATCHED_SUPPLIERS, reconciliation.mismatchedSuppliers());
        return HandlerOutcome.handled(enter(session, ConversationState.MEDIUM_CREDIT_RESULT, false));
    }

    private HandlerOutcome result(EngineSession session, ChatSession chat, String gstin) {
        switch (session.userText()) {
            case "1":
                return HandlerOutcome.handled(enter(session, ConversationState.GST_PERIOD_MENU, false));
            case "2":
                return HandlerOutcome.handled(message(session, "credit.details"));
            case "3": {
                Object suppliers = chat.get(SessionKeys.CREDIT_MISMATCHED_SUPPLIERS);
                int count = suppliers instanceof Number ? ((Number) suppliers).intValue() : 0;
                notificationScheduler.notifySuppliers(chat.getUserId(), gstin, count);
                return HandlerOutcome.handled(message(session, "credit.suppliers_notified", Map.of("count", count)));
            }
            default: {
                ConversationState previous = chat.goBack();
                if (previous == null) {
                    chat.transitionTo(ConversationState.MAIN_MENU, false);
                }
                return HandlerOutcome.handled(replies.prompt(chat));
            }
        }
    }
}
