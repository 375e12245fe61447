package com.github.salilvnair.chatflow.engine.transition.rules;

import com.github.salilvnair.chatflow.domain.IdentifierValidator;
import com.github.salilvnair.chatflow.domain.TaxComputationService;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ValidationException;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.engine.transition.ActionResult;
import com.github.salilvnair.chatflow.engine.transition.ClassifiedInput;
import com.github.salilvnair.chatflow.engine.transition.TransitionAction;
import com.github.salilvnair.chatflow.engine.transition.TransitionTable;
import com.github.salilvnair.chatflow.engine.transition.TransitionTableContributor;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.github.salilvnair.chatflow.engine.state.ConversationState.*;

/**
 * GST menu, GSTIN capture and the GSTR-3B / GSTR-1 filing flow.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GstTransitions implements TransitionTableContributor {

    static final String GSTR_3B = "GSTR-3B";
    static final String GSTR_1 = "GSTR-1";

    private final IdentifierValidator identifierValidator;
    private final TaxComputationService taxService;
    private final ReplyComposer replies;

    @Override
    public void contribute(TransitionTable.Builder table) {
        table.choice(GST_MENU, "1", GST_PERIOD_MENU, true, requireGstin(GST_PERIOD_MENU))
                .choice(GST_MENU, "2", WAIT_INVOICE_UPLOAD)
                .choice(GST_MENU, "3", MEDIUM_CREDIT_CHECK)
                .choice(GST_MENU, "4", NIL_FILING_MENU)
                .choice(GST_MENU, "5", MULTI_GSTIN_MENU)
                .choice(GST_MENU, "6", GST_FILING_STATUS);

        table.text(WAIT_GSTIN, GST_MENU, this::captureGstin);

        table.choice(GST_PERIOD_MENU, "1", ASK_GST_PERIOD_3B, true, returnType(GSTR_3B))
                .choice(GST_PERIOD_MENU, "2", ASK_GST_PERIOD_1, true, returnType(GSTR_1));

        table.text(ASK_GST_PERIOD_3B, GST_FILING_CONFIRM, this::prepareReturn)
                .text(ASK_GST_PERIOD_1, GST_FILING_CONFIRM, this::prepareReturn);

        table.confirmation(GST_FILING_CONFIRM, "yes", GST_FILING_STATUS, this::fileReturn)
                .confirmation(GST_FILING_CONFIRM, "no", GST_MENU, (session, input) -> {
                    session.getSession().clearFlowData();
                    session.addReply(replies.message(session.getSession(), "gst.filing_cancelled"));
                    return ActionResult.proceed();
                });

        table.choice(GST_FILING_STATUS, "1", GST_MENU, false, TransitionAction.NONE)
                .choice(GST_FILING_STATUS, "2", MAIN_MENU, false, TransitionAction.NONE);
    }

    private TransitionAction requireGstin(ConversationState then) {
        return (session, input) -> {
            ChatSession chat = session.getSession();
            if (chat.getString(SessionKeys.GSTIN) != null) {
                return ActionResult.proceed();
            }
            chat.put(SessionKeys.AFTER_GSTIN, then.name());
            session.addReply(replies.message(chat, "gst.gstin_required"));
            return ActionResult.redirect(WAIT_GSTIN);
        };
    }

    private TransitionAction returnType(String type) {
        return (session, input) -> {
            session.getSession().put(SessionKeys.GST_FILING_RETURN_TYPE, type);
            return ActionResult.proceed();
        };
    }

    private ActionResult captureGstin(EngineSession session, ClassifiedInput input) {
        String gstin = identifierValidator.normalize(input.raw());
        if (!identifierValidator.isValidGstin(gstin)) {
            throw new ValidationException(ChatFlowErrorCode.INVALID_IDENTIFIER, "error.invalid_gstin", Map.of());
        }
        ChatSession chat = session.getSession();
        chat.put(SessionKeys.GSTIN, gstin);
        chat.put(SessionKeys.GST_ONBOARDED, Boolean.TRUE);
        session.addReply(replies.message(chat, "gst.gstin_saved", Map.of("gstin", gstin)));
        ConversationState next = ConversationState.fromName((String) chat.remove(SessionKeys.AFTER_GSTIN))
                .orElse(GST_MENU);
        return ActionResult.redirect(next);
    }

    private ActionResult prepareReturn(EngineSession session, ClassifiedInput input) {
        ChatSession chat = session.getSession();
        String period = InputParsers.period(input.raw());
        String returnType = chat.getState() == ASK_GST_PERIOD_1 ? GSTR_1 : GSTR_3B;
        TaxComputationService.GstReturnSummary summary =
                taxService.prepareReturn(chat.getString(SessionKeys.GSTIN), returnType, period);
        chat.put(SessionKeys.GST_FILING_RETURN_TYPE, returnType);
        chat.put(SessionKeys.GST_FILING_PERIOD, period);
        chat.put(SessionKeys.GST_FILING_OUTPUT_TAX, summary.outputTax().toPlainString());
        chat.put(SessionKeys.GST_FILING_ITC, summary.inputTaxCredit().toPlainString());
        chat.put(SessionKeys.GST_FILING_NET, summary.netPayable().toPlainString());
        return ActionResult.proceed();
    }

    private ActionResult fileReturn(EngineSession session, ClassifiedInput input) {
        ChatSession chat = session.getSession();
        String returnType = chat.getString(SessionKeys.GST_FILING_RETURN_TYPE);
        String period = chat.getString(SessionKeys.GST_FILING_PERIOD);
        TaxComputationService.FilingReceipt receipt =
                taxService.fileReturn(chat.getString(SessionKeys.GSTIN), returnType, period);
        log.info("Return filed userId={} type={} period={} ref={}", chat.getUserId(), returnType, period, receipt.reference());
        chat.put(SessionKeys.LAST_FILING_REFERENCE, receipt.reference());
        chat.clearFlowData();
        session.addReply(replies.message(chat, "gst.filed",
                Map.of("returnType", returnType, "period", period, "reference", receipt.reference())));
        return ActionResult.proceed();
    }
}
