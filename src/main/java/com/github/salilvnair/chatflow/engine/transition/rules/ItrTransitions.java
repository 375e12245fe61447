package com.github.salilvnair.chatflow.engine.transition.rules;

import com.github.salilvnair.chatflow.domain.IdentifierValidator;
import com.github.salilvnair.chatflow.domain.TaxComputationService;
import com.github.salilvnair.chatflow.domain.TaxComputationService.ItrComputation;
import com.github.salilvnair.chatflow.domain.TaxComputationService.ItrInput;
import com.github.salilvnair.chatflow.engine.exception.ChatFlowErrorCode;
import com.github.salilvnair.chatflow.engine.exception.ValidationException;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
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

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.function.Function;

import static com.github.salilvnair.chatflow.engine.state.ConversationState.*;

/**
 * ITR-1 (salaried) and ITR-4 (presumptive business) question flows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ItrTransitions implements TransitionTableContributor {

    static final String ITR1 = "ITR-1";
    static final String ITR4 = "ITR-4";

    private final IdentifierValidator identifierValidator;
    private final TaxComputationService taxService;
    private final ReplyComposer replies;
    private final Clock clock;

    @Override
    public void contribute(TransitionTable.Builder table) {
        table.choice(ITR_MENU, "1", ITR1_ASK_PAN, true, startForm(ITR1))
                .choice(ITR_MENU, "2", ITR4_ASK_PAN, true, startForm(ITR4));

        // ITR-1
        table.text(ITR1_ASK_PAN, ITR1_ASK_NAME, this::capturePan)
                .text(ITR1_ASK_NAME, ITR1_ASK_DOB, capture(SessionKeys.ITR_NAME, InputParsers::name))
                .text(ITR1_ASK_DOB, ITR1_ASK_SALARY, capture(SessionKeys.ITR_DOB, raw -> InputParsers.dateOfBirth(raw, LocalDate.now(clock))))
                .text(ITR1_ASK_SALARY, ITR1_ASK_OTHER_INCOME, captureAmount(SessionKeys.ITR_INCOME))
                .text(ITR1_ASK_OTHER_INCOME, ITR1_ASK_80C, captureAmount(SessionKeys.ITR_OTHER_INCOME))
                .text(ITR1_ASK_80C, ITR1_ASK_TDS, captureAmount(SessionKeys.ITR_DEDUCTIONS))
                .text(ITR1_ASK_TDS, ITR1_CONFIRM, captureAmount(SessionKeys.ITR_TDS))
                .confirmation(ITR1_CONFIRM, "yes", ITR_RESULT, this::compute)
                .confirmation(ITR1_CONFIRM, "no", ITR_MENU, this::discard);

        // ITR-4
        table.text(ITR4_ASK_PAN, ITR4_ASK_NAME, this::capturePan)
                .text(ITR4_ASK_NAME, ITR4_ASK_BUSINESS_TYPE, capture(SessionKeys.ITR_NAME, InputParsers::name))
                .choice(ITR4_ASK_BUSINESS_TYPE, "1", ITR4_ASK_TURNOVER, false, businessType("TRADING"))
                .choice(ITR4_ASK_BUSINESS_TYPE, "2", ITR4_ASK_TURNOVER, false, businessType("PROFESSION"))
                .text(ITR4_ASK_TURNOVER, ITR4_ASK_OTHER_INCOME, captureAmount(SessionKeys.ITR_INCOME))
                .text(ITR4_ASK_OTHER_INCOME, ITR4_ASK_TDS, captureAmount(SessionKeys.ITR_OTHER_INCOME))
                .text(ITR4_ASK_TDS, ITR4_CONFIRM, captureAmount(SessionKeys.ITR_TDS))
                .confirmation(ITR4_CONFIRM, "yes", ITR_RESULT, this::compute)
                .confirmation(ITR4_CONFIRM, "no", ITR_MENU, this::discard);

        table.choice(ITR_RESULT, "1", MAIN_MENU, false, (session, input) -> {
                    session.getSession().clearFlowData();
                    return ActionResult.proceed();
                })
                .choice(ITR_RESULT, "2", ITR_MENU, false, (session, input) -> {
                    session.getSession().clearFlowData();
                    return ActionResult.proceed();
                });
    }

    private TransitionAction startForm(String form) {
        return (session, input) -> {
            ChatSession chat = session.getSession();
            chat.clearFlowData();
            chat.put(SessionKeys.ITR_FORM, form);
            return ActionResult.proceed();
        };
    }

    private TransitionAction businessType(String type) {
        return (session, input) -> {
            session.getSession().put(SessionKeys.ITR_BUSINESS_TYPE, type);
            return ActionResult.proceed();
        };
    }

    private TransitionAction capture(String key, Function<String, String> parser) {
        return (session, input) -> {
            session.getSession().put(key, parser.apply(input.raw()));
            return ActionResult.proceed();
        };
    }

    private TransitionAction captureAmount(String key) {
        return (session, input) -> {
            session.getSession().put(key, InputParsers.amount(input.raw()));
            return ActionResult.proceed();
        };
    }

    private ActionResult capturePan(EngineSession session, ClassifiedInput input) {
        String pan = identifierValidator.normalize(input.raw());
        if (!identifierValidator.isValidPan(pan)) {
            throw new ValidationException(ChatFlowErrorCode.INVALID_IDENTIFIER, "error.invalid_pan", Map.of());
        }
        session.getSession().put(SessionKeys.ITR_PAN, pan);
        return ActionResult.proceed();
    }

    private ActionResult compute(EngineSession session, ClassifiedInput input) {
        ChatSession chat = session.getSession();
        String form = chat.getString(SessionKeys.ITR_FORM);
        ItrInput itrInput = new ItrInput(
                form,
                chat.getString(SessionKeys.ITR_PAN),
                chat.getString(SessionKeys.ITR_NAME),
                chat.getString(SessionKeys.ITR_DOB),
                chat.getString(SessionKeys.ITR_BUSINESS_TYPE),
                longValue(chat, SessionKeys.ITR_INCOME),
                longValue(chat, SessionKeys.ITR_OTHER_INCOME),
                longValue(chat, SessionKeys.ITR_DEDUCTIONS),
                longValue(chat, SessionKeys.ITR_TDS)
        );
        ItrComputation computation = taxService.computeItr(itrInput);
        log.info("ITR computed userId={} form={} taxable={}", chat.getUserId(), form, computation.taxableIncome());
        chat.put(SessionKeys.ITR_TAXABLE_INCOME, computation.taxableIncome());
        chat.put(SessionKeys.ITR_TAX_LIABILITY, computation.taxLiability());
        chat.put(SessionKeys.ITR_BALANCE, Math.abs(computation.balance()));
        chat.put(SessionKeys.ITR_OUTCOME, computation.isRefund() ? "refund" : "payable");
        return ActionResult.proceed();
    }

    private ActionResult discard(EngineSession session, ClassifiedInput input) {
        session.getSession().clearFlowData();
        session.addReply(replies.message(session.getSession(), "itr.discarded"));
        return ActionResult.proceed();
    }

    private static long longValue(ChatSession chat, String key) {
        Object value = chat.get(key);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
