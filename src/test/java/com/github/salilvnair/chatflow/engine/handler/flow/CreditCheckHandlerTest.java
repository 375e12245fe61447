package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.domain.TaxComputationService;
import com.github.salilvnair.chatflow.engine.model.EngineResult;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.support.ChatFlowTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.github.salilvnair.chatflow.support.ChatFlowTestHarness.replyText;
import static com.github.salilvnair.chatflow.support.TestConstants.TEXT_HELLO;
import static com.github.salilvnair.chatflow.support.TestConstants.USER_ID;
import static com.github.salilvnair.chatflow.support.TestConstants.VALID_GSTIN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CreditCheckHandlerTest {

    private ChatFlowTestHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ChatFlowTestHarness();
        when(harness.taxService.reconcileCredit(VALID_GSTIN)).thenReturn(new TaxComputationService.CreditReconciliation(
                new BigDecimal("5000"), new BigDecimal("1200"), new BigDecimal("300"), 4));
        harness.text(TEXT_HELLO);
        harness.text("1");
        harness.text("3");
    }

    @Test
    void checkRunsAfterGstinIsCaptured() {
        assertEquals(ConversationState.WAIT_GSTIN, harness.text("1").state());
        assertEquals(ConversationState.MEDIUM_CREDIT_CHECK, harness.text(VALID_GSTIN).state());

        EngineResult result = harness.text("1");

        assertEquals(ConversationState.MEDIUM_CREDIT_RESULT, result.state());
        assertTrue(replyText(result).contains("1200"));
    }

    @Test
    void suppliersCanBeNotified() {
        harness.text("1");
        harness.text(VALID_GSTIN);
        harness.text("1");

        EngineResult result = harness.text("3");

        assertEquals(ConversationState.MEDIUM_CREDIT_RESULT, result.state());
        assertTrue(replyText(result).startsWith("Reminders sent to 4 suppliers."));
        verify(harness.notificationScheduler).notifySuppliers(USER_ID, VALID_GSTIN, 4);
    }

    @Test
    void otherInputLeavesResultScreen() {
        harness.text("1");
        harness.text(VALID_GSTIN);
        harness.text("1");

        EngineResult result = harness.text("ok thanks");

        assertEquals(ConversationState.GST_MENU, result.state());
    }
}
