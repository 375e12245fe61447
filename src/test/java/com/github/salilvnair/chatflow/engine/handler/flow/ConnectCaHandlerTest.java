package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.engine.model.EngineResult;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.support.ChatFlowTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.chatflow.support.ChatFlowTestHarness.replyText;
import static com.github.salilvnair.chatflow.support.TestConstants.TEXT_HELLO;
import static com.github.salilvnair.chatflow.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

class ConnectCaHandlerTest {

    private ChatFlowTestHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ChatFlowTestHarness();
        harness.text(TEXT_HELLO);
        harness.text("3");
    }

    @Test
    void questionIsForwardedVerbatim() {
        EngineResult ask = harness.text("1");
        assertEquals(ConversationState.CONNECT_CA_ASK_TEXT, ask.state());

        EngineResult sent = harness.text("Can I claim ITC on a car lease?");

        assertEquals(ConversationState.CONNECT_CA_MENU, sent.state());
        assertTrue(replyText(sent).startsWith("Your question has been sent."));
        verify(harness.notificationScheduler).requestCaCallback(USER_ID, "Can I claim ITC on a car lease?");
        assertEquals(Boolean.TRUE, harness.session().get(SessionKeys.CA_HANDOFF));
    }

    @Test
    void longQuestionIsTruncated() {
        harness.text("1");

        harness.text("x".repeat(ConnectCaHandler.MAX_QUESTION_LENGTH + 50));

        verify(harness.notificationScheduler).requestCaCallback(eq(USER_ID),
                argThat(question -> question.length() == ConnectCaHandler.MAX_QUESTION_LENGTH));
    }

    @Test
    void callbackRequestKeepsState() {
        EngineResult result = harness.text("2");

        assertEquals(ConversationState.CONNECT_CA_MENU, result.state());
        verify(harness.notificationScheduler).requestCaCallback(eq(USER_ID), isNull());
    }
}
