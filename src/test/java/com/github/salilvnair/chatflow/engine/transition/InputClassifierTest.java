package com.github.salilvnair.chatflow.engine.transition;

import com.github.salilvnair.chatflow.engine.model.InboundEvent;
import com.github.salilvnair.chatflow.engine.model.InboundEventType;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InputClassifierTest {

    private static InboundEvent text(String body) {
        return InboundEvent.builder().senderId("u").type(InboundEventType.TEXT).text(body).build();
    }

    @Test
    void menuChoicesAreNormalised() {
        ClassifiedInput input = InputClassifier.classify(text(" 02 "), ConversationState.GST_MENU);

        assertEquals(InputKind.NUMERIC_CHOICE, input.kind());
        assertEquals("2", input.token());
    }

    @Test
    void confirmationWordsMapToYesOrNo() {
        assertEquals("yes", InputClassifier.classify(text("Haan!"), ConversationState.GST_FILING_CONFIRM).token());
        assertEquals("no", InputClassifier.classify(text("cancel"), ConversationState.GST_FILING_CONFIRM).token());
        assertEquals(InputKind.CONFIRMATION, InputClassifier.classify(text("OK"), ConversationState.ITR1_CONFIRM).kind());
    }

    @Test
    void freeInputStatesNeverProduceMenuChoices() {
        ClassifiedInput input = InputClassifier.classify(text("45"), ConversationState.ITR1_ASK_TDS);

        assertEquals(InputKind.FREE_TEXT, input.kind());
        assertEquals("45", input.raw());
    }

    @Test
    void mediaIsClassifiedByEventType() {
        InboundEvent event = InboundEvent.builder().senderId("u").type(InboundEventType.IMAGE).mediaRef("m").build();

        assertEquals(InputKind.MEDIA, InputClassifier.classify(event, ConversationState.WAIT_INVOICE_UPLOAD).kind());
    }

    @Test
    void isAffirmative() {
        assertTrue(InputClassifier.isAffirmative(" Yes. "));
        assertFalse(InputClassifier.isAffirmative("nope"));
        assertFalse(InputClassifier.isAffirmative(null));
    }
}
