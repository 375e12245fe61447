package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.domain.DocumentParser;
import com.github.salilvnair.chatflow.engine.exception.DomainServiceException;
import com.github.salilvnair.chatflow.engine.model.EngineResult;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.support.ChatFlowTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.github.salilvnair.chatflow.support.ChatFlowTestHarness.replyText;
import static com.github.salilvnair.chatflow.support.TestConstants.DOCUMENT_ID;
import static com.github.salilvnair.chatflow.support.TestConstants.MEDIA_REF;
import static com.github.salilvnair.chatflow.support.TestConstants.OTHER_GSTIN;
import static com.github.salilvnair.chatflow.support.TestConstants.TEXT_HELLO;
import static com.github.salilvnair.chatflow.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

class DocumentUploadHandlerTest {

    private ChatFlowTestHarness harness;

    @BeforeEach
    void setUp() {
        harness = new ChatFlowTestHarness();
        harness.text(TEXT_HELLO);
        harness.text("1");
        harness.text("2");
    }

    @Test
    void textInsteadOfDocumentAsksAgain() {
        EngineResult result = harness.text("here it is");

        assertEquals(ConversationState.WAIT_INVOICE_UPLOAD, result.state());
        assertTrue(replyText(result).startsWith("Please send the invoice as a photo or PDF."));
    }

    @Test
    void parsedInvoiceIsConfirmedAndSaved() {
        when(harness.documentParser.parse(USER_ID, MEDIA_REF, OutboundPayload.MediaKind.DOCUMENT))
                .thenReturn(new DocumentParser.ParsedDocument(DOCUMENT_ID, "INV-42", OTHER_GSTIN,
                        new BigDecimal("10000.00"), new BigDecimal("1800.00")));
        when(harness.documentParser.confirm(USER_ID, DOCUMENT_ID)).thenReturn("INV-REF-1");

        EngineResult parsed = harness.media(MEDIA_REF);
        assertEquals(ConversationState.INVOICE_CONFIRM, parsed.state());
        assertEquals("INV-42", harness.session().getString(SessionKeys.INVOICE_NUMBER));

        EngineResult saved = harness.text("1");

        assertEquals(ConversationState.WAIT_INVOICE_UPLOAD, saved.state());
        assertTrue(replyText(saved).startsWith("Invoice saved. Reference: INV-REF-1"));
        assertNull(harness.session().get(SessionKeys.INVOICE_DOCUMENT_ID));
    }

    @Test
    void parserFailureLeavesUserWaitingForUpload() {
        when(harness.documentParser.parse(USER_ID, MEDIA_REF, OutboundPayload.MediaKind.DOCUMENT))
                .thenThrow(new DomainServiceException("document-parser", "unreadable"));

        EngineResult result = harness.media(MEDIA_REF);

        assertEquals(ConversationState.WAIT_INVOICE_UPLOAD, result.state());
        assertTrue(replyText(result).startsWith("Sorry, something went wrong"));
    }
}
