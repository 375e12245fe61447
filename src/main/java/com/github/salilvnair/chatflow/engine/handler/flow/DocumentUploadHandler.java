package com.github.salilvnair.chatflow.engine.handler.flow;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.domain.DocumentParser;
import com.github.salilvnair.chatflow.engine.handler.AbstractFlowHandler;
import com.github.salilvnair.chatflow.engine.handler.HandlerOutcome;
import com.github.salilvnair.chatflow.engine.model.InboundEvent;
import com.github.salilvnair.chatflow.engine.model.InboundEventType;
import com.github.salilvnair.chatflow.engine.session.EngineSession;
import com.github.salilvnair.chatflow.engine.state.ChatSession;
import com.github.salilvnair.chatflow.engine.state.ConversationState;
import com.github.salilvnair.chatflow.engine.state.SessionKeys;
import com.github.salilvnair.chatflow.i18n.ReplyComposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class DocumentUploadHandler extends AbstractFlowHandler {

    private static final List<String> INVOICE_KEYS = List.of(
            SessionKeys.INVOICE_DOCUMENT_ID,
            SessionKeys.INVOICE_NUMBER,
            SessionKeys.INVOICE_SUPPLIER,
            SessionKeys.INVOICE_TAXABLE,
            SessionKeys.INVOICE_TAX
    );

    private final DocumentParser documentParser;

    public DocumentUploadHandler(ReplyComposer replies, DocumentParser documentParser) {
        super(replies, ConversationState.WAIT_INVOICE_UPLOAD, ConversationState.INVOICE_CONFIRM);
        this.documentParser = documentParser;
    }

    @Override
    public HandlerOutcome handle(EngineSession session) {
        if (session.getState() == ConversationState.WAIT_INVOICE_UPLOAD) {
            return upload(session);
        }
        return confirm(session);
    }

    private HandlerOutcome upload(EngineSession session) {
        InboundEvent event = session.getEvent();
        if (!event.isMedia() || event.mediaRef() == null) {
            return HandlerOutcome.handled(noticeWithPrompt(session, "invoice.upload_expected"));
        }
        OutboundPayload.MediaKind kind = event.type() == InboundEventType.IMAGE
                ? OutboundPayload.MediaKind.IMAGE
                : OutboundPayload.MediaKind.DOCUMENT;
        ChatSession chat = session.getSession();
        DocumentParser.ParsedDocument parsed = documentParser.parse(chat.getUserId(), event.mediaRef(), kind);
        chat.put(SessionKeys.INVOICE_DOCUMENT_ID, parsed.documentId());
        chat.put(SessionKeys.INVOICE_NUMBER, parsed.invoiceNumber());
        chat.put(SessionKeys.INVOICE_SUPPLIER, parsed.supplierGstin());
        chat.put(SessionKeys.INVOICE_TAXABLE, parsed.taxableValue() == null ? null : parsed.taxableValue().toPlainString());
        chat.put(SessionKeys.INVOICE_TAX, parsed.taxAmount() == null ? null : parsed.taxAmount().toPlainString());
        return HandlerOutcome.handled(enter(session, ConversationState.INVOICE_CONFIRM, false));
    }

    private HandlerOutcome confirm(EngineSession session) {
        ChatSession chat = session.getSession();
        switch (session.userText()) {
            case "1": {
                String reference = documentParser.confirm(chat.getUserId(), chat.getString(SessionKeys.INVOICE_DOCUMENT_ID));
                log.info("Invoice saved userId={} ref={}", chat.getUserId(), reference);
                INVOICE_KEYS.forEach(chat::remove);
                return HandlerOutcome.handled(
                        message(session, "invoice.saved", Map.of("reference", reference)),
                        enter(session, ConversationState.WAIT_INVOICE_UPLOAD, false)
                );
            }
            case "2":
                INVOICE_KEYS.forEach(chat::remove);
                return HandlerOutcome.handled(
                        message(session, "invoice.discarded"),
                        enter(session, ConversationState.WAIT_INVOICE_UPLOAD, false)
                );
            default:
                return HandlerOutcome.pass();
        }
    }
}
