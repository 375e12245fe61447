package com.github.salilvnair.chatflow.domain;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.engine.exception.DomainServiceException;

/**
 * Extracts invoice fields from an uploaded document.
 */
public interface DocumentParser {

    /**
     * @throws DomainServiceException when the document cannot be read
     */
    ParsedDocument parse(String userId, String mediaRef, OutboundPayload.MediaKind kind);

    /**
     * Stores a parsed document the user confirmed.
     *
     * @return reference of the stored invoice
     */
    String confirm(String userId, String documentId);

    record ParsedDocument(
            String documentId,
            String invoiceNumber,
            String supplierGstin,
            java.math.BigDecimal taxableValue,
            java.math.BigDecimal taxAmount
    ) {}
}
