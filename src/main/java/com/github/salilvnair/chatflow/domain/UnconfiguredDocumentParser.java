package com.github.salilvnair.chatflow.domain;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.engine.exception.DomainServiceException;

/**
 * Registered when the host application provides no {@link DocumentParser}.
 */
public class UnconfiguredDocumentParser implements DocumentParser {

    private static final String SERVICE = "document-parser";

    @Override
    public ParsedDocument parse(String userId, String mediaRef, OutboundPayload.MediaKind kind) {
        throw DomainServiceException.unavailable(SERVICE);
    }

    @Override
    public String confirm(String userId, String documentId) {
        throw DomainServiceException.unavailable(SERVICE);
    }
}
