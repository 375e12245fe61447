package com.github.salilvnair.chatflow.support;

import java.time.Instant;

public final class TestConstants {

    private TestConstants() {
    }

    public static final String USER_ID = "919800000001";
    public static final String OTHER_USER_ID = "919800000002";

    public static final String VALID_GSTIN = "27ABCDE1234F1Z5";
    public static final String OTHER_GSTIN = "29ABCDE1234F1Z7";
    public static final String INVALID_GSTIN = "27ABCDE1234";
    public static final String VALID_PAN = "ABCDE1234F";

    public static final String FILING_REFERENCE = "ARN-2024-0001";
    public static final String DOCUMENT_ID = "doc-1";
    public static final String MEDIA_REF = "media-123";

    public static final String TEXT_HELLO = "hello";
    public static final String TEXT_GIBBERISH = "qwerty";
    public static final String BOOM = "boom";

    public static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");
}
