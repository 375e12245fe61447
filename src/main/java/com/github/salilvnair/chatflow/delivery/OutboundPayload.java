package com.github.salilvnair.chatflow.delivery;

public sealed interface OutboundPayload permits OutboundPayload.Text, OutboundPayload.Media {

    /** Short human readable form used in logs and dead-letter listings. */
    String summary();

    record Text(String body) implements OutboundPayload {
        @Override
        public String summary() {
            return body == null || body.length() <= 80 ? body : body.substring(0, 77) + "...";
        }
    }

    record Media(String mediaRef, String caption, MediaKind kind) implements OutboundPayload {
        @Override
        public String summary() {
            return kind + ":" + mediaRef + (caption == null ? "" : " (" + caption + ")");
        }
    }

    enum MediaKind {
        IMAGE,
        DOCUMENT
    }

    static OutboundPayload text(String body) {
        return new Text(body);
    }
}
