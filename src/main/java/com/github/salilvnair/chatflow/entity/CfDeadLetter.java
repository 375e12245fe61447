package com.github.salilvnair.chatflow.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "cf_dead_letter", indexes = {
        @Index(name = "idx_cf_dead_letter_recipient", columnList = "recipient"),
        @Index(name = "idx_cf_dead_letter_at", columnList = "dead_lettered_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CfDeadLetter {

    @Id
    @Column(name = "dead_letter_id", length = 36)
    private String deadLetterId;

    @Column(nullable = false, name = "message_id", length = 36)
    private String messageId;

    @Column(nullable = false)
    private String recipient;

    /** TEXT or MEDIA, selects how payload_json is read back. */
    @Column(nullable = false, name = "payload_type", length = 16)
    private String payloadType;

    @Column(nullable = false, name = "payload_json", length = 8000)
    private String payloadJson;

    /** MAX_RETRIES_EXCEEDED, PERMANENT_FAILURE, QUEUE_FULL or SHUTDOWN */
    @Column(nullable = false, name = "failure_reason", length = 32)
    private String failureReason;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(nullable = false, name = "retry_count")
    private Integer retryCount;

    @Column(name = "replay_of", length = 36)
    private String replayOf;

    @Column(nullable = false, name = "enqueued_at")
    private OffsetDateTime enqueuedAt;

    @Column(nullable = false, name = "dead_lettered_at")
    private OffsetDateTime deadLetteredAt;
}
