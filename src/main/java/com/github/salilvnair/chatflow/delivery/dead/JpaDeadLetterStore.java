package com.github.salilvnair.chatflow.delivery.dead;

import com.github.salilvnair.chatflow.delivery.OutboundPayload;
import com.github.salilvnair.chatflow.entity.CfDeadLetter;
import com.github.salilvnair.chatflow.repo.DeadLetterRepository;
import com.github.salilvnair.chatflow.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

@RequiredArgsConstructor
public class JpaDeadLetterStore implements DeadLetterStore {

    private static final String TEXT = "TEXT";
    private static final String MEDIA = "MEDIA";

    private final DeadLetterRepository repository;

    @Override
    @Transactional
    public void save(DeadLetterEntry entry) {
        repository.save(toEntity(entry));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DeadLetterEntry> findById(String id) {
        return repository.findById(id).map(JpaDeadLetterStore::toEntry);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DeadLetterEntry> query(DeadLetterFilter filter) {
        return repository.search(filter.recipient(), reasonName(filter), PageRequest.of(0, filter.limit()))
                .stream()
                .map(JpaDeadLetterStore::toEntry)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long count(DeadLetterFilter filter) {
        return repository.countMatching(filter.recipient(), reasonName(filter));
    }

    @Override
    @Transactional
    public int deleteOlderThan(Instant cutoff) {
        return repository.deleteOlderThan(cutoff.atOffset(ZoneOffset.UTC));
    }

    private static String reasonName(DeadLetterFilter filter) {
        return filter.reason() == null ? null : filter.reason().name();
    }

    static CfDeadLetter toEntity(DeadLetterEntry entry) {
        boolean media = entry.payload() instanceof OutboundPayload.Media;
        return CfDeadLetter.builder()
                .deadLetterId(entry.id())
                .messageId(entry.messageId())
                .recipient(entry.recipient())
                .payloadType(media ? MEDIA : TEXT)
                .payloadJson(JsonUtil.toJson(entry.payload()))
                .failureReason(entry.reason().name())
                .lastError(truncate(entry.lastError()))
                .retryCount(entry.retryCount())
                .replayOf(entry.replayOf())
                .enqueuedAt(toOffset(entry.enqueuedAt()))
                .deadLetteredAt(toOffset(entry.deadLetteredAt()))
                .build();
    }

    static DeadLetterEntry toEntry(CfDeadLetter row) {
        OutboundPayload payload = MEDIA.equals(row.getPayloadType())
                ? JsonUtil.fromJson(row.getPayloadJson(), OutboundPayload.Media.class)
                : JsonUtil.fromJson(row.getPayloadJson(), OutboundPayload.Text.class);
        return new DeadLetterEntry(
                row.getDeadLetterId(),
                row.getMessageId(),
                row.getRecipient(),
                payload,
                FailureReason.valueOf(row.getFailureReason()),
                row.getLastError(),
                row.getRetryCount() == null ? 0 : row.getRetryCount(),
                row.getReplayOf(),
                row.getEnqueuedAt().toInstant(),
                row.getDeadLetteredAt().toInstant()
        );
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static String truncate(String value) {
        return value == null || value.length() <= 2000 ? value : value.substring(0, 2000);
    }
}
