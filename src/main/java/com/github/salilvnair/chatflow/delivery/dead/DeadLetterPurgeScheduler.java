package com.github.salilvnair.chatflow.delivery.dead;

import com.github.salilvnair.chatflow.config.ChatFlowDeliveryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterPurgeScheduler {

    private final DeadLetterStore store;
    private final ChatFlowDeliveryConfig config;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${chatflow.delivery.dead-letter.purge-interval-ms:3600000}")
    public void scheduledPurge() {
        purgeExpired();
    }

    /** @return number of entries older than the retention period that were removed */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(config.getDeadLetter().getRetention());
        int removed = store.deleteOlderThan(cutoff);
        if (removed > 0) {
            log.info("Purged dead letters older than {} count={}", cutoff, removed);
        }
        return removed;
    }
}
