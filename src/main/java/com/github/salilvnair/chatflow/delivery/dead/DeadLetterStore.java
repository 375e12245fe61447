package com.github.salilvnair.chatflow.delivery.dead;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DeadLetterStore {

    void save(DeadLetterEntry entry);

    Optional<DeadLetterEntry> findById(String id);

    /** Newest first, at most {@code filter.limit()} entries. */
    List<DeadLetterEntry> query(DeadLetterFilter filter);

    long count(DeadLetterFilter filter);

    /** @return number of entries removed */
    int deleteOlderThan(Instant cutoff);
}
