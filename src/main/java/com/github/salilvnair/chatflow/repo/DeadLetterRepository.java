package com.github.salilvnair.chatflow.repo;

import com.github.salilvnair.chatflow.entity.CfDeadLetter;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;

public interface DeadLetterRepository extends JpaRepository<CfDeadLetter, String> {

    @Query("""
            select d from CfDeadLetter d
            where (:recipient is null or d.recipient = :recipient)
              and (:reason is null or d.failureReason = :reason)
            order by d.deadLetteredAt desc
            """)
    List<CfDeadLetter> search(@Param("recipient") String recipient, @Param("reason") String reason, Pageable pageable);

    @Query("""
            select count(d) from CfDeadLetter d
            where (:recipient is null or d.recipient = :recipient)
              and (:reason is null or d.failureReason = :reason)
            """)
    long countMatching(@Param("recipient") String recipient, @Param("reason") String reason);

    @Modifying
    @Query("delete from CfDeadLetter d where d.deadLetteredAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") OffsetDateTime cutoff);
}
