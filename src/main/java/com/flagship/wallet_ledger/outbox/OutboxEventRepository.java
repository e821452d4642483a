package com.flagship.wallet_ledger.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Oldest pending events first, in commit order. Rows locked by another
     * publisher's poll are skipped, but the locks only last until the calling
     * transaction commits, which happens before the events are sent. Two
     * instances can therefore send the same event; consumers deduplicate on
     * the event id.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND attempts < :maxAttempts
        ORDER BY sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findPendingForUpdate(@Param("limit") int limit,
                                                 @Param("maxAttempts") int maxAttempts);

    List<OutboxEventEntity> findByAggregateIdOrderBySequenceNumberAsc(String aggregateId);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    @Query("""
        SELECT COUNT(e) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL AND e.attempts >= :maxAttempts
        """)
    long countExhausted(@Param("maxAttempts") int maxAttempts);

    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();

    @Modifying
    @Query("DELETE FROM OutboxEventEntity e WHERE e.publishedAt IS NOT NULL AND e.publishedAt < :before")
    int deletePublishedBefore(@Param("before") Instant before);
}
