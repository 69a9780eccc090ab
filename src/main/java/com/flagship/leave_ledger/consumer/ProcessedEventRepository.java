package com.flagship.leave_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, ProcessedEventEntity.Key> {

    /**
     * Primary deduplication check.
     */
    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    /**
     * Inserts the SUCCESS marker unless one exists. A concurrent claim of the
     * same event blocks on the primary key until the first transaction ends.
     *
     * @return 1 if this transaction owns the event, 0 if another one already did
     */
    @Modifying
    @Query(value = """
        INSERT INTO processed_events
            (event_id, consumer_group, event_type, aggregate_type, aggregate_id, processed_at, outcome)
        VALUES (:eventId, :consumerGroup, :eventType, :aggregateType, :aggregateId, :processedAt, 'SUCCESS')
        ON CONFLICT (event_id, consumer_group) DO NOTHING
        """, nativeQuery = true)
    int claim(@Param("eventId") UUID eventId,
              @Param("consumerGroup") String consumerGroup,
              @Param("eventType") String eventType,
              @Param("aggregateType") String aggregateType,
              @Param("aggregateId") UUID aggregateId,
              @Param("processedAt") Instant processedAt);

    List<ProcessedEventEntity> findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(
        String aggregateType, UUID aggregateId);

    long countByConsumerGroup(String consumerGroup);
}
