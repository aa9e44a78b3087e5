package org.example.integrationservice.repository;

import org.example.integrationservice.model.WebhookEvent;
import org.example.integrationservice.model.WebhookStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, UUID> {

    Optional<WebhookEvent> findByEventId(String eventId);

    Optional<WebhookEvent> findFirstByPayloadHashAndEventIdIsNullOrderByCreatedAtAsc(String payloadHash);

    long countByStatus(WebhookStatus status);

    //Unverified events are kept for forensics only, the worker never picks them up
    @Query("""
            select e from WebhookEvent e
            where e.status = :status
            and e.verified = true
            and e.runAfter <= :now
            order by e.runAfter
            """)
    List<WebhookEvent> findDueEvents(@Param("status") WebhookStatus status,
                                     @Param("now") Instant now,
                                     Pageable pageable);

    default List<WebhookEvent> findProcessableEvents(Instant now, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return findDueEvents(WebhookStatus.RECEIVED, now, PageRequest.of(0, limit));
    }

    @Transactional
    @Modifying
    @Query("""
            update WebhookEvent e
            set e.status = :to, e.updatedAt = :now
            where e.id = :id and e.status = :from
            """)
    int transition(@Param("id") UUID id,
                   @Param("from") WebhookStatus from,
                   @Param("to") WebhookStatus to,
                   @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("""
            update WebhookEvent e
            set e.status = :to, e.updatedAt = :now
            where e.status = :from and e.updatedAt < :threshold
            """)
    int releaseStale(@Param("from") WebhookStatus from,
                     @Param("to") WebhookStatus to,
                     @Param("threshold") Instant threshold,
                     @Param("now") Instant now);
}
