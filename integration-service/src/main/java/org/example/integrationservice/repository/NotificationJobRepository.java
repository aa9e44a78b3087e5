package org.example.integrationservice.repository;

import org.example.integrationservice.model.NotificationEntityType;
import org.example.integrationservice.model.NotificationJob;
import org.example.integrationservice.model.NotificationStatus;
import org.example.integrationservice.model.NotificationType;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotificationJobRepository extends JpaRepository<NotificationJob, UUID> {

    Optional<NotificationJob> findByIdempotencyKey(String idempotencyKey);

    long countByStatus(NotificationStatus status);

    @Query("""
            select n from NotificationJob n
            where n.status = :status
            and n.runAfter <= :now
            order by n.runAfter
            """)
    List<NotificationJob> findDueJobs(@Param("status") NotificationStatus status,
                                      @Param("now") Instant now,
                                      Pageable pageable);

    default List<NotificationJob> findPendingNotifications(Instant now, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return findDueJobs(NotificationStatus.PENDING, now, PageRequest.of(0, limit));
    }

    @Transactional
    @Modifying
    @Query("""
            update NotificationJob n
            set n.status = :to, n.updatedAt = :now
            where n.id = :id and n.status = :from
            """)
    int transition(@Param("id") UUID id,
                   @Param("from") NotificationStatus from,
                   @Param("to") NotificationStatus to,
                   @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("""
            update NotificationJob n
            set n.status = org.example.integrationservice.model.NotificationStatus.CANCELED, n.updatedAt = :now
            where n.entityType = :entityType
            and n.entityId = :entityId
            and n.status = org.example.integrationservice.model.NotificationStatus.PENDING
            """)
    int cancelPending(@Param("entityType") NotificationEntityType entityType,
                      @Param("entityId") String entityId,
                      @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("""
            update NotificationJob n
            set n.status = org.example.integrationservice.model.NotificationStatus.CANCELED, n.updatedAt = :now
            where n.entityType = :entityType
            and n.entityId = :entityId
            and n.type in :types
            and n.status = org.example.integrationservice.model.NotificationStatus.PENDING
            """)
    int cancelPendingOfTypes(@Param("entityType") NotificationEntityType entityType,
                             @Param("entityId") String entityId,
                             @Param("types") Collection<NotificationType> types,
                             @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("""
            update NotificationJob n
            set n.status = :to, n.updatedAt = :now
            where n.status = :from and n.updatedAt < :threshold
            """)
    int releaseStale(@Param("from") NotificationStatus from,
                     @Param("to") NotificationStatus to,
                     @Param("threshold") Instant threshold,
                     @Param("now") Instant now);
}
