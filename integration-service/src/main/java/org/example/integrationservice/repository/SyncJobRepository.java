package org.example.integrationservice.repository;

import org.example.integrationservice.model.SyncEntityType;
import org.example.integrationservice.model.SyncJob;
import org.example.integrationservice.model.SyncJobStatus;
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
import java.util.UUID;

@Repository
public interface SyncJobRepository extends JpaRepository<SyncJob, UUID> {

    long countByStatus(SyncJobStatus status);

    List<SyncJob> findByEntityTypeAndEntityIdOrderByCreatedAtAsc(SyncEntityType entityType, String entityId);

    @Query("""
            select j from SyncJob j
            where j.status = :status
            and j.runAfter <= :now
            order by j.runAfter
            """)
    List<SyncJob> findDueJobs(@Param("status") SyncJobStatus status,
                              @Param("now") Instant now,
                              Pageable pageable);

    default List<SyncJob> findPendingSyncJobs(Instant now, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return findDueJobs(SyncJobStatus.PENDING, now, PageRequest.of(0, limit));
    }

    //Compare-and-set on status, a zero result means another worker owns the job
    @Transactional
    @Modifying
    @Query("""
            update SyncJob j
            set j.status = :to, j.updatedAt = :now
            where j.id = :id and j.status = :from
            """)
    int transition(@Param("id") UUID id,
                   @Param("from") SyncJobStatus from,
                   @Param("to") SyncJobStatus to,
                   @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("""
            update SyncJob j
            set j.status = :to, j.updatedAt = :now
            where j.status = :from and j.updatedAt < :threshold
            """)
    int releaseStale(@Param("from") SyncJobStatus from,
                     @Param("to") SyncJobStatus to,
                     @Param("threshold") Instant threshold,
                     @Param("now") Instant now);
}
