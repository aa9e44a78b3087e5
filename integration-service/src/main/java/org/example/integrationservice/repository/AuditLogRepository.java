package org.example.integrationservice.repository;

import org.example.integrationservice.model.AuditAction;
import org.example.integrationservice.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByActionOrderByCreatedAtAsc(AuditAction action);

    long countByAction(AuditAction action);
}
