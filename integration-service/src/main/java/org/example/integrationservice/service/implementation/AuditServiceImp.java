package org.example.integrationservice.service.implementation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.integrationservice.model.ActorType;
import org.example.integrationservice.model.AuditAction;
import org.example.integrationservice.model.AuditLog;
import org.example.integrationservice.repository.AuditLogRepository;
import org.example.integrationservice.service.AuditService;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuditServiceImp implements AuditService {

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    @Override
    public AuditLog record(AuditAction action, String requestId, String bookingId, Map<String, Object> payload) {
        AuditLog entry = AuditLog.builder()
                .action(action)
                .actorType(ActorType.SYSTEM)
                .requestId(requestId)
                .bookingId(bookingId)
                .payload(new LinkedHashMap<>(payload))
                .createdAt(clock.instant())
                .build();

        AuditLog saved = auditLogRepository.save(entry);
        log.debug("Audit {} recorded", action.getValue());
        return saved;
    }
}
