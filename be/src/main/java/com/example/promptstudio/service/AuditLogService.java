package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.AuditLogCreateRequest;
import com.example.promptstudio.api.v1.dto.AuditLogResponse;
import com.example.promptstudio.domain.AuditLog;
import com.example.promptstudio.repository.AuditLogRepository;
import com.example.promptstudio.repository.OrganizationRepository;
import com.example.promptstudio.repository.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Append-only audit trail. Listings are newest first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogService {

    public static final int DEFAULT_LIMIT = 50;

    private final AuditLogRepository auditLogs;
    private final OrganizationRepository organizations;
    private final UserRepository users;
    private final JsonDocuments json;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public AuditLogResponse record(AuditLogCreateRequest request) {
        if (!organizations.existsById(request.orgId())) {
            throw ResourceNotFoundException.of("Organization", request.orgId());
        }
        if (!users.existsById(request.actorUserId())) {
            throw ResourceNotFoundException.of("User", request.actorUserId());
        }
        AuditLog entry = new AuditLog(idGenerator.newId("aud"), request.orgId(), request.actorUserId(), request.action(),
                request.targetType(), request.targetId(), json.writeObject(request.metadata()), clock.instant());
        auditLogs.save(entry);
        log.debug("Audit action={} target={}:{} orgId={}", entry.getAction(), entry.getTargetType(), entry.getTargetId(), entry.getOrgId());
        return toResponse(entry);
    }

    @Transactional(readOnly = true)
    public List<AuditLogResponse> findByOrgId(String orgId, Integer limit, Integer offset) {
        return auditLogs.findPageByOrgId(orgId, limitOrDefault(limit), offset != null && offset > 0 ? offset : 0).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AuditLogResponse> findByUserId(String userId, Integer limit) {
        return auditLogs.findPageByActorUserId(userId, limitOrDefault(limit), 0).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AuditLogResponse> findByTarget(String targetType, String targetId) {
        return auditLogs.findByTargetTypeAndTargetIdOrderByCreatedAtDesc(targetType, targetId).stream()
                .map(this::toResponse)
                .toList();
    }

    private static int limitOrDefault(Integer limit) {
        return limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
    }

    private AuditLogResponse toResponse(AuditLog entry) {
        return new AuditLogResponse(entry.getId(), entry.getOrgId(), entry.getActorUserId(), entry.getAction(),
                entry.getTargetType(), entry.getTargetId(), json.readObject(entry.getMetadataJson()), entry.getCreatedAt());
    }
}
