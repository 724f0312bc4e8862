package com.example.promptstudio.repository;

import com.example.promptstudio.domain.AuditLog;

import java.util.List;

/**
 * Offset-paginated audit queries, newest first.
 */
public interface AuditLogQueries {

    List<AuditLog> findPageByOrgId(String orgId, int limit, int offset);

    List<AuditLog> findPageByActorUserId(String actorUserId, int limit, int offset);
}
