package com.example.promptstudio.repository;

import com.example.promptstudio.domain.AuditLog;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

import java.util.List;

class AuditLogQueriesImpl implements AuditLogQueries {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<AuditLog> findPageByOrgId(String orgId, int limit, int offset) {
        return entityManager
                .createQuery("select a from AuditLog a where a.orgId = :orgId order by a.createdAt desc, a.id desc", AuditLog.class)
                .setParameter("orgId", orgId)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    public List<AuditLog> findPageByActorUserId(String actorUserId, int limit, int offset) {
        return entityManager
                .createQuery("select a from AuditLog a where a.actorUserId = :actor order by a.createdAt desc, a.id desc", AuditLog.class)
                .setParameter("actor", actorUserId)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }
}
