package com.example.promptstudio.repository;

import com.example.promptstudio.domain.Run;

import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface RunRepository extends JpaRepository<Run, String> {

    List<Run> findByProjectIdOrderByCreatedAtDesc(String projectId, Limit limit);

    /** All runs of the organization's projects, newest first. */
    @Query("select r from Run r where r.projectId in (select p.id from Project p where p.orgId = :orgId) order by r.createdAt desc, r.id desc")
    List<Run> findByOrganization(@Param("orgId") String orgId);

    /** Sum of input tokens of the organization's runs created within {@code [from, to]}. */
    @Query("select coalesce(sum(r.tokensIn), 0L) from Run r "
            + "where r.projectId in (select p.id from Project p where p.orgId = :orgId) "
            + "and r.createdAt >= :from and r.createdAt <= :to")
    long sumTokensInForOrganization(@Param("orgId") String orgId, @Param("from") Instant from, @Param("to") Instant to);

    void deleteByProjectId(String projectId);
}
