package com.example.promptstudio.repository;

import com.example.promptstudio.domain.Pipeline;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PipelineRepository extends JpaRepository<Pipeline, String> {

    List<Pipeline> findByProjectIdOrderByCreatedAt(String projectId);

    /** Pipeline holding the slug, restricted to projects of the organization, in any status. */
    @Query("select p from Pipeline p where p.endpointSlug = :slug "
            + "and p.projectId in (select pr.id from Project pr where pr.orgId = :orgId)")
    Optional<Pipeline> findBySlugForOrganization(@Param("slug") String slug, @Param("orgId") String orgId);

    void deleteByProjectId(String projectId);
}
