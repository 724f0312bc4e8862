package com.example.promptstudio.repository;

import com.example.promptstudio.domain.Template;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TemplateRepository extends JpaRepository<Template, String> {

    List<Template> findByOrgIdIsNullOrderByName();

    List<Template> findByOrgIdOrderByName(String orgId);

    Optional<Template> findFirstByOrgIdIsNullAndName(String name);

    /** Public templates of the category plus, when {@code orgId} is given, that organization's own. */
    @Query("select t from Template t where t.category = :category and (t.orgId is null or t.orgId = :orgId) order by t.name")
    List<Template> findVisibleByCategory(@Param("category") String category, @Param("orgId") String orgId);
}
