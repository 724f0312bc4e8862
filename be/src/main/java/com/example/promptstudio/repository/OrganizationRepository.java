package com.example.promptstudio.repository;

import com.example.promptstudio.domain.Organization;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface OrganizationRepository extends JpaRepository<Organization, String> {

    Optional<Organization> findBySlug(String slug);

    /** Organizations the user is a member of, oldest first. */
    @Query("select o from Organization o where o.id in (select m.orgId from Membership m where m.userId = :userId) order by o.createdAt")
    List<Organization> findByMemberUserId(@Param("userId") String userId);
}
