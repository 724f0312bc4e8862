package com.example.promptstudio.repository;

import com.example.promptstudio.domain.Membership;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface MembershipRepository extends JpaRepository<Membership, String> {

    List<Membership> findByOrgIdOrderByCreatedAt(String orgId);

    Optional<Membership> findFirstByUserIdAndOrgId(String userId, String orgId);
}
