package com.example.promptstudio.repository;

import com.example.promptstudio.domain.ApiKey;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ApiKeyRepository extends JpaRepository<ApiKey, String> {

    Optional<ApiKey> findByTokenHash(String tokenHash);

    List<ApiKey> findByOrgIdOrderByCreatedAt(String orgId);
}
