package com.example.promptstudio.repository;

import com.example.promptstudio.domain.AiProvider;
import com.example.promptstudio.domain.ProviderKey;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProviderKeyRepository extends JpaRepository<ProviderKey, String> {

    List<ProviderKey> findByOrgIdOrderByCreatedAt(String orgId);

    List<ProviderKey> findByOrgIdAndProviderOrderByCreatedAt(String orgId, AiProvider provider);
}
