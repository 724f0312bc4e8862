package com.example.promptstudio.repository;

import com.example.promptstudio.domain.PromptVersion;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface PromptVersionRepository extends JpaRepository<PromptVersion, String> {

    List<PromptVersion> findByPromptIdOrderByCreatedAtDesc(String promptId);

    void deleteByPromptIdIn(Collection<String> promptIds);
}
