package com.example.promptstudio.repository;

import com.example.promptstudio.domain.Prompt;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PromptRepository extends JpaRepository<Prompt, String> {

    List<Prompt> findByProjectIdOrderByCreatedAt(String projectId);
}
