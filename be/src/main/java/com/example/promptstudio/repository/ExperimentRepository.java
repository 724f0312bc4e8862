package com.example.promptstudio.repository;

import com.example.promptstudio.domain.Experiment;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface ExperimentRepository extends JpaRepository<Experiment, String> {

    List<Experiment> findByPromptIdOrderByCreatedAtDesc(String promptId);

    void deleteByPromptIdIn(Collection<String> promptIds);
}
