package com.example.promptstudio.repository;

import com.example.promptstudio.domain.Project;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProjectRepository extends JpaRepository<Project, String> {

    List<Project> findByOrgIdOrderByCreatedAt(String orgId);
}
