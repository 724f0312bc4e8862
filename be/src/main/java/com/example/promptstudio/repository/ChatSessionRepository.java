package com.example.promptstudio.repository;

import com.example.promptstudio.domain.ChatSession;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ChatSessionRepository extends JpaRepository<ChatSession, String> {

    List<ChatSession> findByProjectIdOrderByUpdatedAtDesc(String projectId);

    List<ChatSession> findByUserIdOrderByUpdatedAtDesc(String userId);

    void deleteByProjectId(String projectId);
}
