package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.ChatSessionCreateRequest;
import com.example.promptstudio.api.v1.dto.ChatSessionResponse;
import com.example.promptstudio.chat.ChatMessageEntry;
import com.example.promptstudio.chat.ChatReplyStream;
import com.example.promptstudio.domain.ChatSession;
import com.example.promptstudio.llm.ModelCompletion;
import com.example.promptstudio.llm.ModelGateway;
import com.example.promptstudio.repository.ChatSessionRepository;
import com.example.promptstudio.repository.ProjectRepository;
import com.example.promptstudio.repository.UserRepository;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import tools.jackson.core.type.TypeReference;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Chat sessions and message exchange.
 * <p>
 * Sending a message commits the user message immediately and returns a {@link ChatReplyStream} for the
 * assistant reply. The assistant message is written in its own transaction once the stream has delivered
 * every chunk; a cancelled stream writes nothing.
 * </p>
 */
@Service
@Slf4j
public class ChatSessionService {

    private static final TypeReference<List<ChatMessageEntry>> MESSAGES = new TypeReference<>() { };

    private final ChatSessionRepository sessions;
    private final ProjectRepository projects;
    private final UserRepository users;
    private final ModelGateway modelGateway;
    private final TransactionTemplate transactionTemplate;
    private final ScheduledExecutorService scheduler;
    private final Duration streamInterval;
    private final JsonDocuments json;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public ChatSessionService(ChatSessionRepository sessions,
                              ProjectRepository projects,
                              UserRepository users,
                              ModelGateway modelGateway,
                              TransactionTemplate transactionTemplate,
                              ScheduledExecutorService chatStreamScheduler,
                              @Value("${studio.chat.stream-interval:50ms}") Duration streamInterval,
                              JsonDocuments json,
                              IdGenerator idGenerator,
                              Clock clock) {
        this.sessions = sessions;
        this.projects = projects;
        this.users = users;
        this.modelGateway = modelGateway;
        this.transactionTemplate = transactionTemplate;
        this.scheduler = chatStreamScheduler;
        this.streamInterval = streamInterval;
        this.json = json;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Transactional
    public ChatSessionResponse create(ChatSessionCreateRequest request) {
        if (!projects.existsById(request.projectId())) {
            throw ResourceNotFoundException.of("Project", request.projectId());
        }
        if (!users.existsById(request.userId())) {
            throw ResourceNotFoundException.of("User", request.userId());
        }
        ChatSession session = new ChatSession(idGenerator.newId("chat"), request.projectId(), request.userId(),
                request.title(), request.model(), json.write(List.of()), clock.instant());
        sessions.save(session);
        log.info("Created chat session id={} projectId={} model={}", session.getId(), session.getProjectId(), session.getModel());
        return toResponse(session);
    }

    @Transactional(readOnly = true)
    public ChatSessionResponse findById(String id) {
        return toResponse(require(id));
    }

    @Transactional(readOnly = true)
    public List<ChatSessionResponse> findByProjectId(String projectId) {
        return sessions.findByProjectIdOrderByUpdatedAtDesc(projectId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ChatSessionResponse> findByUserId(String userId) {
        return sessions.findByUserIdOrderByUpdatedAtDesc(userId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public ChatSessionResponse replaceMessages(String id, List<ChatMessageEntry> messages) {
        ChatSession session = require(id);
        session.replaceMessages(json.write(messages), clock.instant());
        sessions.save(session);
        return toResponse(session);
    }

    @Transactional
    public void delete(String id) {
        sessions.delete(require(id));
        log.info("Deleted chat session id={}", id);
    }

    /**
     * Records the user message and prepares the streamed assistant reply. The caller starts the stream.
     */
    public ChatReplyStream sendMessage(String sessionId, String content, String model) {
        String activeModel = transactionTemplate.execute(status -> {
            ChatSession session = require(sessionId);
            if (model != null && !model.isBlank()) {
                session.switchModel(model);
            }
            List<ChatMessageEntry> messages = new ArrayList<>(readMessages(session));
            messages.add(new ChatMessageEntry(ChatMessageEntry.USER, content, clock.instant()));
            session.replaceMessages(json.write(messages), clock.instant());
            sessions.save(session);
            return session.getModel();
        });
        ModelCompletion reply = modelGateway.complete(activeModel, content);
        log.info("Streaming reply sessionId={} model={} tokensOut={}", sessionId, activeModel, reply.tokensOut());
        return new ChatReplyStream(sessionId, reply.text(), () -> appendAssistantMessage(sessionId, reply.text()),
                scheduler, streamInterval);
    }

    private void appendAssistantMessage(String sessionId, String reply) {
        transactionTemplate.executeWithoutResult(status -> {
            ChatSession session = require(sessionId);
            List<ChatMessageEntry> messages = new ArrayList<>(readMessages(session));
            messages.add(new ChatMessageEntry(ChatMessageEntry.ASSISTANT, reply, clock.instant()));
            session.replaceMessages(json.write(messages), clock.instant());
            sessions.save(session);
        });
        log.debug("Stored assistant reply sessionId={}", sessionId);
    }

    private ChatSession require(String id) {
        return sessions.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Chat session", id));
    }

    private List<ChatMessageEntry> readMessages(ChatSession session) {
        return json.read(session.getMessagesJson(), MESSAGES);
    }

    private ChatSessionResponse toResponse(ChatSession session) {
        return new ChatSessionResponse(session.getId(), session.getProjectId(), session.getUserId(), session.getTitle(),
                session.getModel(), readMessages(session), session.getCreatedAt(), session.getUpdatedAt());
    }
}
