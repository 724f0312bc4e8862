package com.example.promptstudio.api.v1;

import com.example.promptstudio.api.v1.dto.ChatMessagesUpdateRequest;
import com.example.promptstudio.api.v1.dto.ChatSendRequest;
import com.example.promptstudio.api.v1.dto.ChatSessionCreateRequest;
import com.example.promptstudio.api.v1.dto.ChatSessionResponse;
import com.example.promptstudio.chat.ChatReplyStream;
import com.example.promptstudio.service.ChatSessionService;

import jakarta.validation.Valid;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Chat sessions. {@code POST /{id}/messages} answers with Server-Sent Events: one
 * {@code {"content": "<chunk>"}} event per chunk, then {@code [DONE]}. A client disconnect, timeout or
 * send failure cancels the stream, and the assistant reply is then not stored.
 */
@RestController
@RequestMapping("/api/v1/chat/sessions")
@Slf4j
public class ChatController {

    static final String DONE = "[DONE]";

    private final ChatSessionService service;
    private final JsonMapper jsonMapper;
    private final long emitterTimeoutMillis;

    public ChatController(ChatSessionService service,
                          JsonMapper jsonMapper,
                          @Value("${studio.chat.emitter-timeout:5m}") Duration emitterTimeout) {
        this.service = service;
        this.jsonMapper = jsonMapper;
        this.emitterTimeoutMillis = emitterTimeout.toMillis();
    }

    @PostMapping
    public ResponseEntity<ChatSessionResponse> create(@Valid @RequestBody ChatSessionCreateRequest request) {
        log.info("Creating chat session projectId={} userId={}", request.projectId(), request.userId());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ChatSessionResponse> getById(@PathVariable String id) {
        return ResponseEntity.ok(service.findById(id));
    }

    @GetMapping(params = "projectId")
    public ResponseEntity<List<ChatSessionResponse>> listByProject(@RequestParam String projectId) {
        return ResponseEntity.ok(service.findByProjectId(projectId));
    }

    @GetMapping(params = "userId")
    public ResponseEntity<List<ChatSessionResponse>> listByUser(@RequestParam String userId) {
        return ResponseEntity.ok(service.findByUserId(userId));
    }

    @PutMapping("/{id}/messages")
    public ResponseEntity<ChatSessionResponse> replaceMessages(@PathVariable String id,
                                                               @Valid @RequestBody ChatMessagesUpdateRequest request) {
        return ResponseEntity.ok(service.replaceMessages(id, request.messages()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        service.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping(path = "/{id}/messages", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter sendMessage(@PathVariable String id, @Valid @RequestBody ChatSendRequest request) {
        log.info("Sending chat message sessionId={} model={}", id, request.model());
        ChatReplyStream stream = service.sendMessage(id, request.content(), request.model());
        SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        emitter.onCompletion(stream::cancel);
        emitter.onTimeout(stream::cancel);
        emitter.onError(error -> stream.cancel());
        stream.start(new ChatReplyStream.Listener() {
            @Override
            public void onChunk(String chunk) {
                send(emitter, jsonMapper.writeValueAsString(Map.of("content", chunk)));
            }

            @Override
            public void onComplete() {
                try {
                    emitter.send(SseEmitter.event().data(DONE));
                    emitter.complete();
                } catch (IOException e) {
                    log.debug("Client left before [DONE] sessionId={}: {}", id, e.getMessage());
                    emitter.completeWithError(e);
                }
            }

            @Override
            public void onError(Throwable error) {
                emitter.completeWithError(error);
            }
        });
        return emitter;
    }

    private static void send(SseEmitter emitter, String data) {
        try {
            emitter.send(SseEmitter.event().data(data));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
