package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.ApiKeyCreateRequest;
import com.example.promptstudio.api.v1.dto.ApiKeyCreatedResponse;
import com.example.promptstudio.api.v1.dto.ApiKeyResponse;
import com.example.promptstudio.crypto.ApiTokenHasher;
import com.example.promptstudio.domain.ApiKey;
import com.example.promptstudio.repository.ApiKeyRepository;
import com.example.promptstudio.repository.OrganizationRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Organization API keys. The raw token is handed out once at creation; lookups go through its hash.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApiKeyService {

    private final ApiKeyRepository apiKeys;
    private final OrganizationRepository organizations;
    private final JsonDocuments json;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public ApiKeyCreatedResponse create(ApiKeyCreateRequest request) {
        if (!organizations.existsById(request.orgId())) {
            throw ResourceNotFoundException.of("Organization", request.orgId());
        }
        String token = ApiTokenHasher.newToken();
        ApiKey apiKey = new ApiKey(idGenerator.newId("key"), request.orgId(), request.label(), ApiTokenHasher.hash(token),
                json.write(request.scopes() != null ? request.scopes() : List.of()), clock.instant());
        apiKeys.save(apiKey);
        log.info("Created API key id={} orgId={}", apiKey.getId(), apiKey.getOrgId());
        return new ApiKeyCreatedResponse(toResponse(apiKey), token);
    }

    @Transactional(readOnly = true)
    public List<ApiKeyResponse> findByOrgId(String orgId) {
        return apiKeys.findByOrgIdOrderByCreatedAt(orgId).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public void revoke(String id) {
        ApiKey apiKey = apiKeys.findById(id).orElseThrow(() -> ResourceNotFoundException.of("API key", id));
        apiKeys.delete(apiKey);
        log.info("Revoked API key id={} orgId={}", id, apiKey.getOrgId());
    }

    /**
     * Finds the key for a presented token and stamps its last use. Empty for unknown or blank tokens.
     */
    @Transactional
    public Optional<ApiKey> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Optional<ApiKey> apiKey = apiKeys.findByTokenHash(ApiTokenHasher.hash(token.trim()));
        apiKey.ifPresent(key -> key.markUsed(clock.instant()));
        return apiKey;
    }

    private ApiKeyResponse toResponse(ApiKey apiKey) {
        return new ApiKeyResponse(apiKey.getId(), apiKey.getOrgId(), apiKey.getLabel(),
                json.readStrings(apiKey.getScopesJson()), apiKey.getCreatedAt(), apiKey.getLastUsedAt());
    }
}
