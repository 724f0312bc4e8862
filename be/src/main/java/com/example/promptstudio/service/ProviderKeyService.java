package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.ProviderKeyCreateRequest;
import com.example.promptstudio.api.v1.dto.ProviderKeyResponse;
import com.example.promptstudio.api.v1.dto.ProviderKeyTestResponse;
import com.example.promptstudio.crypto.ProviderKeyCipher;
import com.example.promptstudio.domain.AiProvider;
import com.example.promptstudio.domain.ProviderKey;
import com.example.promptstudio.repository.OrganizationRepository;
import com.example.promptstudio.repository.ProviderKeyRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderKeyService {

    private final ProviderKeyRepository providerKeys;
    private final OrganizationRepository organizations;
    private final ProviderKeyCipher cipher;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public ProviderKeyResponse create(ProviderKeyCreateRequest request) {
        if (!organizations.existsById(request.orgId())) {
            throw ResourceNotFoundException.of("Organization", request.orgId());
        }
        ProviderKey key = new ProviderKey(idGenerator.newId("pk"), request.orgId(), request.provider(), request.label(),
                cipher.encrypt(request.apiKey()), clock.instant());
        providerKeys.save(key);
        log.info("Stored provider key id={} orgId={} provider={}", key.getId(), key.getOrgId(), key.getProvider().wireName());
        return toResponse(key);
    }

    @Transactional(readOnly = true)
    public List<ProviderKeyResponse> findByOrgId(String orgId) {
        return providerKeys.findByOrgIdOrderByCreatedAt(orgId).stream()
                .map(ProviderKeyService::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ProviderKeyResponse> findByOrgIdAndProvider(String orgId, AiProvider provider) {
        return providerKeys.findByOrgIdAndProviderOrderByCreatedAt(orgId, provider).stream()
                .map(ProviderKeyService::toResponse)
                .toList();
    }

    @Transactional
    public void delete(String id) {
        ProviderKey key = providerKeys.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Provider key", id));
        providerKeys.delete(key);
        log.info("Deleted provider key id={}", id);
    }

    /**
     * Offline plausibility check of a provider key. Never throws; problems are reported in the result.
     */
    public ProviderKeyTestResponse test(String provider, String apiKey) {
        AiProvider parsed;
        try {
            parsed = AiProvider.fromWireName(provider);
        } catch (IllegalArgumentException e) {
            return new ProviderKeyTestResponse(false, "Unsupported provider: " + provider);
        }
        if (apiKey == null || apiKey.isBlank()) {
            return new ProviderKeyTestResponse(false, "API key must not be empty");
        }
        log.debug("Provider key test passed provider={}", parsed.wireName());
        return new ProviderKeyTestResponse(true, null);
    }

    /** Decrypted key for calling the provider. */
    @Transactional(readOnly = true)
    public String reveal(String id) {
        ProviderKey key = providerKeys.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Provider key", id));
        return cipher.decrypt(key.getEncryptedApiKey());
    }

    private static ProviderKeyResponse toResponse(ProviderKey key) {
        return new ProviderKeyResponse(key.getId(), key.getOrgId(), key.getProvider(), key.getLabel(), key.getCreatedAt());
    }
}
