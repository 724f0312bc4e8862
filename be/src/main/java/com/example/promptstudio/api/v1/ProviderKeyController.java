package com.example.promptstudio.api.v1;

import com.example.promptstudio.api.v1.dto.ProviderKeyCreateRequest;
import com.example.promptstudio.api.v1.dto.ProviderKeyResponse;
import com.example.promptstudio.api.v1.dto.ProviderKeyTestRequest;
import com.example.promptstudio.api.v1.dto.ProviderKeyTestResponse;
import com.example.promptstudio.domain.AiProvider;
import com.example.promptstudio.service.ProviderKeyService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/provider-keys")
@RequiredArgsConstructor
@Slf4j
public class ProviderKeyController {

    private final ProviderKeyService service;

    @PostMapping
    public ResponseEntity<ProviderKeyResponse> create(@Valid @RequestBody ProviderKeyCreateRequest request) {
        log.info("Storing provider key orgId={} provider={}", request.orgId(), request.provider().wireName());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @GetMapping
    public ResponseEntity<List<ProviderKeyResponse>> listByOrg(@RequestParam String orgId,
                                                               @RequestParam(required = false) String provider) {
        if (provider != null) {
            return ResponseEntity.ok(service.findByOrgIdAndProvider(orgId, AiProvider.fromWireName(provider)));
        }
        return ResponseEntity.ok(service.findByOrgId(orgId));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        service.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/test")
    public ResponseEntity<ProviderKeyTestResponse> test(@RequestBody ProviderKeyTestRequest request) {
        return ResponseEntity.ok(service.test(request.provider(), request.apiKey()));
    }
}
