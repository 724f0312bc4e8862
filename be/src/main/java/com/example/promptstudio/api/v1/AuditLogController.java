package com.example.promptstudio.api.v1;

import com.example.promptstudio.api.v1.dto.AuditLogCreateRequest;
import com.example.promptstudio.api.v1.dto.AuditLogResponse;
import com.example.promptstudio.service.AuditLogService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
public class AuditLogController {

    private final AuditLogService service;

    @PostMapping
    public ResponseEntity<AuditLogResponse> log(@Valid @RequestBody AuditLogCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.record(request));
    }

    @GetMapping(params = "orgId")
    public ResponseEntity<List<AuditLogResponse>> byOrg(@RequestParam String orgId,
                                                        @RequestParam(required = false) Integer limit,
                                                        @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(service.findByOrgId(orgId, limit, offset));
    }

    @GetMapping(params = "userId")
    public ResponseEntity<List<AuditLogResponse>> byUser(@RequestParam String userId,
                                                         @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(service.findByUserId(userId, limit));
    }

    @GetMapping(params = {"targetType", "targetId"})
    public ResponseEntity<List<AuditLogResponse>> byTarget(@RequestParam String targetType, @RequestParam String targetId) {
        return ResponseEntity.ok(service.findByTarget(targetType, targetId));
    }
}
