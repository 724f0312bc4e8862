package com.example.promptstudio.api.v1.dto;

import com.example.promptstudio.domain.MembershipRole;

import java.time.Instant;

public record MembershipResponse(String id, String orgId, String userId, MembershipRole role, Instant createdAt) {
}
