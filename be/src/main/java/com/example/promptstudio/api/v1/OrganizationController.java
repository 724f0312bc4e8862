package com.example.promptstudio.api.v1;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.MembershipCreateRequest;
import com.example.promptstudio.api.v1.dto.MembershipResponse;
import com.example.promptstudio.api.v1.dto.MembershipRoleRequest;
import com.example.promptstudio.api.v1.dto.OrganizationCreateRequest;
import com.example.promptstudio.api.v1.dto.OrganizationResponse;
import com.example.promptstudio.api.v1.dto.OrganizationUpdateRequest;
import com.example.promptstudio.service.OrganizationService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
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

import java.util.List;

/**
 * Organizations ({@code /api/v1/organizations}) and their members ({@code /{orgId}/members}).
 */
@RestController
@RequestMapping("/api/v1/organizations")
@RequiredArgsConstructor
@Slf4j
public class OrganizationController {

    private final OrganizationService service;

    @PostMapping
    public ResponseEntity<OrganizationResponse> create(@Valid @RequestBody OrganizationCreateRequest request) {
        log.info("Creating organization slug={} owner={}", request.slug(), request.ownerUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OrganizationResponse> getById(@PathVariable String id) {
        return ResponseEntity.ok(service.findById(id));
    }

    @GetMapping(params = "slug")
    public ResponseEntity<OrganizationResponse> getBySlug(@RequestParam String slug) {
        return ResponseEntity.ok(service.findBySlug(slug)
                .orElseThrow(() -> new ResourceNotFoundException("Organization with slug " + slug + " not found")));
    }

    @GetMapping(params = "userId")
    public ResponseEntity<List<OrganizationResponse>> listByUser(@RequestParam String userId) {
        return ResponseEntity.ok(service.findByUserId(userId));
    }

    @PutMapping("/{id}")
    public ResponseEntity<OrganizationResponse> update(@PathVariable String id, @Valid @RequestBody OrganizationUpdateRequest request) {
        log.info("Updating organization id={}", id);
        return ResponseEntity.ok(service.update(id, request));
    }

    @GetMapping("/{orgId}/members")
    public ResponseEntity<List<MembershipResponse>> listMembers(@PathVariable String orgId) {
        return ResponseEntity.ok(service.findMembers(orgId));
    }

    @GetMapping("/{orgId}/members/{userId}")
    public ResponseEntity<MembershipResponse> getMembership(@PathVariable String orgId, @PathVariable String userId) {
        return ResponseEntity.ok(service.findMembership(userId, orgId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + userId + " is not a member of organization " + orgId)));
    }

    @PostMapping("/{orgId}/members")
    public ResponseEntity<MembershipResponse> addMember(@PathVariable String orgId, @Valid @RequestBody MembershipCreateRequest request) {
        log.info("Adding member userId={} orgId={}", request.userId(), orgId);
        return ResponseEntity.status(HttpStatus.CREATED).body(service.addMember(orgId, request));
    }

    @PutMapping("/members/{membershipId}")
    public ResponseEntity<MembershipResponse> updateMemberRole(@PathVariable String membershipId,
                                                               @Valid @RequestBody MembershipRoleRequest request) {
        return ResponseEntity.ok(service.updateMemberRole(membershipId, request.role()));
    }

    @DeleteMapping("/members/{membershipId}")
    public ResponseEntity<Void> removeMember(@PathVariable String membershipId) {
        service.removeMember(membershipId);
        return ResponseEntity.noContent().build();
    }
}
