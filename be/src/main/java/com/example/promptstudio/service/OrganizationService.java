package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.MembershipCreateRequest;
import com.example.promptstudio.api.v1.dto.MembershipResponse;
import com.example.promptstudio.api.v1.dto.OrganizationCreateRequest;
import com.example.promptstudio.api.v1.dto.OrganizationResponse;
import com.example.promptstudio.api.v1.dto.OrganizationUpdateRequest;
import com.example.promptstudio.domain.Membership;
import com.example.promptstudio.domain.MembershipRole;
import com.example.promptstudio.domain.Organization;
import com.example.promptstudio.domain.OrganizationPlan;
import com.example.promptstudio.repository.MembershipRepository;
import com.example.promptstudio.repository.OrganizationRepository;
import com.example.promptstudio.repository.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Organizations and their memberships. Creating an organization also makes its owner a member with
 * the {@code owner} role, atomically.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrganizationService {

    private final OrganizationRepository organizations;
    private final MembershipRepository memberships;
    private final UserRepository users;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public OrganizationResponse create(OrganizationCreateRequest request) {
        if (!users.existsById(request.ownerUserId())) {
            throw new ResourceNotFoundException("Owner user with id " + request.ownerUserId() + " not found");
        }
        Organization organization = new Organization(idGenerator.newId("org"), request.name(), request.slug(),
                request.ownerUserId(), request.plan() != null ? request.plan() : OrganizationPlan.FREE, clock.instant());
        organizations.saveAndFlush(organization);
        memberships.save(new Membership(idGenerator.newId("mem"), organization.getId(), request.ownerUserId(),
                MembershipRole.OWNER, clock.instant()));
        log.info("Created organization id={} slug={} owner={}", organization.getId(), organization.getSlug(), request.ownerUserId());
        return toResponse(organization);
    }

    @Transactional(readOnly = true)
    public OrganizationResponse findById(String id) {
        return toResponse(require(id));
    }

    @Transactional(readOnly = true)
    public Optional<OrganizationResponse> findBySlug(String slug) {
        return organizations.findBySlug(slug).map(OrganizationService::toResponse);
    }

    @Transactional(readOnly = true)
    public List<OrganizationResponse> findByUserId(String userId) {
        return organizations.findByMemberUserId(userId).stream()
                .map(OrganizationService::toResponse)
                .toList();
    }

    @Transactional
    public OrganizationResponse update(String id, OrganizationUpdateRequest request) {
        Organization organization = require(id);
        organization.rename(Updates.keep(request.name(), organization.getName()), Updates.keep(request.slug(), organization.getSlug()));
        if (request.plan() != null) {
            organization.changePlan(request.plan());
        }
        organizations.saveAndFlush(organization);
        return toResponse(organization);
    }

    @Transactional
    public MembershipResponse addMember(String orgId, MembershipCreateRequest request) {
        require(orgId);
        if (!users.existsById(request.userId())) {
            throw ResourceNotFoundException.of("User", request.userId());
        }
        Membership membership = new Membership(idGenerator.newId("mem"), orgId, request.userId(), request.role(), clock.instant());
        memberships.save(membership);
        log.info("Added member userId={} orgId={} role={}", request.userId(), orgId, request.role().wireName());
        return toResponse(membership);
    }

    @Transactional
    public MembershipResponse updateMemberRole(String membershipId, MembershipRole role) {
        Membership membership = requireMembership(membershipId);
        membership.changeRole(role);
        memberships.save(membership);
        return toResponse(membership);
    }

    @Transactional(readOnly = true)
    public List<MembershipResponse> findMembers(String orgId) {
        return memberships.findByOrgIdOrderByCreatedAt(orgId).stream()
                .map(OrganizationService::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<MembershipResponse> findMembership(String userId, String orgId) {
        return memberships.findFirstByUserIdAndOrgId(userId, orgId).map(OrganizationService::toResponse);
    }

    @Transactional
    public void removeMember(String membershipId) {
        memberships.delete(requireMembership(membershipId));
        log.info("Removed membership id={}", membershipId);
    }

    Organization require(String id) {
        return organizations.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Organization", id));
    }

    private Membership requireMembership(String id) {
        return memberships.findById(id).orElseThrow(() -> ResourceNotFoundException.of("Membership", id));
    }

    static OrganizationResponse toResponse(Organization organization) {
        return new OrganizationResponse(organization.getId(), organization.getName(), organization.getSlug(),
                organization.getOwnerUserId(), organization.getPlan(), organization.getCreatedAt());
    }

    private static MembershipResponse toResponse(Membership membership) {
        return new MembershipResponse(membership.getId(), membership.getOrgId(), membership.getUserId(),
                membership.getRole(), membership.getCreatedAt());
    }
}
