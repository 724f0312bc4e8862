package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.UserCreateRequest;
import com.example.promptstudio.api.v1.dto.UserResponse;
import com.example.promptstudio.api.v1.dto.UserUpdateRequest;
import com.example.promptstudio.domain.User;
import com.example.promptstudio.repository.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * User accounts. Email uniqueness is enforced by the store; a duplicate surfaces as a constraint violation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository repository;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public UserResponse create(UserCreateRequest request) {
        User user = new User(idGenerator.newId("usr"), request.email(), request.name(),
                Updates.clearable(request.avatarUrl(), null), clock.instant());
        repository.saveAndFlush(user);
        log.debug("Created user id={}", user.getId());
        return toResponse(user);
    }

    @Transactional(readOnly = true)
    public UserResponse findById(String id) {
        return toResponse(require(id));
    }

    /** Exact, case-sensitive email match. */
    @Transactional(readOnly = true)
    public Optional<UserResponse> findByEmail(String email) {
        return repository.findByEmail(email).map(UserService::toResponse);
    }

    @Transactional
    public UserResponse update(String id, UserUpdateRequest request) {
        User user = require(id);
        user.updateProfile(Updates.keep(request.name(), user.getName()), Updates.clearable(request.avatarUrl(), user.getAvatarUrl()));
        repository.save(user);
        log.debug("Updated user id={}", id);
        return toResponse(user);
    }

    /** Stamps the last login time; unknown ids are ignored. */
    @Transactional
    public void updateLastLogin(String id) {
        repository.findById(id).ifPresentOrElse(
                user -> user.recordLogin(clock.instant()),
                () -> log.debug("Ignoring last-login update for unknown user id={}", id));
    }

    User require(String id) {
        return repository.findById(id).orElseThrow(() -> ResourceNotFoundException.of("User", id));
    }

    static UserResponse toResponse(User user) {
        return new UserResponse(user.getId(), user.getEmail(), user.getName(), user.getAvatarUrl(),
                user.getCreatedAt(), user.getLastLoginAt());
    }
}
