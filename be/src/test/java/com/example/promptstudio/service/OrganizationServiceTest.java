package com.example.promptstudio.service;

import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.MembershipCreateRequest;
import com.example.promptstudio.api.v1.dto.MembershipResponse;
import com.example.promptstudio.api.v1.dto.OrganizationCreateRequest;
import com.example.promptstudio.api.v1.dto.OrganizationResponse;
import com.example.promptstudio.api.v1.dto.OrganizationUpdateRequest;
import com.example.promptstudio.api.v1.dto.UserCreateRequest;
import com.example.promptstudio.api.v1.dto.UserResponse;
import com.example.promptstudio.api.v1.dto.UserUpdateRequest;
import com.example.promptstudio.domain.MembershipRole;
import com.example.promptstudio.domain.OrganizationPlan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(StudioFixtures.class)
@DisplayName("Users and organizations")
class OrganizationServiceTest {

    @Autowired
    private UserService users;

    @Autowired
    private OrganizationService organizations;

    @Autowired
    private StudioFixtures fixtures;

    @Nested
    @DisplayName("users")
    class Users {

        @Test
        @DisplayName("rejects a duplicate email")
        void duplicateEmail() {
            UserResponse user = fixtures.user();

            assertThatThrownBy(() -> users.create(new UserCreateRequest(user.email(), "Other", null)))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }

        @Test
        @DisplayName("keeps fields that are not sent and clears blank ones")
        void partialUpdate() {
            UserResponse user = users.create(new UserCreateRequest(StudioFixtures.unique("ada") + "@example.com", "Ada",
                    "https://img.example.com/ada.png"));

            UserResponse renamed = users.update(user.id(), new UserUpdateRequest("Ada L.", null));
            UserResponse cleared = users.update(user.id(), new UserUpdateRequest(null, ""));

            assertThat(renamed.name()).isEqualTo("Ada L.");
            assertThat(renamed.avatarUrl()).isEqualTo("https://img.example.com/ada.png");
            assertThat(cleared.name()).isEqualTo("Ada L.");
            assertThat(cleared.avatarUrl()).isNull();
        }

        @Test
        @DisplayName("finds users by exact email")
        void findByEmail() {
            UserResponse user = fixtures.user();

            assertThat(users.findByEmail(user.email())).map(UserResponse::id).contains(user.id());
            assertThat(users.findByEmail(user.email().toUpperCase())).isEmpty();
        }
    }

    @Nested
    @DisplayName("organizations")
    class Organizations {

        @Test
        @DisplayName("makes the creator an owner and defaults to the free plan")
        void creatorIsOwner() {
            UserResponse owner = fixtures.user();

            OrganizationResponse org = fixtures.organization(owner);

            assertThat(org.plan()).isEqualTo(OrganizationPlan.FREE);
            assertThat(organizations.findMembers(org.id()))
                    .singleElement()
                    .satisfies(m -> {
                        assertThat(m.userId()).isEqualTo(owner.id());
                        assertThat(m.role()).isEqualTo(MembershipRole.OWNER);
                    });
            assertThat(organizations.findByUserId(owner.id())).extracting(OrganizationResponse::id).containsExactly(org.id());
        }

        @Test
        @DisplayName("requires an existing owner")
        void unknownOwner() {
            assertThatThrownBy(() -> organizations.create(new OrganizationCreateRequest("X", StudioFixtures.unique("x"), "usr_missing", null)))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessage("Owner user with id usr_missing not found");
        }

        @Test
        @DisplayName("rejects a duplicate slug")
        void duplicateSlug() {
            UserResponse owner = fixtures.user();
            OrganizationResponse org = fixtures.organization(owner);

            assertThatThrownBy(() -> organizations.create(new OrganizationCreateRequest("Copy", org.slug(), owner.id(), null)))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }

        @Test
        @DisplayName("updates name and plan")
        void update() {
            OrganizationResponse org = fixtures.organization(fixtures.user());

            OrganizationResponse updated = organizations.update(org.id(), new OrganizationUpdateRequest("Acme Corp", null, OrganizationPlan.PRO));

            assertThat(updated.name()).isEqualTo("Acme Corp");
            assertThat(updated.slug()).isEqualTo(org.slug());
            assertThat(organizations.findBySlug(org.slug())).map(OrganizationResponse::plan).contains(OrganizationPlan.PRO);
        }
    }

    @Nested
    @DisplayName("memberships")
    class Memberships {

        @Test
        @DisplayName("adds, changes and removes a member")
        void memberLifecycle() {
            OrganizationResponse org = fixtures.organization(fixtures.user());
            UserResponse editor = fixtures.user();

            MembershipResponse added = organizations.addMember(org.id(), new MembershipCreateRequest(editor.id(), MembershipRole.EDITOR));
            MembershipResponse promoted = organizations.updateMemberRole(added.id(), MembershipRole.ADMIN);

            assertThat(promoted.role()).isEqualTo(MembershipRole.ADMIN);
            assertThat(organizations.findMembership(editor.id(), org.id())).map(MembershipResponse::role).contains(MembershipRole.ADMIN);

            organizations.removeMember(added.id());
            assertThat(organizations.findMembership(editor.id(), org.id())).isEmpty();
            assertThat(organizations.findMembers(org.id())).hasSize(1);
        }

        @Test
        @DisplayName("requires an existing user")
        void unknownUser() {
            OrganizationResponse org = fixtures.organization(fixtures.user());

            assertThatThrownBy(() -> organizations.addMember(org.id(), new MembershipCreateRequest("usr_missing", MembershipRole.VIEWER)))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
