package com.example.promptstudio.service;

import com.example.promptstudio.api.DomainRuleViolationException;
import com.example.promptstudio.api.ResourceNotFoundException;
import com.example.promptstudio.api.v1.dto.ChatSessionCreateRequest;
import com.example.promptstudio.api.v1.dto.PipelineCreateRequest;
import com.example.promptstudio.api.v1.dto.ProjectResponse;
import com.example.promptstudio.api.v1.dto.ProjectUpdateRequest;
import com.example.promptstudio.api.v1.dto.PromptResponse;
import com.example.promptstudio.api.v1.dto.PromptUpdateRequest;
import com.example.promptstudio.api.v1.dto.PromptVersionResponse;
import com.example.promptstudio.api.v1.dto.UserResponse;
import com.example.promptstudio.api.v1.dto.VersionComparisonResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(StudioFixtures.class)
@DisplayName("Projects and prompts")
class PromptServiceTest {

    @Autowired
    private ProjectService projects;

    @Autowired
    private PromptService prompts;

    @Autowired
    private RunService runs;

    @Autowired
    private PipelineService pipelines;

    @Autowired
    private ChatSessionService chatSessions;

    @Autowired
    private StudioFixtures fixtures;

    private UserResponse author;
    private ProjectResponse project;

    @BeforeEach
    void setUp() {
        author = fixtures.user();
        project = fixtures.project(fixtures.organization(author));
    }

    @Nested
    @DisplayName("versions")
    class Versions {

        @Test
        @DisplayName("promotes a version of the same prompt")
        void promote() {
            PromptResponse prompt = fixtures.prompt(project);
            PromptVersionResponse v1 = fixtures.version(prompt, author, "1.0.0");

            PromptResponse promoted = prompts.promoteVersion(prompt.id(), v1.id());

            assertThat(prompt.currentVersionId()).isNull();
            assertThat(promoted.currentVersionId()).isEqualTo(v1.id());
            assertThat(v1.variables()).containsEntry("name", "string");
            assertThat(v1.testInputs()).containsEntry("name", "Ada");
        }

        @Test
        @DisplayName("refuses to promote a version of another prompt")
        void promoteForeignVersion() {
            PromptResponse prompt = fixtures.prompt(project);
            PromptResponse other = fixtures.prompt(project);
            PromptVersionResponse foreign = fixtures.version(other, author, "1.0.0");

            assertThatThrownBy(() -> prompts.promoteVersion(prompt.id(), foreign.id()))
                    .isInstanceOf(DomainRuleViolationException.class)
                    .hasMessage("Version " + foreign.id() + " does not belong to prompt " + prompt.id());
        }

        @Test
        @DisplayName("compares two versions of the same prompt")
        void compare() {
            PromptResponse prompt = fixtures.prompt(project);
            PromptVersionResponse v1 = fixtures.version(prompt, author, "1.0.0");
            PromptVersionResponse v2 = fixtures.version(prompt, author, "1.1.0");

            VersionComparisonResponse comparison = prompts.compareVersions(v1.id(), v2.id());

            assertThat(comparison.version1().version()).isEqualTo("1.0.0");
            assertThat(comparison.version2().version()).isEqualTo("1.1.0");
            assertThat(prompts.findVersions(prompt.id())).hasSize(2);
        }

        @Test
        @DisplayName("refuses to compare versions of different prompts")
        void compareAcrossPrompts() {
            PromptVersionResponse a = fixtures.version(fixtures.prompt(project), author, "1.0.0");
            PromptVersionResponse b = fixtures.version(fixtures.prompt(project), author, "1.0.0");

            assertThatThrownBy(() -> prompts.compareVersions(a.id(), b.id()))
                    .isInstanceOf(DomainRuleViolationException.class)
                    .hasMessage("Versions must belong to the same prompt");
            assertThatThrownBy(() -> prompts.compareVersions(a.id(), "ver_missing"))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessage("Version 2 with id ver_missing not found");
        }

        @Test
        @DisplayName("clears the description with a blank value")
        void clearDescription() {
            PromptResponse prompt = fixtures.prompt(project);
            prompts.update(prompt.id(), new PromptUpdateRequest(null, "Says hello"));

            PromptResponse cleared = prompts.update(prompt.id(), new PromptUpdateRequest(null, " "));

            assertThat(cleared.name()).isEqualTo("Greeting");
            assertThat(cleared.description()).isNull();
        }
    }

    @Nested
    @DisplayName("projects")
    class Projects {

        @Test
        @DisplayName("replaces tags on update")
        void updateTags() {
            ProjectResponse updated = projects.update(project.id(), new ProjectUpdateRequest(null, "Handles tickets", List.of("a", "b")));

            assertThat(updated.tags()).containsExactly("a", "b");
            assertThat(updated.description()).isEqualTo("Handles tickets");
            assertThat(updated.name()).isEqualTo(project.name());
        }

        @Test
        @DisplayName("deleting a project removes what hangs off it")
        void deleteCascades() {
            PromptResponse prompt = fixtures.prompt(project);
            PromptVersionResponse version = fixtures.version(prompt, author, "1.0.0");
            fixtures.run(version, project.id(), "gpt-4o-mini", 10, "0.001", 10, true);
            pipelines.create(new PipelineCreateRequest(project.id(), "Flow", Map.of("nodes", List.of(), "edges", List.of())));
            chatSessions.create(new ChatSessionCreateRequest(project.id(), author.id(), "Chat", "gpt-4o-mini"));

            projects.delete(project.id());

            assertThatThrownBy(() -> projects.findById(project.id())).isInstanceOf(ResourceNotFoundException.class);
            assertThatThrownBy(() -> prompts.findById(prompt.id())).isInstanceOf(ResourceNotFoundException.class);
            assertThatThrownBy(() -> prompts.findVersionById(version.id())).isInstanceOf(ResourceNotFoundException.class);
            assertThat(runs.findByProjectId(project.id(), null)).isEmpty();
            assertThat(pipelines.findByProjectId(project.id())).isEmpty();
            assertThat(chatSessions.findByProjectId(project.id())).isEmpty();
        }
    }
}
