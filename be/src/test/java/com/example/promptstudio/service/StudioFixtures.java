package com.example.promptstudio.service;

import com.example.promptstudio.api.v1.dto.OrganizationCreateRequest;
import com.example.promptstudio.api.v1.dto.OrganizationResponse;
import com.example.promptstudio.api.v1.dto.ProjectCreateRequest;
import com.example.promptstudio.api.v1.dto.ProjectResponse;
import com.example.promptstudio.api.v1.dto.PromptCreateRequest;
import com.example.promptstudio.api.v1.dto.PromptResponse;
import com.example.promptstudio.api.v1.dto.PromptVersionCreateRequest;
import com.example.promptstudio.api.v1.dto.PromptVersionResponse;
import com.example.promptstudio.api.v1.dto.RunCreateRequest;
import com.example.promptstudio.api.v1.dto.RunResponse;
import com.example.promptstudio.api.v1.dto.UserCreateRequest;
import com.example.promptstudio.api.v1.dto.UserResponse;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestComponent;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds a fresh user / organization / project / prompt chain per test. Emails and slugs are unique
 * so tests can share the application context and its database.
 */
@TestComponent
public class StudioFixtures {

    @Autowired
    private UserService users;

    @Autowired
    private OrganizationService organizations;

    @Autowired
    private ProjectService projects;

    @Autowired
    private PromptService prompts;

    @Autowired
    private RunService runs;

    public static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public UserResponse user() {
        return users.create(new UserCreateRequest(unique("user") + "@example.com", "Test User", null));
    }

    public OrganizationResponse organization(UserResponse owner) {
        return organizations.create(new OrganizationCreateRequest("Acme", unique("acme"), owner.id(), null));
    }

    public ProjectResponse project(OrganizationResponse organization) {
        return projects.create(new ProjectCreateRequest(organization.id(), "Support bot", null, List.of("support")));
    }

    public PromptResponse prompt(ProjectResponse project) {
        return prompts.create(new PromptCreateRequest(project.id(), "Greeting", null));
    }

    public PromptVersionResponse version(PromptResponse prompt, UserResponse author, String label) {
        return prompts.createVersion(prompt.id(), new PromptVersionCreateRequest(label, "Hello {{name}}",
                Map.of("name", "string"), Map.of("name", "Ada"), "v" + label, author.id()));
    }

    public RunResponse run(PromptVersionResponse version, String projectId, String model, int tokensIn,
                           String cost, int latencyMs, boolean success) {
        return runs.create(new RunCreateRequest(projectId, version.promptId(), version.id(), null, model,
                Map.of("name", "Ada"), Map.of("text", "Hello Ada"), tokensIn, 10, new BigDecimal(cost), latencyMs, success, null));
    }
}
