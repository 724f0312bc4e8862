package com.example.promptstudio.api.v1;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(StudioApiIntegrationTest.RestTestConfig.class)
@DisplayName("Studio REST API")
class StudioApiIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {};

    @TestConfiguration
    static class RestTestConfig {

        @Bean
        public RestTemplate restTemplate() {
            RestTemplate rest = new RestTemplate();
            rest.setErrorHandler(new org.springframework.web.client.ResponseErrorHandler() {
                @Override
                public boolean hasError(ClientHttpResponse response) {
                    return false;
                }

                @Override
                public void handleError(java.net.URI url, HttpMethod method, ClientHttpResponse response) throws java.io.IOException {
                }
            });
            return rest;
        }
    }

    @LocalServerPort
    private int port;

    @Autowired
    private RestTemplate restTemplate;

    private String userId;
    private String orgId;
    private String projectId;

    private String url(String path) {
        return "http://localhost:" + port + "/api/v1" + path;
    }

    private ResponseEntity<Map<String, Object>> send(HttpMethod method, String path, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(url(path), method, new HttpEntity<>(body, headers), JSON_OBJECT);
    }

    private ResponseEntity<Map<String, Object>> get(String path) {
        return restTemplate.exchange(url(path), HttpMethod.GET, null, JSON_OBJECT);
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    @BeforeEach
    void setUp() {
        ResponseEntity<Map<String, Object>> user = send(HttpMethod.POST, "/users",
                Map.of("email", "dev-" + suffix() + "@example.com", "name", "Dev"));
        assertThat(user.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        userId = (String) user.getBody().get("id");

        ResponseEntity<Map<String, Object>> org = send(HttpMethod.POST, "/organizations",
                Map.of("name", "Acme", "slug", "acme-" + suffix(), "ownerUserId", userId));
        assertThat(org.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(org.getBody()).containsEntry("plan", "free");
        orgId = (String) org.getBody().get("id");

        ResponseEntity<Map<String, Object>> project = send(HttpMethod.POST, "/projects",
                Map.of("orgId", orgId, "name", "Support bot", "tags", List.of("support")));
        assertThat(project.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        projectId = (String) project.getBody().get("id");
    }

    @Test
    @DisplayName("GET health reports the service as up")
    void health() {
        assertThat(get("/health").getBody()).containsEntry("status", "UP");
    }

    @Nested
    @DisplayName("prompts and runs")
    class PromptsAndRuns {

        @Test
        @DisplayName("records a run against a promoted version and exports it as CSV")
        void versionRunExport() {
            String promptId = (String) send(HttpMethod.POST, "/prompts", Map.of("projectId", projectId, "name", "Greeting"))
                    .getBody().get("id");
            ResponseEntity<Map<String, Object>> version = send(HttpMethod.POST, "/prompts/" + promptId + "/versions",
                    Map.of("version", "1.0.0", "content", "Hello {{name}}", "createdBy", userId));
            assertThat(version.getStatusCode()).isEqualTo(HttpStatus.CREATED);
            String versionId = (String) version.getBody().get("id");

            ResponseEntity<Map<String, Object>> promoted = send(HttpMethod.POST,
                    "/prompts/" + promptId + "/versions/" + versionId + "/promote", null);
            assertThat(promoted.getBody()).containsEntry("currentVersionId", versionId);

            ResponseEntity<Map<String, Object>> run = send(HttpMethod.POST, "/runs", Map.ofEntries(
                    Map.entry("projectId", projectId), Map.entry("promptId", promptId), Map.entry("versionId", versionId),
                    Map.entry("model", "gpt-4o-mini"), Map.entry("tokensIn", 120), Map.entry("tokensOut", 30),
                    Map.entry("costUsd", 0.0015), Map.entry("latencyMs", 420), Map.entry("success", true)));
            assertThat(run.getStatusCode()).isEqualTo(HttpStatus.CREATED);

            ResponseEntity<String> csv = restTemplate.getForEntity(url("/runs/export?orgId=" + orgId + "&format=csv"), String.class);
            assertThat(csv.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(csv.getHeaders().getContentType().toString()).startsWith("text/csv");
            assertThat(csv.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION)).contains("runs.csv");
            assertThat(csv.getBody()).startsWith("id,model,tokens_in").contains(",gpt-4o-mini,120,30,0.001500,420,");

            ResponseEntity<Map<String, Object>> analytics = get("/runs/analytics?orgId=" + orgId);
            assertThat(analytics.getBody()).containsEntry("totalRuns", 1).containsEntry("totalTokens", 150);
        }

        @Test
        @DisplayName("promoting a version of another prompt is a conflict")
        void promoteForeignVersion() {
            String promptA = (String) send(HttpMethod.POST, "/prompts", Map.of("projectId", projectId, "name", "A")).getBody().get("id");
            String promptB = (String) send(HttpMethod.POST, "/prompts", Map.of("projectId", projectId, "name", "B")).getBody().get("id");
            String versionB = (String) send(HttpMethod.POST, "/prompts/" + promptB + "/versions",
                    Map.of("version", "1.0.0", "content", "b", "createdBy", userId)).getBody().get("id");

            ResponseEntity<Map<String, Object>> resp = send(HttpMethod.POST, "/prompts/" + promptA + "/versions/" + versionB + "/promote", null);

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
            assertThat((String) resp.getBody().get("message")).contains("does not belong to prompt");
        }
    }

    @Nested
    @DisplayName("pipelines")
    class Pipelines {

        @Test
        @DisplayName("validates graphs without saving them")
        void validate() {
            ResponseEntity<Map<String, Object>> resp = send(HttpMethod.POST, "/pipelines/validate",
                    Map.of("nodes", List.of(Map.of("id", "a")), "edges", List.of(Map.of("source", "a", "target", "a"))));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).containsEntry("valid", false);
            assertThat(resp.getBody().get("errors")).asList()
                    .containsExactly("Node a must have a string type", "Pipeline graph contains cycles");
        }

        @Test
        @DisplayName("executes a published pipeline with an API key header")
        void publishAndExecute() {
            Map<String, Object> graph = Map.of("nodes", List.of(Map.of("id", "in", "type", "input")), "edges", List.of());
            String pipelineId = (String) send(HttpMethod.POST, "/pipelines",
                    Map.of("projectId", projectId, "name", "Echo", "graph", graph)).getBody().get("id");
            String slug = (String) send(HttpMethod.POST, "/pipelines/" + pipelineId + "/publish", null).getBody().get("endpointSlug");
            ResponseEntity<Map<String, Object>> key = send(HttpMethod.POST, "/api-keys", Map.of("orgId", orgId, "label", "ci"));
            assertThat(key.getStatusCode()).isEqualTo(HttpStatus.CREATED);
            String token = (String) key.getBody().get("token");

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.set("X-Api-Key", token);
            ResponseEntity<Map<String, Object>> ok = restTemplate.exchange(url("/pipelines/execute/" + slug), HttpMethod.POST,
                    new HttpEntity<>(Map.of("q", "hi"), headers), JSON_OBJECT);
            ResponseEntity<Map<String, Object>> noKey = send(HttpMethod.POST, "/pipelines/execute/" + slug, Map.of());

            assertThat(ok.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(ok.getBody()).containsEntry("success", true);
            assertThat(noKey.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(noKey.getBody()).containsEntry("success", false);
            assertThat(noKey.getBody().get("output")).isEqualTo(Map.of("error", "invalid API key"));
        }
    }

    @Nested
    @DisplayName("billing")
    class Billing {

        @Test
        @DisplayName("plan change to pro applies limits; unknown plans are rejected")
        void planChange() {
            ResponseEntity<Map<String, Object>> pro = send(HttpMethod.PUT, "/billing/" + orgId + "/plan", Map.of("plan", "pro", "customerId", "cus_1"));
            ResponseEntity<Map<String, Object>> gold = send(HttpMethod.PUT, "/billing/" + orgId + "/plan", Map.of("plan", "gold"));

            assertThat(pro.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(pro.getBody()).containsEntry("plan", "pro").containsEntry("seats", 5).containsEntry("meteredQuota", 10000);
            assertThat(get("/organizations/" + orgId).getBody()).containsEntry("plan", "pro");
            assertThat(gold.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(gold.getBody()).containsEntry("message", "Invalid plan: gold");
        }

        @Test
        @DisplayName("usage quota defaults without a billing row")
        void defaultQuota() {
            assertThat(get("/billing/" + orgId + "/usage").getBody())
                    .containsEntry("used", 0).containsEntry("quota", 1000).containsEntry("exceeded", false);
            assertThat(get("/billing/" + orgId).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("chat")
    class Chat {

        @Test
        @DisplayName("streams the reply as server-sent events ending with [DONE]")
        void streamReply() {
            String sessionId = (String) send(HttpMethod.POST, "/chat/sessions",
                    Map.of("projectId", projectId, "userId", userId, "model", "gpt-4o-mini")).getBody().get("id");
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setAccept(List.of(MediaType.TEXT_EVENT_STREAM));

            ResponseEntity<String> stream = restTemplate.exchange(url("/chat/sessions/" + sessionId + "/messages"), HttpMethod.POST,
                    new HttpEntity<>(Map.of("content", "Hello"), headers), String.class);

            assertThat(stream.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(stream.getBody()).contains("{\"content\":\"I \"}").contains("[DONE]");
            assertThat(get("/chat/sessions/" + sessionId).getBody().get("messages")).asList().hasSize(2);
        }
    }

    @Nested
    @DisplayName("error handling")
    class ErrorHandling {

        @Test
        @DisplayName("bean validation failures return 400 with field errors")
        void validationErrors() {
            ResponseEntity<Map<String, Object>> resp = send(HttpMethod.POST, "/users", Map.of("email", "not-an-email", "name", ""));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).containsEntry("message", "Validation failed");
            assertThat(resp.getBody().get("errors")).asList().hasSize(2);
        }

        @Test
        @DisplayName("unknown ids return 404 with a message")
        void notFound() {
            ResponseEntity<Map<String, Object>> resp = get("/users/usr_missing");

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(resp.getBody()).containsEntry("message", "User with id usr_missing not found");
        }

        @Test
        @DisplayName("duplicate slugs return 409 without store details")
        void duplicateSlug() {
            String slug = (String) get("/organizations/" + orgId).getBody().get("slug");

            ResponseEntity<Map<String, Object>> resp = send(HttpMethod.POST, "/organizations",
                    Map.of("name", "Copy", "slug", slug, "ownerUserId", userId));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
            assertThat(resp.getBody()).containsEntry("message", "Request conflicts with existing data");
        }

        @Test
        @DisplayName("malformed JSON returns 400")
        void malformedBody() {
            ResponseEntity<Map<String, Object>> resp = send(HttpMethod.POST, "/projects", "{ not json");

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).containsEntry("message", "Malformed request body");
        }
    }
}
