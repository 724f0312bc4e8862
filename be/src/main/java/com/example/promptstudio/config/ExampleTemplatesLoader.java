package com.example.promptstudio.config;

import com.example.promptstudio.service.TemplateService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Seeds the public template catalogue from classpath resources at startup.
 * Existing public templates are updated in place (by name) so the catalogue stays in sync.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExampleTemplatesLoader implements ApplicationRunner {

    static final String TEMPLATES_DIR = "templates/";
    static final List<String> TEMPLATE_FILES = List.of(
            "customer-support.json",
            "code-review.json",
            "summarization.json"
    );

    private final TemplateService templateService;
    private final JsonMapper jsonMapper;

    @Override
    public void run(ApplicationArguments args) {
        for (String filename : TEMPLATE_FILES) {
            loadTemplate(TEMPLATES_DIR + filename);
        }
    }

    private void loadTemplate(String path) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Template resource not found: {}", path);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            SeedTemplate seed = jsonMapper.readValue(in, SeedTemplate.class);
            if (seed.name() == null || seed.category() == null) {
                log.warn("Skipping template {}: name and category are required", path);
                return;
            }
            templateService.upsertPublicTemplate(seed.name(), seed.category(), seed.content() != null ? seed.content() : Map.of());
            log.info("Loaded public template: {}", seed.name());
        } catch (JacksonException e) {
            log.error("Failed to parse template {}: {}", path, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read template {}: {}", path, e.getMessage());
        }
    }

    public record SeedTemplate(String name, String category, Map<String, Object> content) {
    }
}
