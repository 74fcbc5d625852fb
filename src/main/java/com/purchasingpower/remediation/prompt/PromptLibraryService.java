package com.purchasingpower.remediation.prompt;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.remediation.model.GenerationPrompt;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from classpath:prompts/*.yaml once at startup and compiles them with
 * Mustache. Rendering afterwards touches no files.
 *
 * Usage:
 * GenerationPrompt prompt = promptLibrary.render("remediation", Map.of(
 *     "language", "python",
 *     "ruleName", "SQL Injection"
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private static final String LOCATION = "classpath:prompts/*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, CompiledTemplate> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(LOCATION);

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), compile(template));
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * Render both halves of a template with the same variables.
     */
    public GenerationPrompt render(String templateName, Map<String, Object> variables) {
        CompiledTemplate compiled = templates.get(templateName);

        if (compiled == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }

        return new GenerationPrompt(
                execute(compiled.system(), variables).strip(),
                execute(compiled.user(), variables).strip());
    }

    public boolean hasTemplate(String name) {
        return templates.containsKey(name);
    }

    private CompiledTemplate compile(PromptTemplate template) {
        if (template.getName() == null || template.getSystemPrompt() == null || template.getUserPrompt() == null) {
            throw new IllegalStateException("Prompt template is missing name, systemPrompt or userPrompt");
        }
        return new CompiledTemplate(
                mustacheFactory.compile(new StringReader(template.getSystemPrompt()), template.getName() + "-system"),
                mustacheFactory.compile(new StringReader(template.getUserPrompt()), template.getName() + "-user"));
    }

    private static String execute(Mustache mustache, Map<String, Object> variables) {
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    private record CompiledTemplate(Mustache system, Mustache user) {
    }
}
