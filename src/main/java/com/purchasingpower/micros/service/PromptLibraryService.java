package com.purchasingpower.micros.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.micros.model.prompt.PromptTemplate;
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
 * Loads prompts from classpath:prompts/*.yaml and renders them with Mustache.
 *
 * Usage:
 * String prompt = promptLibrary.render("intent-extractor", Map.of("message", text));
 * String system = promptLibrary.renderSystem("logging-agent", Map.of("userId", 1));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    /**
     * System and user prompts combined into one message.
     */
    public String render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = require(templateName);
        String fullPrompt = nullToEmpty(template.getSystemPrompt()) + "\n\n" + nullToEmpty(template.getUserPrompt());
        return renderText(templateName, fullPrompt, variables);
    }

    /**
     * System prompt only, for transcripts that carry the user message separately.
     */
    public String renderSystem(String templateName, Map<String, Object> variables) {
        PromptTemplate template = require(templateName);
        return renderText(templateName + "#system", nullToEmpty(template.getSystemPrompt()), variables);
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }

    private PromptTemplate require(String templateName) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        return template;
    }

    private String renderText(String cacheName, String text, Map<String, Object> variables) {
        Mustache mustache = mustacheFactory.compile(new StringReader(text), cacheName);
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString().trim();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
