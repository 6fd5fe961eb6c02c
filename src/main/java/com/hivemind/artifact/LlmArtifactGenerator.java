package com.hivemind.artifact;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import com.hivemind.core.error.ArtifactGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Generates artifacts through Spring AI's {@link ChatClient} with structured output.
 * <p>
 * The model answers with an {@link ArtifactDraft}; {@link BeanOutputConverter} parses it and a
 * lenient Jackson pass handles answers wrapped in markdown fences.
 */
@Service
public class LlmArtifactGenerator implements ArtifactGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmArtifactGenerator.class);

    static final String SYSTEM_PROMPT = """
            You are a platform developer agent in a coordinated team. You produce exactly one
            artifact for the task you are given. Answer with the artifact name, the record
            fields to store (field name to value, values as plain strings) and a one-sentence
            summary of what the artifact does.
            """;

    /** Shape the model is asked to answer with. */
    public record ArtifactDraft(String name, Map<String, String> fields, String summary) {
    }

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper;

    public LlmArtifactGenerator(ChatClient.Builder builder) {
        this.chatClient = builder.build();
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .registerModule(new ParameterNamesModule());
    }

    @Override
    public GeneratedArtifact generate(ArtifactRequest request) {
        String table = request.targetTable();
        log.info("Generating {} artifact for task {}", table, request.taskId());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(ArtifactDraft.class);

        String response;
        try {
            response = chatClient.prompt()
                    .system(SYSTEM_PROMPT)
                    .user(userPrompt(request, table) + "\n\n" + converter.getFormat())
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new ArtifactGenerationException(ArtifactGenerationException.Kind.BACKEND_UNAVAILABLE,
                    "Artifact backend call failed for task " + request.taskId() + ": " + e.getMessage(), null, e);
        }
        log.info("Artifact backend responded for {} ({}s)", request.taskId(),
                String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
        if (response == null || response.isBlank()) {
            throw new ArtifactGenerationException(ArtifactGenerationException.Kind.BACKEND_UNAVAILABLE,
                    "Artifact backend returned empty content for task " + request.taskId(), response, null);
        }

        ArtifactDraft draft = parse(converter, response);
        if (draft.name() == null || draft.name().isBlank()) {
            throw new ArtifactGenerationException(ArtifactGenerationException.Kind.CONTENT_PARSE,
                    "Artifact for task " + request.taskId() + " has no name", response, null);
        }
        return new GeneratedArtifact(table, draft.name(), draft.fields(), draft.summary());
    }

    private ArtifactDraft parse(BeanOutputConverter<ArtifactDraft> converter, String response) {
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Structured parse failed ({}), trying lenient parse", e.getMessage());
            log.debug("Raw artifact response: {}", response);
        }
        try {
            return lenientMapper.readValue(stripFences(response), ArtifactDraft.class);
        } catch (Exception e) {
            throw new ArtifactGenerationException(ArtifactGenerationException.Kind.CONTENT_PARSE,
                    "Could not parse artifact response: " + e.getMessage(), response, e);
        }
    }

    static String stripFences(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    private static String userPrompt(ArtifactRequest request, String table) {
        return """
                Objective: %s
                Task: %s
                Artifact kind: %s (stored in table %s)
                Your role: %s with capabilities %s
                """.formatted(request.objective(), request.taskContent(), request.taskType().tag(), table,
                request.role() != null ? request.role().tag() : "generalist",
                request.role() != null ? request.role().capabilities() : "[]");
    }
}
