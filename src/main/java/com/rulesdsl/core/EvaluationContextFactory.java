package com.rulesdsl.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulesdsl.variable.ContextSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Factory for creating an EvaluationContext from a JSON document or a plain map.
 * Top-level keys must be section keys ("risk", "coverage", ...); nested objects are kept
 * nested and reached through dotted paths.
 */
public class EvaluationContextFactory {

    private static final Logger log = LoggerFactory.getLogger(EvaluationContextFactory.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Create a context from a JSON object, e.g. {@code {"risk": {"state": "CA"}}}.
     *
     * @param json JSON document
     * @return Evaluation context
     * @throws IllegalArgumentException if the JSON is malformed
     */
    public static EvaluationContext fromJson(String json) {
        return fromJson(null, json);
    }

    public static EvaluationContext fromJson(String contextId, String json) {
        if (json == null || json.isBlank()) {
            return EvaluationContext.builder().contextId(contextId).build();
        }
        return fromMap(contextId, parseJson(json));
    }

    /**
     * Create a context from a map keyed by section key.
     */
    @SuppressWarnings("unchecked")
    public static EvaluationContext fromMap(String contextId, Map<String, ?> sections) {
        EvaluationContext.Builder builder = EvaluationContext.builder().contextId(contextId);
        if (sections == null) {
            return builder.build();
        }

        for (Map.Entry<String, ?> entry : sections.entrySet()) {
            Optional<ContextSection> section = ContextSection.fromKey(entry.getKey());
            if (section.isEmpty()) {
                log.warn("Ignoring unknown context section '{}'", entry.getKey());
                continue;
            }
            if (entry.getValue() instanceof Map<?, ?> attributes) {
                builder.section(section.get(), (Map<String, ?>) attributes);
            } else if (entry.getValue() != null) {
                log.warn("Ignoring context section '{}': expected an object but got {}",
                        entry.getKey(), entry.getValue().getClass().getSimpleName());
            }
        }
        return builder.build();
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid context JSON: " + e.getMessage(), e);
        }
    }
}
