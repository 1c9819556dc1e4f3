package com.rulesdsl.core;

import com.rulesdsl.variable.ContextSection;

import java.util.Map;
import java.util.Optional;

/**
 * Runtime attribute bag a rule is evaluated against.
 * Immutable after creation: every section is a deep, unmodifiable snapshot,
 * so one context can be shared by concurrent evaluations.
 */
public interface EvaluationContext {

    /**
     * Get a section's attributes.
     *
     * @param section Context section
     * @return Section attributes, or empty if the section was not supplied
     */
    Optional<Map<String, Object>> getSection(ContextSection section);

    /**
     * Get the whole context keyed by section key ("risk", "policy", ...).
     */
    Map<String, Object> asMap();

    /**
     * Get the caller-supplied identifier used in logs, if any.
     */
    Optional<String> getContextId();

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultEvaluationContext.Builder();
    }

    /**
     * An empty context.
     */
    static EvaluationContext empty() {
        return builder().build();
    }

    /**
     * Builder for EvaluationContext.
     */
    interface Builder {
        Builder contextId(String contextId);
        Builder section(ContextSection section, Map<String, ?> attributes);
        Builder attribute(ContextSection section, String name, Object value);
        EvaluationContext build();
    }
}
