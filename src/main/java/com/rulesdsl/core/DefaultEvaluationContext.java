package com.rulesdsl.core;

import com.rulesdsl.variable.ContextSection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of EvaluationContext.
 * Immutable after construction.
 */
public final class DefaultEvaluationContext implements EvaluationContext {

    private final String contextId;
    private final Map<String, Object> root;

    private DefaultEvaluationContext(Builder builder) {
        this.contextId = builder.contextId;

        Map<String, Object> sections = new LinkedHashMap<>();
        for (Map.Entry<ContextSection, Map<String, Object>> entry : builder.sections.entrySet()) {
            sections.put(entry.getKey().getKey(), deepCopy(entry.getValue()));
        }
        this.root = Collections.unmodifiableMap(sections);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> getSection(ContextSection section) {
        return Optional.ofNullable((Map<String, Object>) root.get(section.getKey()));
    }

    @Override
    public Map<String, Object> asMap() {
        return root;
    }

    @Override
    public Optional<String> getContextId() {
        return Optional.ofNullable(contextId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DefaultEvaluationContext that)) return false;
        return root.equals(that.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "EvaluationContext{" +
                "contextId='" + contextId + '\'' +
                ", sections=" + root +
                '}';
    }

    /**
     * Copy nested maps and lists into unmodifiable structures. Null values are kept
     * so that "present but null" and "absent" both read as absent downstream.
     */
    static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(deepCopy(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Builder for DefaultEvaluationContext.
     */
    public static class Builder implements EvaluationContext.Builder {
        private String contextId;
        private final Map<ContextSection, Map<String, Object>> sections = new EnumMap<>(ContextSection.class);

        @Override
        public Builder contextId(String contextId) {
            this.contextId = contextId;
            return this;
        }

        @Override
        public Builder section(ContextSection section, Map<String, ?> attributes) {
            if (section != null && attributes != null) {
                sections.computeIfAbsent(section, s -> new LinkedHashMap<>()).putAll(attributes);
            }
            return this;
        }

        @Override
        public Builder attribute(ContextSection section, String name, Object value) {
            if (section != null && name != null) {
                sections.computeIfAbsent(section, s -> new LinkedHashMap<>()).put(name, value);
            }
            return this;
        }

        @Override
        public EvaluationContext build() {
            return new DefaultEvaluationContext(this);
        }
    }
}
