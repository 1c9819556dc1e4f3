package com.rulesdsl.variable;

import com.rulesdsl.core.EvaluationContext;

import java.util.Optional;

/**
 * Resolves dotted field paths (e.g. "risk.classCode", "coverage.building.limit")
 * against an evaluation context.
 */
public interface FieldPathResolver {

    /**
     * Resolve a field path.
     *
     * @param path    Dotted path, first segment is the context section
     * @param context Evaluation context
     * @return Resolved value, or empty if any segment is missing or null
     */
    Optional<Object> resolve(String path, EvaluationContext context);

    /**
     * Resolve a field path, returning null when it cannot be resolved.
     */
    default Object resolveOrNull(String path, EvaluationContext context) {
        return resolve(path, context).orElse(null);
    }
}
