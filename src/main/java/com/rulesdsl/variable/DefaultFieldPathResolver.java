package com.rulesdsl.variable;

import com.rulesdsl.core.EvaluationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of FieldPathResolver.
 * Walks maps by key and lists by numeric index; anything else ends the walk.
 */
public class DefaultFieldPathResolver implements FieldPathResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultFieldPathResolver.class);

    @Override
    public Optional<Object> resolve(String path, EvaluationContext context) {
        if (path == null || path.isEmpty() || context == null) {
            return Optional.empty();
        }

        Object current = context.asMap();
        for (String segment : path.split("\\.", -1)) {
            current = step(current, segment);
            if (current == null) {
                log.trace("Path {} not resolved at segment '{}'", path, segment);
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (current instanceof List<?> list) {
            return elementAt(list, segment);
        }
        return null;
    }

    private Object elementAt(List<?> list, String segment) {
        if (segment.isEmpty() || !segment.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            int index = Integer.parseInt(segment);
            return index < list.size() ? list.get(index) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
