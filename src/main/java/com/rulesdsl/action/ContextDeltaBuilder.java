package com.rulesdsl.action;

import com.rulesdsl.condition.Values;
import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.dsl.Action;
import com.rulesdsl.dsl.ActionOperator;
import com.rulesdsl.dsl.ActionValue;
import com.rulesdsl.variable.ContextSection;
import com.rulesdsl.variable.FieldPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulates the intended effect of SET actions as a nested map keyed like the context
 * (e.g. {@code {"pricing": {"factor": 1.2}}}). Arithmetic operators read the current value
 * from earlier entries of this delta first, then from the context.
 * Not thread-safe; one builder per evaluation.
 */
class ContextDeltaBuilder {

    private static final Logger log = LoggerFactory.getLogger(ContextDeltaBuilder.class);

    private final EvaluationContext context;
    private final FieldPathResolver resolver;
    private final Map<String, Object> delta = new LinkedHashMap<>();
    private final Map<String, Object> flat = new LinkedHashMap<>();

    ContextDeltaBuilder(EvaluationContext context, FieldPathResolver resolver) {
        this.context = context;
        this.resolver = resolver;
    }

    /**
     * Record the effect of a SET action, if it has a computable one.
     */
    void record(Action action) {
        String target = action.target();
        if (target == null || ContextSection.fromPath(target).isEmpty() || target.indexOf('.') < 0) {
            log.debug("SET target '{}' is not a context path, no delta recorded", target);
            return;
        }
        if (action.value() == null) {
            log.debug("SET {} has no value, no delta recorded", target);
            return;
        }

        ActionOperator operator = action.operator() == null ? ActionOperator.EQUALS : action.operator();
        Optional<Object> newValue = operator.isArithmetic()
                ? applyArithmetic(target, operator, action.value())
                : Optional.of(action.value().raw());

        newValue.ifPresent(value -> put(target, value));
    }

    Map<String, Object> build() {
        return freeze(delta);
    }

    private Optional<Object> applyArithmetic(String target, ActionOperator operator, ActionValue operand) {
        if (operand.kind() != ActionValue.Kind.NUMBER) {
            log.warn("SET {} {} needs a numeric value but got {}", target, operator.getWireName(), operand.kind());
            return Optional.empty();
        }

        Object current = flat.containsKey(target) ? flat.get(target) : currentValue(target);
        if (!(current instanceof Number currentNumber)) {
            log.warn("SET {} {}: current value {} is not numeric, no delta recorded",
                    target, operator.getWireName(), current);
            return Optional.empty();
        }

        BigDecimal a = Values.toBigDecimal(currentNumber);
        BigDecimal b = Values.toBigDecimal(operand.asNumber());
        BigDecimal result = switch (operator) {
            case ADD -> a.add(b);
            case SUBTRACT -> a.subtract(b);
            case MULTIPLY -> a.multiply(b);
            case DIVIDE -> b.signum() == 0 ? null : a.divide(b, MathContext.DECIMAL64);
            case EQUALS -> b;
        };
        if (result == null) {
            log.warn("SET {} divide by zero, no delta recorded", target);
            return Optional.empty();
        }
        return Optional.of(toNumber(result));
    }

    private Object currentValue(String target) {
        return context == null ? null : resolver.resolveOrNull(target, context);
    }

    @SuppressWarnings("unchecked")
    private void put(String path, Object value) {
        flat.put(path, value);

        String[] segments = path.split("\\.");
        Map<String, Object> node = delta;
        for (int i = 0; i < segments.length - 1; i++) {
            Object child = node.get(segments[i]);
            if (!(child instanceof Map)) {
                child = new LinkedHashMap<String, Object>();
                node.put(segments[i], child);
            }
            node = (Map<String, Object>) child;
        }
        node.put(segments[segments.length - 1], value);
    }

    /**
     * Integral results become Long, anything else Double.
     */
    private static Number toNumber(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            try {
                return stripped.longValueExact();
            } catch (ArithmeticException e) {
                return stripped;
            }
        }
        return stripped.doubleValue();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> freeze(Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k, v instanceof Map ? freeze((Map<String, Object>) v) : v));
        return Collections.unmodifiableMap(copy);
    }
}
