package com.rulesdsl.dsl;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged value carried by an action. The {@link Kind} tells consumers which
 * accessor is valid, so they can switch on it instead of inspecting types.
 *
 * @param kind Value kind
 * @param raw  Underlying value (String, Number, Boolean, unmodifiable List or Map)
 */
public record ActionValue(Kind kind, Object raw) {

    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        LIST,
        OBJECT
    }

    public ActionValue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(raw, "raw");
    }

    /**
     * Wrap a JSON-native value, inferring its kind.
     *
     * @throws IllegalArgumentException if the value is not a string, number, boolean, list or map
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ActionValue of(Object value) {
        if (value instanceof ActionValue av) {
            return av;
        }
        if (value instanceof String s) {
            return new ActionValue(Kind.STRING, s);
        }
        if (value instanceof Number n) {
            return new ActionValue(Kind.NUMBER, n);
        }
        if (value instanceof Boolean b) {
            return new ActionValue(Kind.BOOLEAN, b);
        }
        if (value instanceof List<?> list) {
            return new ActionValue(Kind.LIST, Collections.unmodifiableList(new ArrayList<>(list)));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return new ActionValue(Kind.OBJECT, Collections.unmodifiableMap(copy));
        }
        throw new IllegalArgumentException("Unsupported action value: "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    public static ActionValue ofString(String value) {
        return new ActionValue(Kind.STRING, value);
    }

    public static ActionValue ofNumber(Number value) {
        return new ActionValue(Kind.NUMBER, value);
    }

    public static ActionValue ofBoolean(boolean value) {
        return new ActionValue(Kind.BOOLEAN, value);
    }

    @JsonValue
    public Object raw() {
        return raw;
    }

    public String asString() {
        requireKind(Kind.STRING);
        return (String) raw;
    }

    public Number asNumber() {
        requireKind(Kind.NUMBER);
        return (Number) raw;
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) raw;
    }

    @SuppressWarnings("unchecked")
    public List<Object> asList() {
        requireKind(Kind.LIST);
        return (List<Object>) raw;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> asObject() {
        requireKind(Kind.OBJECT);
        return (Map<String, Object>) raw;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Action value is " + kind + ", not " + expected);
        }
    }

    @Override
    public String toString() {
        return String.valueOf(raw);
    }
}
