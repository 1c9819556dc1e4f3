package com.rulesdsl.variable;

import java.util.Optional;

/**
 * Named top-level sections of an evaluation context.
 */
public enum ContextSection {
    /** Risk/submission data */
    RISK("risk"),
    /** Policy data */
    POLICY("policy"),
    /** Coverage data */
    COVERAGE("coverage"),
    /** Pricing data */
    PRICING("pricing"),
    /** Location data */
    LOCATION("location"),
    /** Insured data */
    INSURED("insured"),
    /** Anything else a caller wants rules to see */
    CUSTOM("custom");

    private final String key;

    ContextSection(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Find the section for a top-level key.
     *
     * @param key Section key (e.g. "risk")
     * @return The section, or empty if the key is not a known section
     */
    public static Optional<ContextSection> fromKey(String key) {
        for (ContextSection section : values()) {
            if (section.key.equals(key)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }

    /**
     * Find the section a dotted path starts in (e.g. "risk.classCode" -> RISK).
     */
    public static Optional<ContextSection> fromPath(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        int dot = path.indexOf('.');
        return fromKey(dot < 0 ? path : path.substring(0, dot));
    }
}
