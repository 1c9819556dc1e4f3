package com.rulesdsl.condition.impl;

import com.rulesdsl.condition.Comparison;
import com.rulesdsl.dsl.ConditionOperator;

/**
 * Presence check (EXISTS / NOT_EXISTS). The expected value is ignored.
 */
public class ExistsComparison implements Comparison {

    private final boolean negated;

    private ExistsComparison(boolean negated) {
        this.negated = negated;
    }

    public static ExistsComparison exists() {
        return new ExistsComparison(false);
    }

    public static ExistsComparison notExists() {
        return new ExistsComparison(true);
    }

    @Override
    public boolean test(Object actual, Object expected) {
        return (actual != null) != negated;
    }

    @Override
    public ConditionOperator getOperator() {
        return negated ? ConditionOperator.NOT_EXISTS : ConditionOperator.EXISTS;
    }

    @Override
    public String toString() {
        return negated ? "NOT EXISTS" : "EXISTS";
    }
}
