package com.rulesdsl.condition.impl;

import com.rulesdsl.condition.Comparison;
import com.rulesdsl.condition.Values;
import com.rulesdsl.dsl.ConditionOperator;

import java.util.Collection;
import java.util.Optional;

/**
 * Substring test when both values are strings, element test when the actual value
 * is a list (CONTAINS / NOT_CONTAINS). Any other combination is false for both forms.
 */
public class ContainsComparison implements Comparison {

    private final boolean negated;

    private ContainsComparison(boolean negated) {
        this.negated = negated;
    }

    public static ContainsComparison contains() {
        return new ContainsComparison(false);
    }

    public static ContainsComparison notContains() {
        return new ContainsComparison(true);
    }

    @Override
    public boolean test(Object actual, Object expected) {
        if (actual instanceof String str) {
            if (!(expected instanceof String search)) {
                return false;
            }
            return str.contains(search) != negated;
        }

        Optional<Collection<?>> elements = Values.asCollection(actual);
        if (elements.isPresent()) {
            return Values.containsStrict(elements.get(), expected) != negated;
        }
        return false;
    }

    @Override
    public ConditionOperator getOperator() {
        return negated ? ConditionOperator.NOT_CONTAINS : ConditionOperator.CONTAINS;
    }

    @Override
    public String toString() {
        return negated ? "NOT CONTAINS" : "CONTAINS";
    }
}
