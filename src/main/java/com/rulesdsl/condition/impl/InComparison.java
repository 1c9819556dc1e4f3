package com.rulesdsl.condition.impl;

import com.rulesdsl.condition.Comparison;
import com.rulesdsl.condition.Values;
import com.rulesdsl.dsl.ConditionOperator;

import java.util.Collection;
import java.util.Optional;

/**
 * Membership of the actual value in an expected list (IN / NOT_IN).
 * Both forms are false when the expected value is not a list.
 */
public class InComparison implements Comparison {

    private final boolean negated;

    private InComparison(boolean negated) {
        this.negated = negated;
    }

    public static InComparison in() {
        return new InComparison(false);
    }

    public static InComparison notIn() {
        return new InComparison(true);
    }

    @Override
    public boolean test(Object actual, Object expected) {
        Optional<Collection<?>> allowed = Values.asCollection(expected);
        if (allowed.isEmpty()) {
            return false;
        }
        return Values.containsStrict(allowed.get(), actual) != negated;
    }

    @Override
    public ConditionOperator getOperator() {
        return negated ? ConditionOperator.NOT_IN : ConditionOperator.IN;
    }

    @Override
    public String toString() {
        return negated ? "NOT IN" : "IN";
    }
}
