package com.rulesdsl.condition.impl;

import com.rulesdsl.condition.Comparison;
import com.rulesdsl.condition.Values;
import com.rulesdsl.dsl.ConditionOperator;

import java.util.Collection;
import java.util.Iterator;
import java.util.Optional;

/**
 * Inclusive range check: low <= actual <= high.
 * The actual value must be a number and the expected value a 2-element list;
 * bounds may be numbers or numeric strings.
 */
public class BetweenComparison implements Comparison {

    @Override
    public boolean test(Object actual, Object expected) {
        if (!(actual instanceof Number value)) {
            return false;
        }
        Optional<Collection<?>> bounds = Values.asCollection(expected);
        if (bounds.isEmpty() || bounds.get().size() != 2) {
            return false;
        }

        Iterator<?> it = bounds.get().iterator();
        Optional<Number> low = Values.toNumber(it.next());
        Optional<Number> high = Values.toNumber(it.next());
        if (low.isEmpty() || high.isEmpty()) {
            return false;
        }

        Optional<Integer> aboveLow = Values.compareNumbers(value, low.get());
        Optional<Integer> belowHigh = Values.compareNumbers(value, high.get());
        return aboveLow.isPresent() && belowHigh.isPresent()
                && aboveLow.get() >= 0 && belowHigh.get() <= 0;
    }

    @Override
    public ConditionOperator getOperator() {
        return ConditionOperator.BETWEEN;
    }

    @Override
    public String toString() {
        return "BETWEEN";
    }
}
