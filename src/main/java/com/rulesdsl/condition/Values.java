package com.rulesdsl.condition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;

/**
 * Type helpers shared by the comparisons.
 * Numbers compare by value regardless of boxed type; nothing is coerced across types.
 */
public final class Values {

    private Values() {
    }

    /**
     * Strict equality: same type family and same value. A number never equals a string.
     */
    public static boolean strictEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return compareNumbers(x, y).map(c -> c == 0).orElse(false);
        }
        if (a instanceof Number || b instanceof Number) {
            return false;
        }
        return a.equals(b);
    }

    /**
     * Compare two numbers by value.
     *
     * @return comparison result, or empty if either is NaN
     */
    public static Optional<Integer> compareNumbers(Number a, Number b) {
        if (isNaN(a) || isNaN(b)) {
            return Optional.empty();
        }
        if (isExact(a) && isExact(b)) {
            return Optional.of(toBigDecimal(a).compareTo(toBigDecimal(b)));
        }
        double x = a.doubleValue() + 0.0;
        double y = b.doubleValue() + 0.0;
        return Optional.of(Double.compare(x, y));
    }

    /**
     * Coerce a bound to a number: numbers as-is, numeric strings parsed.
     */
    public static Optional<Number> toNumber(Object value) {
        if (value instanceof Number n) {
            return isNaN(n) ? Optional.empty() : Optional.of(n);
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(new BigDecimal(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * View a list-like value (Collection or object array) as a collection.
     */
    public static Optional<Collection<?>> asCollection(Object value) {
        if (value instanceof Collection<?> collection) {
            return Optional.of(collection);
        }
        if (value instanceof Object[] array) {
            return Optional.of(Arrays.asList(array));
        }
        return Optional.empty();
    }

    /**
     * Check whether a collection holds an element strictly equal to the value.
     */
    public static boolean containsStrict(Collection<?> collection, Object value) {
        for (Object element : collection) {
            if (strictEquals(element, value)) {
                return true;
            }
        }
        return false;
    }

    public static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        return BigDecimal.valueOf(n.doubleValue());
    }

    private static boolean isExact(Number n) {
        if (n instanceof Double d) {
            return !d.isInfinite();
        }
        if (n instanceof Float f) {
            return !f.isInfinite();
        }
        return true;
    }

    private static boolean isNaN(Number n) {
        return (n instanceof Double d && d.isNaN()) || (n instanceof Float f && f.isNaN());
    }
}
