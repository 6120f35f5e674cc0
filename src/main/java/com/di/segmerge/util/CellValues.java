package com.di.segmerge.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Comparison, equality and conversion rules for table cell values.
 *
 * Cells are plain Java objects coming from loaders or from callers:
 * - Numbers of any boxed type, compared by value (5, 5L and 5.0 are the same value)
 * - Strings and other {@link Comparable}s of one class, compared naturally
 * - {@code null} or a NaN double, both treated as a missing value
 *
 * Missing values sort after every present value, as a columnar store would place them.
 */
public final class CellValues {

    private static final double MAX_EXACT_DOUBLE = 9_007_199_254_740_992d; // 2^53

    private CellValues() {
        // Utility class - prevent instantiation
    }

    /** Returns true for {@code null} and for NaN floating point values. */
    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    /** True when the value is a boxed integral number. */
    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger;
    }

    /**
     * Total order over cells. Missing values come last, numbers compare by value and
     * values of unrelated classes fall back to class name then string form.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object a, Object b) {
        boolean missingA = isMissing(a);
        boolean missingB = isMissing(b);
        if (missingA || missingB) {
            return Boolean.compare(missingA, missingB);
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return compareNumbers(na, nb);
        }
        if (a instanceof Comparable ca && a.getClass().equals(b.getClass())) {
            return ca.compareTo(b);
        }
        int byClass = a.getClass().getName().compareTo(b.getClass().getName());
        return byClass != 0 ? byClass : a.toString().compareTo(b.toString());
    }

    /** Value equality: two missing values are equal, numbers are equal when their values are. */
    public static boolean same(Object a, Object b) {
        boolean missingA = isMissing(a);
        boolean missingB = isMissing(b);
        if (missingA || missingB) {
            return missingA && missingB;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return compareNumbers(na, nb) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * Normalised form of a value for hashing, such that {@code same(a, b)} implies
     * {@code normalize(a).equals(normalize(b))}.
     */
    public static Object normalize(Object value) {
        if (isMissing(value)) {
            return null;
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : big;
        }
        if (isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < MAX_EXACT_DOUBLE) {
                return (long) d;
            }
            return d;
        }
        return value;
    }

    /** Normalised tuple of the given values, usable as a hash key for equi-joins and grouping. */
    public static List<Object> key(List<?> values) {
        List<Object> key = new ArrayList<>(values.size());
        for (Object v : values) {
            key.add(normalize(v));
        }
        return key;
    }

    /**
     * Converts a numeric cell to a double.
     *
     * @throws IllegalArgumentException if the value is missing or not a number
     */
    public static double toDouble(Object value, String columnName) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException(
                String.format("Column '%s' holds a non-numeric value: %s", columnName, value));
    }

    /** Smaller of two cells under {@link #compare(Object, Object)}. */
    public static Object min(Object a, Object b) {
        return compare(a, b) <= 0 ? a : b;
    }

    /** Larger of two cells under {@link #compare(Object, Object)}. */
    public static Object max(Object a, Object b) {
        return compare(a, b) >= 0 ? a : b;
    }

    private static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b) && !(a instanceof BigInteger) && !(b instanceof BigInteger)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        if (a instanceof BigDecimal || b instanceof BigDecimal
                || a instanceof BigInteger || b instanceof BigInteger) {
            return toBigDecimal(a).compareTo(toBigDecimal(b));
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        return BigDecimal.valueOf(n.doubleValue());
    }
}
