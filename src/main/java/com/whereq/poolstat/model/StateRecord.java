package com.whereq.poolstat.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Observed state of a single job or slot, as a flat attribute mapping.
 *
 * Attribute names are case-insensitive. Accessors never throw for a missing or
 * malformed attribute; they return an empty Optional and leave the decision to the caller.
 */
public final class StateRecord {

    private final Map<String, Object> attributes;

    private StateRecord(Map<String, Object> attributes) {
        this.attributes = attributes;
    }

    public static StateRecord of(Map<String, ?> attributes) {
        Map<String, Object> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        attributes.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return new StateRecord(Collections.unmodifiableMap(copy));
    }

    public static StateRecord empty() {
        return of(Map.of());
    }

    public boolean has(String key) {
        return attributes.containsKey(key);
    }

    /**
     * Raw attribute value, expressions left unevaluated
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /**
     * Attribute value with expressions replaced by their evaluated value.
     * Empty if the attribute is absent or the expression is undefined.
     */
    public Optional<Object> evaluate(String key) {
        Object raw = attributes.get(key);
        if (raw instanceof Expression expression) {
            return Optional.ofNullable(expression.getValue());
        }
        return Optional.ofNullable(raw);
    }

    /**
     * Numeric value of an attribute. Booleans, non-numeric strings and non-finite values are not numbers.
     */
    public Optional<Double> number(String key) {
        return evaluate(key).flatMap(StateRecord::toDouble);
    }

    public double number(String key, double defaultValue) {
        return number(key).orElse(defaultValue);
    }

    public Optional<Long> integer(String key) {
        return number(key).map(Double::longValue);
    }

    public Optional<String> string(String key) {
        return evaluate(key)
            .filter(String.class::isInstance)
            .map(String.class::cast);
    }

    public String string(String key, String defaultValue) {
        return string(key).orElse(defaultValue);
    }

    public Optional<Boolean> bool(String key) {
        return evaluate(key).flatMap(value -> {
            if (value instanceof Boolean b) {
                return Optional.of(b);
            }
            if (value instanceof Number n) {
                return Optional.of(n.doubleValue() != 0);
            }
            return Optional.empty();
        });
    }

    public Map<String, Object> asMap() {
        return attributes;
    }

    private static Optional<Double> toDouble(Object value) {
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        // NaN and infinities would poison every sum they reach
        return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateRecord other)) {
            return false;
        }
        return attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "StateRecord" + attributes;
    }
}
