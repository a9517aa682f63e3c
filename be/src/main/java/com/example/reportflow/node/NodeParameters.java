package com.example.reportflow.node;

import com.example.reportflow.model.Amounts;
import com.example.reportflow.model.DateValues;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable key/value configuration handed to a node, with typed accessors.
 * <p>
 * Accessors throw {@link IllegalArgumentException} when a value is present but has the wrong
 * shape; a node's failure to read its configuration is a node failure.
 * </p>
 */
public final class NodeParameters {

    private static final NodeParameters EMPTY = new NodeParameters(Map.of());

    private final Map<String, Object> values;

    private NodeParameters(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static NodeParameters empty() {
        return EMPTY;
    }

    public static NodeParameters of(Map<String, ?> values) {
        return values == null || values.isEmpty() ? EMPTY : new NodeParameters(values);
    }

    /**
     * Returns these parameters with the overrides applied: override values replace same-named
     * keys, other keys are added.
     */
    public NodeParameters mergedWith(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overrides);
        return new NodeParameters(merged);
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Optional<String> getString(String key) {
        Object value = values.get(key);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.toString().trim());
    }

    public String getString(String key, String defaultValue) {
        return getString(key).orElse(defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        BigDecimal decimal = Amounts.toDecimal(value);
        if (decimal == null) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a number but was: " + value);
        }
        try {
            return decimal.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a whole number but was: " + value, e);
        }
    }

    public BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        BigDecimal decimal = Amounts.toDecimal(value);
        if (decimal == null) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a number but was: " + value);
        }
        return decimal;
    }

    public Optional<LocalDate> getDate(String key) {
        Object value = values.get(key);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(DateValues.parse(value)
                .orElseThrow(() -> new IllegalArgumentException("Parameter '" + key + "' must be an ISO date but was: " + value)));
    }

    /**
     * A list of objects (e.g. filter conditions); empty when absent.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getObjectList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof Collection<?> items)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a list but was: " + value);
        }
        List<Map<String, Object>> result = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Parameter '" + key + "' must contain objects but had: " + item);
            }
            result.add((Map<String, Object>) map);
        }
        return result;
    }

    public List<String> getStringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof Collection<?> items)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a list but was: " + value);
        }
        return items.stream().map(String::valueOf).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof NodeParameters other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
