package com.eventaudit.infrastructure.cache;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Structured cache key: a query class plus a parameter tuple.
 *
 * Parameters are kept sorted by name and every component is length-prefixed
 * in the encoded form, so two keys encode equally only when class and
 * parameters are equal. Separators inside values cannot alias across
 * components.
 *
 * Every value carries a type tag, so {@code 5} and {@code "5"} are different
 * keys. Integral boxes share one tag, so {@code 5} and {@code 5L} are not.
 *
 * Encoding grammar:
 * - string: {@code s<length>:<chars>}
 * - integral ({@code Byte}, {@code Short}, {@code Integer}, {@code Long}): {@code i<length>:<digits>}
 * - floating point ({@code Float}, {@code Double}): {@code d<length>:<digits>}
 * - boolean: {@code b1} or {@code b0}
 * - enum: {@code e} then the class name and the constant name, each as a string
 * - null: {@code n}
 * - collection: {@code l<size>:} followed by each element
 * - anything else: {@code x} then the class name and {@code toString()}, each as a string
 */
@Getter
@EqualsAndHashCode(of = "encoded")
public final class CacheKey {

    private final String queryClass;
    private final SortedMap<String, Object> parameters;
    private final String encoded;

    private CacheKey(String queryClass, SortedMap<String, Object> parameters) {
        this.queryClass = queryClass;
        this.parameters = Collections.unmodifiableSortedMap(parameters);
        this.encoded = encode(queryClass, parameters);
    }

    public static CacheKey of(String queryClass) {
        return of(queryClass, Map.of());
    }

    public static CacheKey of(String queryClass, Map<String, ?> parameters) {
        if (queryClass == null || queryClass.isBlank()) {
            throw new IllegalArgumentException("Cache key requires a non-empty query class");
        }
        Objects.requireNonNull(parameters, "parameters");
        return new CacheKey(queryClass, new TreeMap<>(parameters));
    }

    /**
     * Stable, filesystem-safe identifier for the persisted tier.
     */
    public String digest() {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(encoded.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String encode(String queryClass, SortedMap<String, Object> parameters) {
        StringBuilder out = new StringBuilder();
        appendString(out, queryClass);
        out.append('l').append(parameters.size()).append(':');
        for (Map.Entry<String, Object> param : parameters.entrySet()) {
            appendString(out, param.getKey());
            appendValue(out, param.getValue());
        }
        return out.toString();
    }

    private static void appendValue(StringBuilder out, Object value) {
        if (value == null) {
            out.append('n');
        } else if (value instanceof Collection<?> values) {
            out.append('l').append(values.size()).append(':');
            for (Object element : values) {
                appendValue(out, element);
            }
        } else if (value instanceof String text) {
            appendString(out, text);
        } else if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            appendTagged(out, 'i', Long.toString(((Number) value).longValue()));
        } else if (value instanceof Double || value instanceof Float) {
            appendTagged(out, 'd', Double.toString(((Number) value).doubleValue()));
        } else if (value instanceof Boolean flag) {
            out.append('b').append(flag ? '1' : '0');
        } else if (value instanceof Enum<?> constant) {
            out.append('e');
            appendString(out, constant.getDeclaringClass().getName());
            appendString(out, constant.name());
        } else {
            out.append('x');
            appendString(out, value.getClass().getName());
            appendString(out, value.toString());
        }
    }

    private static void appendString(StringBuilder out, String value) {
        appendTagged(out, 's', value);
    }

    private static void appendTagged(StringBuilder out, char tag, String value) {
        out.append(tag).append(value.length()).append(':').append(value);
    }

    @Override
    public String toString() {
        return queryClass + parameters;
    }
}
