package com.rpagent.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Storage capacity advertised by a provider: bytes per source (a volume or profile id).
 * Immutable. Serialized as a JSON object of source to bytes; on input, values may be numbers
 * or size strings such as {@code "4GB"}.
 */
public final class Capacity {

    public static final Capacity EMPTY = new Capacity(Map.of());

    private static final Pattern SIZE = Pattern.compile("(\\d+)\\s*([KMGTP]?B)?", Pattern.CASE_INSENSITIVE);

    private final SortedMap<String, Long> sources;

    private Capacity(Map<String, Long> sources) {
        this.sources = Collections.unmodifiableSortedMap(new TreeMap<>(sources));
    }

    public static Capacity of(Map<String, Long> sources) {
        Objects.requireNonNull(sources, "sources");
        for (Map.Entry<String, Long> e : sources.entrySet()) {
            Objects.requireNonNull(e.getKey(), "source");
            if (e.getValue() == null || e.getValue() < 0) {
                throw new IllegalArgumentException("Invalid size for " + e.getKey() + ": " + e.getValue());
            }
        }
        return sources.isEmpty() ? EMPTY : new Capacity(sources);
    }

    public static Capacity of(String source, long bytes) {
        return of(Map.of(source, bytes));
    }

    /**
     * Reads a capacity map whose values are numbers of bytes or size strings.
     *
     * @throws IllegalArgumentException on a value that is neither
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Capacity fromJson(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, Long> parsed = new TreeMap<>();
        for (Map.Entry<String, Object> e : raw.entrySet()) {
            Object v = e.getValue();
            if (v instanceof Number) {
                parsed.put(e.getKey(), ((Number) v).longValue());
            } else if (v instanceof String) {
                parsed.put(e.getKey(), parseSize((String) v));
            } else {
                throw new IllegalArgumentException("Invalid size for " + e.getKey() + ": " + v);
            }
        }
        return of(parsed);
    }

    /**
     * Parses sizes like {@code 4GB}, {@code 512MB}, {@code 0B} or a bare byte count.
     * Units are binary (1KB = 1024B).
     */
    public static long parseSize(String text) {
        Matcher m = SIZE.matcher(Objects.requireNonNull(text, "text").trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid size: '" + text + "'");
        }
        long value = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "B" : m.group(2).toUpperCase(Locale.ROOT);
        int shift;
        switch (unit) {
            case "KB": shift = 10; break;
            case "MB": shift = 20; break;
            case "GB": shift = 30; break;
            case "TB": shift = 40; break;
            case "PB": shift = 50; break;
            default: shift = 0;
        }
        if (shift > 0 && value > (Long.MAX_VALUE >> shift)) {
            throw new IllegalArgumentException("Size too large: '" + text + "'");
        }
        return value << shift;
    }

    @JsonValue
    public Map<String, Long> getSources() {
        return sources;
    }

    public long get(String source) {
        return sources.getOrDefault(source, 0L);
    }

    /**
     * Sum of all sources.
     *
     * @throws ArithmeticException when the sum does not fit in a long
     */
    public long total() {
        long sum = 0;
        for (long v : sources.values()) {
            sum = Math.addExact(sum, v);
        }
        return sum;
    }

    /** True when no source has any bytes. */
    public boolean isEmpty() {
        for (long v : sources.values()) {
            if (v != 0) {
                return false;
            }
        }
        return true;
    }

    /** True when every source of {@code other} is present here with at least as many bytes. */
    public boolean contains(Capacity other) {
        for (Map.Entry<String, Long> e : other.sources.entrySet()) {
            if (get(e.getKey()) < e.getValue()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return sources.equals(((Capacity) o).sources);
    }

    @Override
    public int hashCode() {
        return sources.hashCode();
    }

    @Override
    public String toString() {
        return sources.toString();
    }
}
