package com.di.moduleflow.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session-level overrides handed to the dataset engine (partition sizing, etc). Mutable and
 * shared by every module of a run; {@link #restore(Map)} puts it back to a prior snapshot.
 */
@Slf4j
public class SessionConf {

    private final Map<String, String> values = new LinkedHashMap<>();

    public SessionConf(Map<String, String> initial) {
        values.putAll(initial);
    }

    public String get(String key) {
        return values.get(key);
    }

    public int getInt(String key, int defaultValue) {
        String v = values.get(key);
        if (v == null || v.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Session conf " + key + " is not an integer: " + v, e);
        }
    }

    public void set(String key, String value) {
        String previous = values.put(key, value);
        log.debug("[SESSION] {}: {} -> {}", key, previous, value);
    }

    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Replaces every value with {@code target}; keys absent from it are removed. */
    public void restore(Map<String, String> target) {
        if (values.equals(target)) return;
        values.clear();
        values.putAll(target);
        log.debug("[SESSION] restored {} keys", target.size());
    }
}
