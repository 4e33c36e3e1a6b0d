package io.stockingest.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Resolves settings from JVM system properties first, then environment variables, then a default.
 */
public final class ConfigLookup {
    private final Map<String, String> env;

    public ConfigLookup() {
        this(System.getenv());
    }

    public ConfigLookup(Map<String, String> env) {
        this.env = env;
    }

    public String get(String property, String envName, String defaultValue) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) value = env.get(envName);
        return (value == null || value.isBlank()) ? defaultValue : value.trim();
    }

    public int getInt(String property, String envName, int defaultValue) {
        String v = get(property, envName, null);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + envName + ": " + v, e);
        }
    }

    public double getDouble(String property, String envName, double defaultValue) {
        String v = get(property, envName, null);
        if (v == null) return defaultValue;
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for " + envName + ": " + v, e);
        }
    }

    public List<String> getList(String property, String envName, String defaultValue) {
        String v = get(property, envName, defaultValue);
        if (v == null) return List.of();
        List<String> out = new ArrayList<>();
        Arrays.stream(v.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(out::add);
        return out;
    }
}
