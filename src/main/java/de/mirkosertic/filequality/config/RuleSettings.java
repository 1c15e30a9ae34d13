package de.mirkosertic.filequality.config;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Settings of one rule as read from the {@code quality.rules.<name>} configuration section.
 * <p>
 * The common keys {@code enabled}, {@code weight}, {@code include-patterns} and
 * {@code exclude-patterns} are lifted into fields; every other key is a rule option.
 */
public record RuleSettings(
        String name,
        boolean enabled,
        double weight,
        List<String> includePatterns,
        List<String> excludePatterns,
        Map<String, Object> options
) {

    private static final String KEY_ENABLED = "enabled";
    private static final String KEY_WEIGHT = "weight";
    private static final String KEY_INCLUDE = "include-patterns";
    private static final String KEY_EXCLUDE = "exclude-patterns";

    public RuleSettings {
        includePatterns = List.copyOf(includePatterns);
        excludePatterns = List.copyOf(excludePatterns);
        // Sorted so that the configuration string used for the rule-set version is stable
        options = Collections.unmodifiableMap(new TreeMap<>(options));
    }

    public static RuleSettings defaults(final String name) {
        return new RuleSettings(name, true, 1.0, List.of(), List.of(), Map.of());
    }

    public static RuleSettings of(final String name, final Map<String, Object> options) {
        return fromMap(name, options);
    }

    /**
     * Build settings from a raw YAML map.
     */
    @SuppressWarnings("unchecked")
    public static RuleSettings fromMap(final String name, final @Nullable Map<String, Object> raw) {
        if (raw == null) {
            return defaults(name);
        }
        final Map<String, Object> options = new LinkedHashMap<>(raw);
        final Object enabled = options.remove(KEY_ENABLED);
        final Object weight = options.remove(KEY_WEIGHT);
        final Object include = options.remove(KEY_INCLUDE);
        final Object exclude = options.remove(KEY_EXCLUDE);

        return new RuleSettings(
                name,
                enabled == null || Boolean.parseBoolean(enabled.toString()),
                weight instanceof Number number ? number.doubleValue() : 1.0,
                include instanceof List ? toStringList((List<Object>) include) : List.of(),
                exclude instanceof List ? toStringList((List<Object>) exclude) : List.of(),
                options
        );
    }

    public long getLong(final String key, final long defaultValue) {
        final Object value = options.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        return value != null ? Long.parseLong(value.toString().trim()) : defaultValue;
    }

    public int getInt(final String key, final int defaultValue) {
        return (int) getLong(key, defaultValue);
    }

    public boolean getBoolean(final String key, final boolean defaultValue) {
        final Object value = options.get(key);
        return value != null ? Boolean.parseBoolean(value.toString()) : defaultValue;
    }

    public String getString(final String key, final String defaultValue) {
        final Object value = options.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    public List<String> getStringList(final String key, final List<String> defaultValue) {
        final Object value = options.get(key);
        if (value instanceof List) {
            return toStringList((List<Object>) value);
        }
        if (value != null) {
            final List<String> result = new ArrayList<>();
            for (final String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
            return result;
        }
        return defaultValue;
    }

    /**
     * Everything that influences the rule's behaviour, in a stable textual form.
     */
    public String fingerprintSource() {
        return name + "|weight=" + weight + "|include=" + includePatterns + "|exclude=" + excludePatterns
                + "|options=" + options;
    }

    private static List<String> toStringList(final List<Object> values) {
        return values.stream().map(String::valueOf).toList();
    }
}
