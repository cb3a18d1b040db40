package io.infrautomater.core.generator;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Typed, defaulted reads over a request's scalar config map.
///
/// Absent keys, null values and blank strings all fall back to the caller's
/// default.
public final class ConfigValues {

    private final Map<String, Object> values;

    public ConfigValues(Map<String, Object> values) {
        this.values = Objects.requireNonNull(values, "values must not be null");
    }

    /// Reads a string, trimmed.
    ///
    /// @param key config key, not null
    /// @param defaultValue value used when absent or blank, not null
    /// @return configured or default value, never null
    public String getString(String key, String defaultValue) {
        Object raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? defaultValue : text;
    }

    /// Reads a string and lower-cases it.
    ///
    /// @param key config key, not null
    /// @param defaultValue value used when absent or blank, not null
    /// @return lower-cased configured or default value, never null
    public String getLowercase(String key, String defaultValue) {
        return getString(key, defaultValue).toLowerCase(Locale.ROOT);
    }

    /// Reads a boolean given either as a boolean or as `"true"`/`"false"`.
    ///
    /// @param key config key, not null
    /// @param defaultValue value used when absent or blank
    /// @return configured or default value
    /// @throws InvalidResourceConfigException if the value is neither form
    public boolean getBoolean(String key, boolean defaultValue)
            throws InvalidResourceConfigException {
        Object raw = values.get(key);
        if (raw instanceof Boolean b) {
            return b;
        }
        String text = getLowercase(key, "");
        if (text.isEmpty()) {
            return defaultValue;
        }
        if (text.equals("true")) {
            return true;
        }
        if (text.equals("false")) {
            return false;
        }
        throw new InvalidResourceConfigException(
                "'" + key + "' must be true or false, got: " + raw);
    }
}
