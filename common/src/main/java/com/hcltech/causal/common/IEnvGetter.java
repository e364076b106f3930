package com.hcltech.causal.common;

/**
 * Abstraction for reading environment variables or configuration values.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} in code,
 * so that unit tests can provide their own environment source.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given environment variable, or {@code null} if unset.
     */
    String get(String name);

    static boolean isUnset(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Integer value, or {@code defaultValue} when unset or blank. Malformed values throw.
     */
    static int getIntOr(IEnvGetter env, String name, int defaultValue) {
        String value = env.get(name);
        if (isUnset(value)) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
        }
    }

    /**
     * Boolean value, or {@code defaultValue} when unset or blank.
     * Only {@code true} and {@code false} (case-insensitive) are accepted.
     */
    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        if (isUnset(value)) return defaultValue;
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) return true;
        if (trimmed.equalsIgnoreCase("false")) return false;
        throw new IllegalStateException("Invalid boolean for environment variable: " + name + " = '" + value + "'");
    }
}
