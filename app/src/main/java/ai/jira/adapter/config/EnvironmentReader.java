package ai.jira.adapter.config;

import java.util.Optional;

/**
 * Source of environment-style key/value settings.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Value of {@code key} trimmed, treating blank values as absent.
     */
    default Optional<String> nonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
