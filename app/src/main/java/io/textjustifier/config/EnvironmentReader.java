package io.textjustifier.config;

import java.util.Optional;

/**
 * Looks up environment values by key.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Value for the key with surrounding whitespace removed, empty when unset or blank.
     */
    default Optional<String> getNonBlank(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
