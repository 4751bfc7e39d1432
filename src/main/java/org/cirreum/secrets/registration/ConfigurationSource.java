package org.cirreum.secrets.registration;

import java.util.Optional;

/**
 * Configuration source contributed by one activated provider instance.
 */
public interface ConfigurationSource {

    /**
     * Returns source name used in host diagnostics.
     */
    String name();

    /**
     * Looks up one configuration value.
     *
     * @param key configuration key.
     * @return value, or empty when this source does not define the key.
     */
    Optional<String> get(String key);
}
