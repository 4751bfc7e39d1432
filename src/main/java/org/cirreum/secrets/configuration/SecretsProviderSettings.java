package org.cirreum.secrets.configuration;

import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Provider-level settings: a tracing switch plus the named instances to register.
 *
 * <p>A provider with zero instances is legal and registers nothing.</p>
 *
 * @param <I> instance settings type.
 */
@Getter
@Setter
public class SecretsProviderSettings<I extends SecretsProviderInstanceSettings> {

    /**
     * Whether the provider's activity sources are subscribed for tracing. Defaults to {@code true}.
     */
    private boolean tracing = true;

    /**
     * Instance settings keyed by instance key, iterated in insertion order.
     */
    private Map<String, I> instances = new LinkedHashMap<>();

    /**
     * Adds one instance entry, replacing any previous entry with the same key.
     *
     * @param key instance key.
     * @param settings instance settings (may be {@code null} to model an unbound entry).
     * @return this settings object.
     */
    public SecretsProviderSettings<I> instance(String key, I settings) {
        if (instances == null) {
            instances = new LinkedHashMap<>();
        }
        instances.put(Objects.requireNonNull(key, "key"), settings);
        return this;
    }

    /**
     * Returns whether there is nothing to register.
     */
    public boolean isEmpty() {
        return instances == null || instances.isEmpty();
    }
}
