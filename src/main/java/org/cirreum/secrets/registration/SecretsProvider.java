package org.cirreum.secrets.registration;

import org.cirreum.secrets.configuration.ProviderType;
import org.cirreum.secrets.configuration.SecretsProviderInstanceSettings;

import java.util.Set;

/**
 * Capability contract a concrete secrets provider fulfills to be registered.
 *
 * @param <I> instance settings type.
 */
public interface SecretsProvider<I extends SecretsProviderInstanceSettings> {

    /**
     * Returns provider-type tag.
     */
    ProviderType providerType();

    /**
     * Returns provider name, for example {@code Vault}.
     */
    String providerName();

    /**
     * Returns activity-source names subscribed when tracing is enabled. May be empty.
     */
    Set<String> activitySourceNames();

    /**
     * Provider-specific validation. Runs after the structural checks; signals failure by
     * throwing a runtime exception whose message is reported unchanged.
     *
     * @param settings validated, deduplicated instance settings.
     */
    default void validateSettings(I settings) {
    }

    /**
     * Activation hook: wires one validated instance into the host.
     *
     * @param settings validated instance settings.
     * @param configuration configuration target to add the instance's source to.
     * @param services service registration target.
     */
    void addInstance(I settings, ConfigurationTarget configuration, ServiceTarget services);
}
