package org.cirreum.secrets.ledger;

import org.cirreum.secrets.core.ProviderScope;

import java.util.Objects;

/**
 * Uniqueness token for one instance: {@code <Type>.<Name>::<InstanceKey>}.
 *
 * @param scope provider scope.
 * @param instanceKey instance key within the provider's settings.
 */
public record RegistrationKey(ProviderScope scope, String instanceKey) {

    public RegistrationKey {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(instanceKey, "instanceKey");
    }

    /**
     * Derives the key for one instance of a provider.
     */
    public static RegistrationKey of(ProviderScope scope, String instanceKey) {
        return new RegistrationKey(scope, instanceKey);
    }

    /**
     * Returns the rendered key.
     */
    public String value() {
        return scope.namespace() + "::" + instanceKey;
    }

    @Override
    public String toString() {
        return value();
    }
}
