package org.cirreum.secrets.core;

import org.cirreum.secrets.configuration.ProviderType;

import java.util.Objects;

/**
 * Provider type + provider name pair that namespaces every ledger entry.
 *
 * @param type provider-type tag.
 * @param name provider name, for example {@code Vault}.
 */
public record ProviderScope(ProviderType type, String name) {

    public ProviderScope {
        Objects.requireNonNull(type, "type");
        String normalized = Objects.requireNonNull(name, "name").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("provider name must be non-blank");
        }
        name = normalized;
    }

    /**
     * Returns the namespace rendered as {@code <Type>.<Name>}.
     */
    public String namespace() {
        return type.displayName() + "." + name;
    }

    @Override
    public String toString() {
        return namespace();
    }
}
