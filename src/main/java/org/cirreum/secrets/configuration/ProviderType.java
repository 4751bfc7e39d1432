package org.cirreum.secrets.configuration;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Provider-type tag participating in registration-key and endpoint namespacing.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum ProviderType {
    SECRETS("Secrets");

    /** Name rendered into ledger keys. */
    private final String displayName;

    @Override
    public String toString() {
        return displayName;
    }
}
