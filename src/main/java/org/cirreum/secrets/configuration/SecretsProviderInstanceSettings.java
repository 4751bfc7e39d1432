package org.cirreum.secrets.configuration;

import lombok.Getter;
import lombok.Setter;

/**
 * Base settings for one configured connection of a secrets provider.
 *
 * <p>Providers extend this class with their own fields. Instances are populated by the
 * host's configuration binding, rewritten at most once by {@link #parseEndpoint()}, and
 * treated as immutable for the rest of registration.</p>
 */
@Getter
@Setter
public class SecretsProviderInstanceSettings {

    /**
     * Optional provider-defined identifier (client id, account id, ...).
     */
    private String identifier;

    /**
     * Raw uri/url/arn/connection string the provider connects to.
     */
    private String endpoint = "";

    /**
     * Gives the provider a chance to normalize {@link #getEndpoint()} in place.
     *
     * <p>Invoked exactly once, after the endpoint is known to be non-blank and before
     * it is fingerprinted. The default is a no-op; overrides signal a malformed
     * endpoint by throwing a runtime exception.</p>
     */
    public void parseEndpoint() {
    }
}
