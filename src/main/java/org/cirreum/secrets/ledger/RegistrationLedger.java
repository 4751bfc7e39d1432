package org.cirreum.secrets.ledger;

import lombok.extern.slf4j.Slf4j;
import org.cirreum.secrets.core.ProviderScope;
import org.cirreum.secrets.core.RegistrationError;
import org.cirreum.secrets.core.RegistrationFailure;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only record of claimed registration keys and endpoint fingerprints.
 *
 * <p>One ledger is created at application bootstrap and shared by every registrar. Both
 * claim operations are a single {@code putIfAbsent} so concurrent registrations cannot
 * both pass the check. Entries are never removed.</p>
 */
@Slf4j
public final class RegistrationLedger {
    private static final String NO_ENDPOINT = "";

    private final ConcurrentMap<String, String> registrations = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> endpoints = new ConcurrentHashMap<>();

    /**
     * Claims one registration key.
     *
     * <p>Succeeds exactly once per key for the ledger's lifetime, whatever endpoint is
     * supplied with later attempts. Only the endpoint's fingerprint is retained.</p>
     *
     * @param key registration key.
     * @param endpoint raw endpoint of the instance, may be {@code null}.
     * @return empty when claimed, otherwise an {@code ALREADY_REGISTERED} error.
     */
    public Optional<RegistrationError> claimRegistration(RegistrationKey key, String endpoint) {
        RegistrationKey nonNullKey = Objects.requireNonNull(key, "key");
        String claimedValue = EndpointFingerprint.compute(endpoint)
                .map(EndpointFingerprint::value)
                .orElse(NO_ENDPOINT);
        if (registrations.putIfAbsent(nonNullKey.value(), claimedValue) != null) {
            log.debug("Registration key {} already claimed", nonNullKey);
            return Optional.of(RegistrationError.of(
                    RegistrationFailure.ALREADY_REGISTERED,
                    nonNullKey.instanceKey(),
                    nonNullKey.scope(),
                    "a service with the key of '" + nonNullKey.instanceKey() + "' has already been registered"
            ));
        }
        log.debug("Claimed registration key {}", nonNullKey);
        return Optional.empty();
    }

    /**
     * Claims one endpoint fingerprint within a provider scope.
     *
     * <p>Fingerprints are compared only within the same provider type + name; two
     * different providers may point at the same physical endpoint.</p>
     *
     * @param scope provider scope.
     * @param fingerprint endpoint fingerprint.
     * @param instanceKey instance key claiming the endpoint.
     * @return empty when claimed, otherwise a {@code DUPLICATE_ENDPOINT} error.
     */
    public Optional<RegistrationError> claimEndpoint(
            ProviderScope scope,
            EndpointFingerprint fingerprint,
            String instanceKey
    ) {
        ProviderScope nonNullScope = Objects.requireNonNull(scope, "scope");
        EndpointFingerprint nonNullFingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        String nonNullInstanceKey = Objects.requireNonNull(instanceKey, "instanceKey");

        String owner = endpoints.putIfAbsent(endpointKey(nonNullScope, nonNullFingerprint), nonNullInstanceKey);
        if (owner != null) {
            log.debug(
                    "Endpoint {} in {} already claimed by instance '{}'",
                    nonNullFingerprint.shortForm(),
                    nonNullScope,
                    owner
            );
            return Optional.of(RegistrationError.of(
                    RegistrationFailure.DUPLICATE_ENDPOINT,
                    nonNullInstanceKey,
                    nonNullScope,
                    "an endpoint string for service instance '" + nonNullInstanceKey
                            + "' has already been configured. Cannot register the same endpoint with multiple instances."
            ));
        }
        log.debug("Claimed endpoint {} in {} for instance '{}'", nonNullFingerprint.shortForm(), nonNullScope, nonNullInstanceKey);
        return Optional.empty();
    }

    /**
     * Returns whether a registration key has been claimed.
     */
    public boolean isRegistered(RegistrationKey key) {
        return registrations.containsKey(Objects.requireNonNull(key, "key").value());
    }

    /**
     * Returns whether an endpoint fingerprint has been claimed within a scope.
     */
    public boolean isEndpointClaimed(ProviderScope scope, EndpointFingerprint fingerprint) {
        return endpointOwner(scope, fingerprint).isPresent();
    }

    /**
     * Returns the instance key that claimed an endpoint within a scope.
     */
    public Optional<String> endpointOwner(ProviderScope scope, EndpointFingerprint fingerprint) {
        return Optional.ofNullable(endpoints.get(endpointKey(
                Objects.requireNonNull(scope, "scope"),
                Objects.requireNonNull(fingerprint, "fingerprint")
        )));
    }

    /**
     * Returns number of claimed registration keys.
     */
    public int registrationCount() {
        return registrations.size();
    }

    /**
     * Returns number of claimed endpoint fingerprints across all scopes.
     */
    public int endpointCount() {
        return endpoints.size();
    }

    private static String endpointKey(ProviderScope scope, EndpointFingerprint fingerprint) {
        return scope.namespace() + ".Connections:" + fingerprint.value();
    }
}
