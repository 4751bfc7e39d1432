package org.cirreum.secrets.validation;

import lombok.extern.slf4j.Slf4j;
import org.cirreum.secrets.configuration.SecretsProviderInstanceSettings;
import org.cirreum.secrets.core.ProviderScope;
import org.cirreum.secrets.core.RegistrationError;
import org.cirreum.secrets.core.RegistrationFailure;
import org.cirreum.secrets.ledger.EndpointFingerprint;
import org.cirreum.secrets.ledger.RegistrationLedger;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Structural + provider-specific validation of one instance.
 *
 * <p>Checks run in a fixed order and the first failure short-circuits the rest:</p>
 * <ol>
 * <li>settings present,</li>
 * <li>endpoint non-blank,</li>
 * <li>{@link SecretsProviderInstanceSettings#parseEndpoint()},</li>
 * <li>endpoint fingerprint resolvable,</li>
 * <li>endpoint not yet claimed within the provider scope,</li>
 * <li>provider-specific validation.</li>
 * </ol>
 * <p>Provider-specific checks therefore only ever see a structurally sound,
 * already-deduplicated instance.</p>
 */
@Slf4j
public final class InstanceValidator {
    private final RegistrationLedger ledger;

    /**
     * Creates a validator claiming endpoints in the given ledger.
     *
     * @param ledger shared registration ledger.
     */
    public InstanceValidator(RegistrationLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    /**
     * Validates one instance.
     *
     * @param instanceKey instance key.
     * @param settings instance settings, may be {@code null}.
     * @param scope provider scope.
     * @param providerSpecificValidate provider hook; signals failure by throwing.
     * @param <I> instance settings type.
     * @return empty when valid, otherwise the first failure.
     */
    public <I extends SecretsProviderInstanceSettings> Optional<RegistrationError> validateInstance(
            String instanceKey,
            I settings,
            ProviderScope scope,
            Consumer<? super I> providerSpecificValidate
    ) {
        String nonNullInstanceKey = Objects.requireNonNull(instanceKey, "instanceKey");
        ProviderScope nonNullScope = Objects.requireNonNull(scope, "scope");

        if (settings == null) {
            return fail(
                    RegistrationFailure.MISSING_SETTINGS,
                    nonNullInstanceKey,
                    nonNullScope,
                    "missing required settings for the service '" + nonNullInstanceKey + "'",
                    null
            );
        }

        if (settings.getEndpoint() == null || settings.getEndpoint().isBlank()) {
            return fail(
                    RegistrationFailure.MISSING_ENDPOINT,
                    nonNullInstanceKey,
                    nonNullScope,
                    "the 'Endpoint' is missing for service instance '" + nonNullInstanceKey + "'",
                    null
            );
        }

        try {
            settings.parseEndpoint();
        } catch (RuntimeException ex) {
            return fail(
                    RegistrationFailure.ENDPOINT_PARSE_FAILED,
                    nonNullInstanceKey,
                    nonNullScope,
                    "the 'Endpoint' for service instance '" + nonNullInstanceKey + "' could not be parsed: "
                            + describe(ex),
                    ex
            );
        }

        Optional<EndpointFingerprint> fingerprint = EndpointFingerprint.compute(settings.getEndpoint());
        if (fingerprint.isEmpty()) {
            return fail(
                    RegistrationFailure.UNRESOLVABLE_ENDPOINT,
                    nonNullInstanceKey,
                    nonNullScope,
                    "service instance '" + nonNullInstanceKey + "' could not be configured. Unable to resolve an 'Endpoint'",
                    null
            );
        }

        Optional<RegistrationError> duplicate = ledger.claimEndpoint(nonNullScope, fingerprint.get(), nonNullInstanceKey);
        if (duplicate.isPresent()) {
            log.debug("[{}] {}", duplicate.get().reasonCode(), duplicate.get().getMessage());
            return duplicate;
        }

        if (providerSpecificValidate != null) {
            try {
                providerSpecificValidate.accept(settings);
            } catch (RuntimeException ex) {
                return fail(
                        RegistrationFailure.PROVIDER_VALIDATION_FAILED,
                        nonNullInstanceKey,
                        nonNullScope,
                        describe(ex),
                        ex
                );
            }
        }

        log.debug("Validated service instance '{}' of {}", nonNullInstanceKey, nonNullScope);
        return Optional.empty();
    }

    private static Optional<RegistrationError> fail(
            RegistrationFailure failure,
            String instanceKey,
            ProviderScope scope,
            String message,
            Throwable cause
    ) {
        log.debug("[{}] {} ({})", failure.reasonCode(), message, scope);
        return Optional.of(RegistrationError.builder()
                .failure(failure)
                .instanceKey(instanceKey)
                .scope(scope)
                .message(message)
                .cause(cause)
                .build());
    }

    private static String describe(RuntimeException ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
