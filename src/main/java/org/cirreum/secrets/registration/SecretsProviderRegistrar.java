package org.cirreum.secrets.registration;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.cirreum.secrets.configuration.SecretsProviderInstanceSettings;
import org.cirreum.secrets.configuration.SecretsProviderSettings;
import org.cirreum.secrets.core.ProviderScope;
import org.cirreum.secrets.core.RegistrationError;
import org.cirreum.secrets.core.RegistrationFailure;
import org.cirreum.secrets.ledger.RegistrationKey;
import org.cirreum.secrets.ledger.RegistrationLedger;
import org.cirreum.secrets.validation.InstanceValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Startup-only registrar admitting the instances of one secrets provider.
 *
 * <p>Per instance, in declared order:</p>
 * <ul>
 * <li>claim the registration key in the shared {@link RegistrationLedger},</li>
 * <li>run {@link InstanceValidator} (which also claims the endpoint),</li>
 * <li>invoke the provider's activation hook.</li>
 * </ul>
 * <p>The first failure aborts the call. Instances activated before it stay activated and
 * their ledger claims stay in place. After every instance succeeds, the provider's
 * activity sources are subscribed once when tracing is enabled.</p>
 *
 * @param <I> instance settings type.
 */
@Slf4j
public final class SecretsProviderRegistrar<I extends SecretsProviderInstanceSettings> {
    private final SecretsProvider<I> provider;
    private final RegistrationLedger ledger;
    private final InstanceValidator validator;
    private final TracingSubscriber tracing;
    @Getter
    @Accessors(fluent = true)
    private final ProviderScope scope;

    /**
     * Creates a registrar for one provider.
     *
     * @param provider provider capability.
     * @param ledger shared registration ledger.
     * @param tracing telemetry collaborator.
     */
    public SecretsProviderRegistrar(
            SecretsProvider<I> provider,
            RegistrationLedger ledger,
            TracingSubscriber tracing
    ) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.tracing = Objects.requireNonNull(tracing, "tracing");
        this.validator = new InstanceValidator(ledger);
        this.scope = new ProviderScope(provider.providerType(), provider.providerName());
    }

    /**
     * Registers every configured instance of the provider.
     *
     * @param providerSettings bound provider settings, may be {@code null}.
     * @param services service registration target.
     * @param configuration configuration target.
     * @return success report, or the first failure.
     */
    public RegistrationResult register(
            SecretsProviderSettings<I> providerSettings,
            ServiceTarget services,
            ConfigurationTarget configuration
    ) {
        if (providerSettings == null || providerSettings.isEmpty()) {
            log.debug("No instances configured for {}; nothing to register", scope);
            return RegistrationResult.success(RegistrationReport.empty(scope));
        }

        List<String> activated = new ArrayList<>();
        for (Map.Entry<String, I> entry : providerSettings.getInstances().entrySet()) {
            Optional<RegistrationError> error = admit(entry.getKey(), entry.getValue(), services, configuration);
            if (error.isPresent()) {
                return reportFailure(error.get(), activated);
            }
            activated.add(entry.getKey());
        }

        boolean tracingSubscribed = subscribeTracing(providerSettings.isTracing());
        log.info(
                "Registered {} instance(s) of {} (tracing {})",
                activated.size(),
                scope,
                tracingSubscribed ? "enabled" : "disabled"
        );
        return RegistrationResult.success(RegistrationReport.builder()
                .scope(scope)
                .activatedInstances(activated)
                .tracingSubscribed(tracingSubscribed)
                .build());
    }

    /**
     * Registers a single instance outside a full provider registration.
     *
     * <p>Uses the same claim, validate, activate sequence as {@link #register}; tracing
     * is not touched.</p>
     *
     * @param instanceKey instance key.
     * @param settings instance settings, may be {@code null}.
     * @param services service registration target.
     * @param configuration configuration target.
     * @return success report, or the failure.
     */
    public RegistrationResult registerInstance(
            String instanceKey,
            I settings,
            ServiceTarget services,
            ConfigurationTarget configuration
    ) {
        Optional<RegistrationError> error = admit(instanceKey, settings, services, configuration);
        if (error.isPresent()) {
            return reportFailure(error.get(), List.of());
        }
        return RegistrationResult.success(RegistrationReport.builder()
                .scope(scope)
                .activatedInstance(instanceKey)
                .build());
    }

    private Optional<RegistrationError> admit(
            String instanceKey,
            I settings,
            ServiceTarget services,
            ConfigurationTarget configuration
    ) {
        RegistrationKey key = RegistrationKey.of(scope, Objects.requireNonNull(instanceKey, "instanceKey"));
        Optional<RegistrationError> claimError = ledger.claimRegistration(
                key,
                settings == null ? null : settings.getEndpoint()
        );
        if (claimError.isPresent()) {
            return claimError;
        }

        Optional<RegistrationError> validationError =
                validator.validateInstance(instanceKey, settings, scope, provider::validateSettings);
        if (validationError.isPresent()) {
            return validationError;
        }

        try {
            provider.addInstance(settings, configuration, services);
        } catch (RuntimeException ex) {
            return Optional.of(RegistrationError.builder()
                    .failure(RegistrationFailure.ACTIVATION_FAILED)
                    .instanceKey(instanceKey)
                    .scope(scope)
                    .message("activation of service instance '" + instanceKey + "' failed: "
                            + (ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage()))
                    .cause(ex)
                    .build());
        }
        log.info("Activated service instance '{}' of {}", instanceKey, scope);
        return Optional.empty();
    }

    private boolean subscribeTracing(boolean tracingEnabled) {
        if (!tracingEnabled) {
            return false;
        }
        Set<String> sources = provider.activitySourceNames();
        if (sources == null || sources.isEmpty()) {
            return false;
        }
        tracing.addSources(Set.copyOf(sources));
        log.debug("Subscribed activity sources {} for {}", sources, scope);
        return true;
    }

    private RegistrationResult reportFailure(RegistrationError error, List<String> activated) {
        log.warn(
                "Registration of {} failed at instance '{}': [{}] {}",
                scope,
                error.getInstanceKey(),
                error.reasonCode(),
                error.getMessage()
        );
        return RegistrationResult.failure(error, activated);
    }
}
