package org.cirreum.secrets.registration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.cirreum.secrets.core.ProviderScope;

import java.util.List;

/**
 * Immutable summary of one successful registration call.
 */
@Value
@Builder
public class RegistrationReport {

    /**
     * Scope the instances were registered under.
     */
    ProviderScope scope;

    /**
     * Activated instance keys in registration order.
     */
    @Singular
    List<String> activatedInstances;

    /**
     * Whether the provider's activity sources were subscribed for tracing.
     */
    boolean tracingSubscribed;

    /**
     * Returns an empty report for a call that had nothing to register.
     */
    public static RegistrationReport empty(ProviderScope scope) {
        return RegistrationReport.builder().scope(scope).build();
    }
}
