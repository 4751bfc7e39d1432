package org.cirreum.secrets.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Tagged error value describing why one instance could not be admitted.
 *
 * <p>Messages name the instance key and provider scope; they never carry the raw endpoint.</p>
 */
@Value
@Builder
public class RegistrationError {

    /**
     * Failure kind.
     */
    @NonNull
    RegistrationFailure failure;

    /**
     * Offending instance key.
     */
    @NonNull
    String instanceKey;

    /**
     * Provider scope the instance was registered under.
     */
    @NonNull
    ProviderScope scope;

    /**
     * Human-readable description.
     */
    @NonNull
    String message;

    /**
     * Underlying provider exception, or {@code null}.
     */
    Throwable cause;

    /**
     * Returns the reason code of {@link #getFailure()}.
     */
    public String reasonCode() {
        return failure.reasonCode();
    }

    /**
     * Converts this error into a reason-coded exception.
     */
    public SecretsProviderRegistrationException toException() {
        return new SecretsProviderRegistrationException(this);
    }

    /**
     * Creates an error without a cause.
     */
    public static RegistrationError of(
            RegistrationFailure failure,
            String instanceKey,
            ProviderScope scope,
            String message
    ) {
        return RegistrationError.builder()
                .failure(failure)
                .instanceKey(instanceKey)
                .scope(scope)
                .message(message)
                .build();
    }

    @Override
    public String toString() {
        return "[" + failure.reasonCode() + "] " + scope + "::" + instanceKey + ": " + message;
    }
}
