package org.cirreum.secrets.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Reason-coded registration failure raised by hosts that abort startup by exception.
 */
@Getter
public final class SecretsProviderRegistrationException extends RuntimeException {
    private final transient RegistrationError error;

    /**
     * Creates an exception for one registration error.
     *
     * @param error tagged error value.
     */
    public SecretsProviderRegistrationException(RegistrationError error) {
        super(formatMessage(error), error.getCause());
        this.error = error;
    }

    /**
     * Returns the deterministic reason code.
     */
    public String getReasonCode() {
        return error.reasonCode();
    }

    private static String formatMessage(RegistrationError error) {
        RegistrationError nonNullError = Objects.requireNonNull(error, "error");
        return "[" + nonNullError.reasonCode() + "] " + nonNullError.getMessage();
    }
}
