package org.cirreum.secrets.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Failure kinds that abort a registration attempt, each with a stable reason code.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum RegistrationFailure {
    ALREADY_REGISTERED("SP_ALREADY_REGISTERED"),
    MISSING_SETTINGS("SP_MISSING_SETTINGS"),
    MISSING_ENDPOINT("SP_MISSING_ENDPOINT"),
    ENDPOINT_PARSE_FAILED("SP_ENDPOINT_PARSE_FAILED"),
    UNRESOLVABLE_ENDPOINT("SP_UNRESOLVABLE_ENDPOINT"),
    DUPLICATE_ENDPOINT("SP_DUPLICATE_ENDPOINT"),
    PROVIDER_VALIDATION_FAILED("SP_PROVIDER_VALIDATION_FAILED"),
    ACTIVATION_FAILED("SP_ACTIVATION_FAILED");

    /** Deterministic reason code prefixed onto exception messages. */
    private final String reasonCode;
}
