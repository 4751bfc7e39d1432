package org.cirreum.secrets.registration;

import org.cirreum.secrets.core.RegistrationError;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a registration call: a report on success or the first error on failure.
 */
public sealed interface RegistrationResult {

    /**
     * Creates a successful result.
     */
    static RegistrationResult success(RegistrationReport report) {
        return new Success(report);
    }

    /**
     * Creates a failed result.
     *
     * @param error first error encountered.
     * @param activatedBeforeFailure instances activated earlier in the same call; they stay registered.
     */
    static RegistrationResult failure(RegistrationError error, List<String> activatedBeforeFailure) {
        return new Failure(error, activatedBeforeFailure);
    }

    /**
     * Returns whether registration completed.
     */
    boolean isSuccess();

    /**
     * Returns the error of a failed result.
     */
    Optional<RegistrationError> error();

    /**
     * Returns the report, or throws the reason-coded exception of a failure.
     */
    RegistrationReport orElseThrow();

    /**
     * Successful registration.
     *
     * @param report registration summary.
     */
    record Success(RegistrationReport report) implements RegistrationResult {
        public Success {
            Objects.requireNonNull(report, "report");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<RegistrationError> error() {
            return Optional.empty();
        }

        @Override
        public RegistrationReport orElseThrow() {
            return report;
        }
    }

    /**
     * Failed registration. Nothing activated before the failure is rolled back.
     *
     * @param registrationError first error encountered.
     * @param activatedBeforeFailure instance keys activated before the failure.
     */
    record Failure(RegistrationError registrationError, List<String> activatedBeforeFailure)
            implements RegistrationResult {
        public Failure {
            Objects.requireNonNull(registrationError, "registrationError");
            activatedBeforeFailure = activatedBeforeFailure == null ? List.of() : List.copyOf(activatedBeforeFailure);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<RegistrationError> error() {
            return Optional.of(registrationError);
        }

        @Override
        public RegistrationReport orElseThrow() {
            throw registrationError.toException();
        }
    }
}
