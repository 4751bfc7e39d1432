package org.cirreum.secrets.ledger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * One-way SHA-256 digest of an endpoint string, rendered as Base64.
 *
 * <p>Used purely as an equality oracle so duplicate endpoints can be detected without
 * keeping or logging the raw connection string.</p>
 *
 * @param value 44-character Base64 rendering of the digest.
 */
public record EndpointFingerprint(String value) {
    static final String ALGORITHM = "SHA-256";
    private static final int SHORT_FORM_LENGTH = 12;

    public EndpointFingerprint {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("fingerprint must be non-blank");
        }
    }

    /**
     * Fingerprints one endpoint.
     *
     * @param endpoint raw endpoint string.
     * @return fingerprint, or empty when the endpoint is null/blank or no digest is available.
     */
    public static Optional<EndpointFingerprint> compute(String endpoint) {
        return compute(endpoint, ALGORITHM);
    }

    static Optional<EndpointFingerprint> compute(String endpoint, String algorithm) {
        if (endpoint == null || endpoint.isBlank()) {
            return Optional.empty();
        }
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException ex) {
            return Optional.empty();
        }
        byte[] hash = digest.digest(endpoint.getBytes(StandardCharsets.UTF_8));
        return Optional.of(new EndpointFingerprint(Base64.getEncoder().encodeToString(hash)));
    }

    /**
     * Returns an abbreviated form suitable for log lines.
     */
    public String shortForm() {
        return value.length() <= SHORT_FORM_LENGTH ? value : value.substring(0, SHORT_FORM_LENGTH);
    }

    @Override
    public String toString() {
        return value;
    }
}
