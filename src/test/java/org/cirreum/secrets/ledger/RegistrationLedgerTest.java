package org.cirreum.secrets.ledger;

import org.cirreum.secrets.configuration.ProviderType;
import org.cirreum.secrets.core.ProviderScope;
import org.cirreum.secrets.core.RegistrationError;
import org.cirreum.secrets.core.RegistrationFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Registration ledger Tests")
class RegistrationLedgerTest {
    private static final ProviderScope VAULT = new ProviderScope(ProviderType.SECRETS, "Vault");
    private static final ProviderScope KEY_VAULT = new ProviderScope(ProviderType.SECRETS, "KeyVault");

    @Test
    @DisplayName("Scope and key render their namespaced forms")
    void testKeyRendering() {
        assertEquals("Secrets.Vault", VAULT.namespace());
        assertEquals("Secrets.Vault::primary", RegistrationKey.of(VAULT, "primary").value());
        assertEquals("Secrets.Vault::primary", RegistrationKey.of(VAULT, "primary").toString());
        assertEquals("Secrets.Vault", new ProviderScope(ProviderType.SECRETS, "  Vault ").namespace());
    }

    @Test
    @DisplayName("Registration key is claimed exactly once regardless of endpoint")
    void testRegistrationClaimedOnce() {
        RegistrationLedger ledger = new RegistrationLedger();
        RegistrationKey key = RegistrationKey.of(VAULT, "primary");

        assertTrue(ledger.claimRegistration(key, "https://vault.local/a").isEmpty());
        Optional<RegistrationError> sameEndpoint = ledger.claimRegistration(key, "https://vault.local/a");
        Optional<RegistrationError> otherEndpoint = ledger.claimRegistration(key, "https://vault.local/b");
        Optional<RegistrationError> noEndpoint = ledger.claimRegistration(key, null);

        assertTrue(sameEndpoint.isPresent());
        assertTrue(otherEndpoint.isPresent());
        assertTrue(noEndpoint.isPresent());
        assertEquals(RegistrationFailure.ALREADY_REGISTERED, otherEndpoint.get().getFailure());
        assertEquals("primary", otherEndpoint.get().getInstanceKey());
        assertEquals(VAULT, otherEndpoint.get().getScope());
        assertEquals(1, ledger.registrationCount());
        assertTrue(ledger.isRegistered(key));
    }

    @Test
    @DisplayName("Same instance key under another provider is a different registration")
    void testRegistrationKeysAreScoped() {
        RegistrationLedger ledger = new RegistrationLedger();
        assertTrue(ledger.claimRegistration(RegistrationKey.of(VAULT, "primary"), "x").isEmpty());
        assertTrue(ledger.claimRegistration(RegistrationKey.of(KEY_VAULT, "primary"), "x").isEmpty());
        assertEquals(2, ledger.registrationCount());
    }

    @Test
    @DisplayName("Endpoint dedup is scoped per provider type and name")
    void testEndpointClaimScoping() {
        RegistrationLedger ledger = new RegistrationLedger();
        EndpointFingerprint fingerprint = EndpointFingerprint.compute("https://vault.local/a").orElseThrow();

        assertTrue(ledger.claimEndpoint(VAULT, fingerprint, "primary").isEmpty());
        assertTrue(ledger.claimEndpoint(KEY_VAULT, fingerprint, "primary").isEmpty());

        Optional<RegistrationError> duplicate = ledger.claimEndpoint(VAULT, fingerprint, "secondary");
        assertTrue(duplicate.isPresent());
        assertEquals(RegistrationFailure.DUPLICATE_ENDPOINT, duplicate.get().getFailure());
        assertEquals("secondary", duplicate.get().getInstanceKey());
        assertFalse(duplicate.get().getMessage().contains("vault.local"));

        assertEquals(Optional.of("primary"), ledger.endpointOwner(VAULT, fingerprint));
        assertTrue(ledger.isEndpointClaimed(KEY_VAULT, fingerprint));
        assertEquals(2, ledger.endpointCount());
    }

    @Test
    @DisplayName("Unclaimed entries are reported as absent")
    void testUnclaimedQueries() {
        RegistrationLedger ledger = new RegistrationLedger();
        EndpointFingerprint fingerprint = EndpointFingerprint.compute("https://vault.local/a").orElseThrow();
        assertFalse(ledger.isRegistered(RegistrationKey.of(VAULT, "primary")));
        assertFalse(ledger.isEndpointClaimed(VAULT, fingerprint));
        assertEquals(0, ledger.registrationCount());
        assertEquals(0, ledger.endpointCount());
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrent claims of the same key and endpoint admit exactly one winner")
    void testConcurrentClaims() throws InterruptedException {
        RegistrationLedger ledger = new RegistrationLedger();
        RegistrationKey key = RegistrationKey.of(VAULT, "primary");
        EndpointFingerprint fingerprint = EndpointFingerprint.compute("https://vault.local/a").orElseThrow();
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger registrationWins = new AtomicInteger();
        AtomicInteger endpointWins = new AtomicInteger();
        AtomicBoolean failed = new AtomicBoolean(false);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int i = 0; i < threads; i++) {
            final String instanceKey = "instance-" + i;
            executor.execute(() -> {
                try {
                    start.await();
                    if (ledger.claimRegistration(key, "https://vault.local/a").isEmpty()) {
                        registrationWins.incrementAndGet();
                    }
                    if (ledger.claimEndpoint(VAULT, fingerprint, instanceKey).isEmpty()) {
                        endpointWins.incrementAndGet();
                    }
                } catch (Throwable t) {
                    failed.set(true);
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        executor.shutdownNow();

        assertFalse(failed.get());
        assertEquals(1, registrationWins.get());
        assertEquals(1, endpointWins.get());
        assertEquals(1, ledger.registrationCount());
        assertEquals(1, ledger.endpointCount());
    }
}
