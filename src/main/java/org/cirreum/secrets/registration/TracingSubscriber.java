package org.cirreum.secrets.registration;

import java.util.Set;

/**
 * Telemetry capability: enable tracing for a named set of activity sources.
 */
@FunctionalInterface
public interface TracingSubscriber {

    /**
     * Subscribes the given activity sources. Idempotency is up to the implementation.
     *
     * @param activitySourceNames non-empty set of source names.
     */
    void addSources(Set<String> activitySourceNames);

    /**
     * Returns a subscriber that ignores every request.
     */
    static TracingSubscriber none() {
        return activitySourceNames -> {
        };
    }
}
