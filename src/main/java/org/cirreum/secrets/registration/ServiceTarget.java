package org.cirreum.secrets.registration;

/**
 * Host-side service registration target handed to activation hooks.
 */
public interface ServiceTarget {

    /**
     * Registers one shared service instance.
     *
     * @param serviceType contract the instance is registered under.
     * @param instance service instance.
     * @param <T> service contract type.
     */
    <T> void addSingleton(Class<T> serviceType, T instance);
}
