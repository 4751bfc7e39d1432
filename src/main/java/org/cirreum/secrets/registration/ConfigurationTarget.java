package org.cirreum.secrets.registration;

/**
 * Host-side configuration builder that activated instances add their sources to.
 */
public interface ConfigurationTarget {

    /**
     * Appends one configuration source.
     *
     * @param source source to add.
     */
    void add(ConfigurationSource source);
}
