package org.fhirstack.config;

import org.fhirstack.registry.StackException;

/**
 * The configuration could not be read or does not describe a stack.
 */
public class ConfigurationException extends StackException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
