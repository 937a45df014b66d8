package org.utd.cs.langmodel.probability;

/**
 * Thrown when an estimator, model or configuration is constructed with
 * parameters it cannot work with (too few bins, an empty sample set,
 * an unknown model name, a malformed property).
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
