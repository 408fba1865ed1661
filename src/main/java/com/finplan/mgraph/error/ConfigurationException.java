package com.finplan.mgraph.error;

/**
 * The model was used in a way its current configuration does not allow:
 * unknown dimension members, missing horizon, unknown metrics in queries and
 * the like.
 */
public class ConfigurationException extends ModelException {
    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }
}
