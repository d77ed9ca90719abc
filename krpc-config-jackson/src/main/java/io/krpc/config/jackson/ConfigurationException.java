package io.krpc.config.jackson;

import io.krpc.core.KrpcException;

/**
 * Raised when a configuration document cannot be read or holds invalid settings.
 */
public final class ConfigurationException extends KrpcException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
