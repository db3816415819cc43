package com.questrail.diameter.config;

/**
 * A server was configured incorrectly: a null handler registration, a
 * rejected duplicate registration, or TLS key material that cannot be loaded.
 *
 * <p>Raised while configuring or starting a server, before any connection is
 * served.</p>
 */
public class DiameterConfigurationException extends RuntimeException
{
    public DiameterConfigurationException(String message) {
        super(message);
    }

    public DiameterConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
