package com.questrail.diameter.server;

/**
 * What {@link ServeMux#handle(String, Handler)} does with a key that already
 * has a handler.
 */
public enum RegistrationPolicy
{
    /** The new handler silently replaces the previous one. */
    REPLACE,

    /** The registration fails with a configuration error; the previous handler stays. */
    REJECT
}
