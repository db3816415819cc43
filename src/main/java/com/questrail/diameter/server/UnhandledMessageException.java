package com.questrail.diameter.server;

/**
 * Carried by the {@link ErrorReport} emitted when no handler matches a message.
 * It is reported, never thrown.
 */
public final class UnhandledMessageException extends Exception
{
    public UnhandledMessageException() {
        super("unhandled message");
    }
}
