package com.questrail.diameter.codec;

/**
 * The first header byte was not protocol version 1.
 */
public final class InvalidVersionException extends DiameterDecodeException
{
    private final int version;

    public InvalidVersionException(int version) {
        super("Invalid diameter version " + version);
        this.version = version;
    }

    public int version() {
        return version;
    }
}
