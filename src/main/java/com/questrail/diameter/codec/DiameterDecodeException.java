package com.questrail.diameter.codec;

import java.io.IOException;

/**
 * Indicates that bytes read from a peer do not form a valid Diameter message.
 *
 * This typically reflects:
 * <ul>
 *   <li>An unsupported protocol version</li>
 *   <li>A message length shorter than the header</li>
 *   <li>A truncated byte array handed to a decoder</li>
 * </ul>
 *
 * Decode failures are read faults: the connection that produced them is closed.
 */
public class DiameterDecodeException extends IOException
{
    public DiameterDecodeException(String message) {
        super(message);
    }

    public DiameterDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
