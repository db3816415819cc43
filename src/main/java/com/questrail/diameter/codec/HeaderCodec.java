package com.questrail.diameter.codec;

import java.io.IOException;
import java.io.InputStream;

/**
 * HeaderCodec
 * -----------------------------------------------------------------------------
 * Byte-level codec for the fixed Diameter header.
 *
 * <p>The codec is responsible only for:</p>
 * <ul>
 *   <li>Reading or writing exactly {@value DiameterHeader#LENGTH} big-endian bytes</li>
 *   <li>Rejecting any version other than {@value DiameterHeader#VERSION}</li>
 * </ul>
 *
 * <p>It does not read the AVP payload that follows the header, and it does
 * not recompute the message length on encode.</p>
 */
public interface HeaderCodec
{
    /**
     * Read one header from the stream.
     *
     * @return the decoded header
     * @throws java.io.EOFException if the stream ends before 20 bytes were read,
     *         including when it ends before the first byte
     * @throws InvalidVersionException if the version byte is not 1
     * @throws IOException on any other read failure
     */
    DiameterHeader decode(InputStream in) throws IOException;

    /**
     * Decode a header from the first 20 bytes of {@code bytes}.
     *
     * @throws DiameterDecodeException if fewer than 20 bytes are supplied or
     *         the version byte is not 1
     */
    DiameterHeader decode(byte[] bytes) throws DiameterDecodeException;

    /**
     * Write the 20-byte wire form of {@code header}, fields as given.
     */
    byte[] encode(DiameterHeader header);
}
