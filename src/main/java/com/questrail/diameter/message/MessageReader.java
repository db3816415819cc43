package com.questrail.diameter.message;

import com.questrail.diameter.dict.Dictionary;

import java.io.IOException;
import java.io.InputStream;

/**
 * MessageReader
 * -----------------------------------------------------------------------------
 * Reads one complete Diameter message from a byte stream.
 *
 * <p>The connection read loop calls this once per message and never reads
 * ahead. Implementations must consume exactly the bytes of one message so
 * the next call starts on a header boundary.</p>
 *
 * <p>Failure classification used by the read loop:</p>
 * <ul>
 *   <li>{@link java.io.EOFException}: the peer closed the stream; the
 *       connection ends quietly</li>
 *   <li>{@link MessageReadException}: malformed message; may carry the
 *       partially identified message for error reports</li>
 *   <li>any other {@link IOException}: network fault</li>
 * </ul>
 */
@FunctionalInterface
public interface MessageReader
{
    Message read(InputStream in, Dictionary dictionary) throws IOException;
}
