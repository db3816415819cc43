package com.questrail.diameter.message;

import com.questrail.diameter.codec.DiameterHeader;
import com.questrail.diameter.codec.HeaderCodec;
import com.questrail.diameter.codec.impl.DefaultHeaderCodec;
import com.questrail.diameter.dict.Dictionary;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * PayloadMessageReader
 * -----------------------------------------------------------------------------
 * Default {@link MessageReader}: header through a {@link HeaderCodec}, then
 * exactly {@code messageLength - 20} payload bytes, left undecoded.
 *
 * <p>A length field smaller than the header is rejected before any payload
 * byte is consumed. An optional ceiling guards against peers announcing
 * messages larger than the server is willing to buffer.</p>
 */
public final class PayloadMessageReader implements MessageReader
{
    /** Largest length the 24-bit field can express. */
    public static final int MAX_MESSAGE_LENGTH = 0xFF_FFFF;

    private final HeaderCodec headerCodec;
    private final int maxMessageLength;

    public PayloadMessageReader() {
        this(DefaultHeaderCodec.INSTANCE, MAX_MESSAGE_LENGTH);
    }

    public PayloadMessageReader(HeaderCodec headerCodec, int maxMessageLength) {
        this.headerCodec = Objects.requireNonNull(headerCodec, "headerCodec");
        if (maxMessageLength < DiameterHeader.LENGTH) {
            throw new IllegalArgumentException("maxMessageLength must be >= " + DiameterHeader.LENGTH);
        }
        this.maxMessageLength = maxMessageLength;
    }

    @Override
    public Message read(InputStream in, Dictionary dictionary) throws IOException
    {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(dictionary, "dictionary");

        final DiameterHeader header = headerCodec.decode(in);

        if (header.messageLength() < DiameterHeader.LENGTH) {
            throw new MessageReadException(
                    "Invalid message length " + header.messageLength() + " (< " + DiameterHeader.LENGTH + ")",
                    new Message(header, null, dictionary));
        }
        if (header.messageLength() > maxMessageLength) {
            throw new MessageReadException(
                    "Message length " + header.messageLength() + " exceeds limit " + maxMessageLength,
                    new Message(header, null, dictionary));
        }

        final int payloadLength = header.payloadLength();
        final byte[] payload = in.readNBytes(payloadLength);
        if (payload.length < payloadLength) {
            throw new EOFException("Truncated message body: " + payload.length + " of "
                    + payloadLength + " bytes");
        }
        return new Message(header, payload, dictionary);
    }
}
