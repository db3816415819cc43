package com.questrail.diameter.codec.impl;

import com.questrail.diameter.codec.DiameterDecodeException;
import com.questrail.diameter.codec.DiameterHeader;
import com.questrail.diameter.codec.HeaderCodec;
import com.questrail.diameter.codec.InvalidVersionException;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * DefaultHeaderCodec
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link HeaderCodec}.
 *
 * <p>Decoding performs the following steps, in order:</p>
 * <ol>
 *   <li>Read exactly 20 bytes (short read → {@link EOFException})</li>
 *   <li>Validate the version byte (RFC 6733 §3: must be 1)</li>
 *   <li>Extract the big-endian fields into a {@link DiameterHeader}</li>
 * </ol>
 *
 * <p>Encoding is the mechanical inverse and writes the fields unchanged.</p>
 *
 * <p>Instances are stateless and may be shared.</p>
 */
public final class DefaultHeaderCodec implements HeaderCodec
{
    public static final DefaultHeaderCodec INSTANCE = new DefaultHeaderCodec();

    @Override
    public DiameterHeader decode(InputStream in) throws IOException
    {
        Objects.requireNonNull(in, "in");

        byte[] buf = in.readNBytes(DiameterHeader.LENGTH);
        if (buf.length == 0) {
            throw new EOFException("End of stream before diameter header");
        }
        if (buf.length < DiameterHeader.LENGTH) {
            throw new EOFException("Truncated diameter header: " + buf.length + " of "
                    + DiameterHeader.LENGTH + " bytes");
        }
        return parse(buf);
    }

    @Override
    public DiameterHeader decode(byte[] bytes) throws DiameterDecodeException
    {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length < DiameterHeader.LENGTH) {
            throw new DiameterDecodeException("Diameter header requires " + DiameterHeader.LENGTH
                    + " bytes (was " + bytes.length + ")");
        }
        return parse(bytes);
    }

    @Override
    public byte[] encode(DiameterHeader header)
    {
        Objects.requireNonNull(header, "header");

        byte[] out = new byte[DiameterHeader.LENGTH];
        out[0] = (byte) header.version();
        putUint24(out, 1, header.messageLength());
        out[4] = (byte) header.commandFlags();
        putUint24(out, 5, header.commandCode());
        putUint32(out, 8, header.applicationId());
        putUint32(out, 12, header.hopByHopId());
        putUint32(out, 16, header.endToEndId());
        return out;
    }

    private static DiameterHeader parse(byte[] b) throws InvalidVersionException
    {
        final int version = b[0] & 0xFF;
        if (version != DiameterHeader.VERSION) {
            throw new InvalidVersionException(version);
        }

        return new DiameterHeader(
                version,
                uint24(b, 1),
                b[4] & 0xFF,
                uint24(b, 5),
                uint32(b, 8),
                uint32(b, 12),
                uint32(b, 16)
        );
    }

    private static int uint24(byte[] b, int off)
    {
        return ((b[off] & 0xFF) << 16)
                | ((b[off + 1] & 0xFF) << 8)
                | (b[off + 2] & 0xFF);
    }

    private static long uint32(byte[] b, int off)
    {
        return ((long) (b[off] & 0xFF) << 24)
                | ((b[off + 1] & 0xFF) << 16)
                | ((b[off + 2] & 0xFF) << 8)
                | (b[off + 3] & 0xFF);
    }

    private static void putUint24(byte[] b, int off, int v)
    {
        b[off] = (byte) (v >>> 16);
        b[off + 1] = (byte) (v >>> 8);
        b[off + 2] = (byte) v;
    }

    private static void putUint32(byte[] b, int off, long v)
    {
        b[off] = (byte) (v >>> 24);
        b[off + 1] = (byte) (v >>> 16);
        b[off + 2] = (byte) (v >>> 8);
        b[off + 3] = (byte) v;
    }
}
