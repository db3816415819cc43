package com.questrail.diameter.codec.impl;

import com.questrail.diameter.codec.DiameterDecodeException;
import com.questrail.diameter.codec.DiameterHeader;
import com.questrail.diameter.codec.InvalidVersionException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultHeaderCodecTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultHeaderCodec}.
 *
 * <p>Covers the fixed 20-byte big-endian layout, version validation and
 * stream truncation handling.</p>
 */
final class DefaultHeaderCodecTest
{
    private final DefaultHeaderCodec codec = DefaultHeaderCodec.INSTANCE;

    // CER, proxiable, length 20, app 0, hbh 0x0A0B0C0D, e2e 0xFFFFFFFE
    private static final byte[] CER_HEADER = {
            0x01, 0x00, 0x00, 0x14,
            (byte) 0xC0, 0x00, 0x01, 0x01,
            0x00, 0x00, 0x00, 0x00,
            0x0A, 0x0B, 0x0C, 0x0D,
            (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFE
    };

    @Test
    void decodeExtractsFields() throws Exception
    {
        DiameterHeader header = codec.decode(CER_HEADER);

        assertEquals(1, header.version());
        assertEquals(20, header.messageLength());
        assertEquals(0xC0, header.commandFlags());
        assertEquals(257, header.commandCode());
        assertEquals(0L, header.applicationId());
        assertEquals(0x0A0B0C0DL, header.hopByHopId());
        assertEquals(0xFFFFFFFEL, header.endToEndId());
        assertTrue(header.isRequest());
        assertTrue(header.isProxiable());
        assertFalse(header.isError());
        assertFalse(header.isRetransmitted());
    }

    @Test
    void encodeProducesWireLayout()
    {
        DiameterHeader header = new DiameterHeader(1, 20, 0xC0, 257, 0, 0x0A0B0C0DL, 0xFFFFFFFEL);
        assertArrayEquals(CER_HEADER, codec.encode(header));
    }

    @Test
    void roundTripPreservesMaximalFieldValues() throws Exception
    {
        DiameterHeader header = new DiameterHeader(
                1, 0xFFFFFF, 0xFF, 0xFFFFFF, 0xFFFFFFFFL, 0xFFFFFFFFL, 0xFFFFFFFFL);
        assertEquals(header, codec.decode(codec.encode(header)));
    }

    @Test
    void decodeRejectsWrongVersion()
    {
        byte[] bytes = CER_HEADER.clone();
        bytes[0] = 0x02;

        InvalidVersionException e = assertThrows(InvalidVersionException.class, () -> codec.decode(bytes));
        assertEquals(2, e.version());
        assertEquals("Invalid diameter version 2", e.getMessage());
    }

    @Test
    void decodeRejectsShortBuffer()
    {
        byte[] shortBuffer = new byte[19];
        shortBuffer[0] = 0x01;
        assertThrows(DiameterDecodeException.class, () -> codec.decode(shortBuffer));
    }

    @Test
    void streamDecodeConsumesExactlyOneHeader() throws Exception
    {
        byte[] twoHeaders = new byte[40];
        System.arraycopy(CER_HEADER, 0, twoHeaders, 0, 20);
        System.arraycopy(CER_HEADER, 0, twoHeaders, 20, 20);
        ByteArrayInputStream in = new ByteArrayInputStream(twoHeaders);

        codec.decode(in);
        assertEquals(20, in.available());
        assertEquals(257, codec.decode(in).commandCode());
    }

    @Test
    void streamDecodeAtEndOfStreamIsEof()
    {
        assertThrows(EOFException.class, () -> codec.decode(new ByteArrayInputStream(new byte[0])));
    }

    @Test
    void streamDecodeOfTruncatedHeaderIsEof()
    {
        byte[] partial = new byte[7];
        System.arraycopy(CER_HEADER, 0, partial, 0, 7);
        IOException e = assertThrows(IOException.class, () -> codec.decode(new ByteArrayInputStream(partial)));
        assertInstanceOf(EOFException.class, e);
    }
}
