package com.questrail.diameter.message;

import com.questrail.diameter.codec.DiameterHeader;
import com.questrail.diameter.codec.InvalidVersionException;
import com.questrail.diameter.codec.impl.DefaultHeaderCodec;
import com.questrail.diameter.dict.Dictionary;
import com.questrail.diameter.dict.StaticDictionary;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PayloadMessageReaderTest
 * -----------------------------------------------------------------------------
 * Framing of whole messages off a byte stream.
 */
final class PayloadMessageReaderTest
{
    private final Dictionary dictionary = StaticDictionary.baseProtocol();
    private final PayloadMessageReader reader = new PayloadMessageReader();

    @Test
    void readsConsecutiveMessages() throws Exception
    {
        Message first = TestMessages.capabilitiesExchangeRequest((byte) 1, (byte) 2, (byte) 3, (byte) 4);
        Message second = TestMessages.answer(0, 280, dictionary);

        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        wire.writeBytes(first.toBytes());
        wire.writeBytes(second.toBytes());
        ByteArrayInputStream in = new ByteArrayInputStream(wire.toByteArray());

        Message read1 = reader.read(in, dictionary);
        Message read2 = reader.read(in, dictionary);

        assertEquals(first.header(), read1.header());
        assertArrayEquals(new byte[] { 1, 2, 3, 4 }, read1.payload());
        assertSame(dictionary, read1.dictionary());
        assertEquals("DWA", read2.header().commandName().abbrev());
        assertEquals(0, read2.payloadLength());
        assertThrows(EOFException.class, () -> reader.read(in, dictionary));
    }

    @Test
    void truncatedBodyIsEof()
    {
        byte[] wire = TestMessages.capabilitiesExchangeRequest(new byte[16]).toBytes();
        byte[] cut = new byte[wire.length - 5];
        System.arraycopy(wire, 0, cut, 0, cut.length);

        assertThrows(EOFException.class, () -> reader.read(new ByteArrayInputStream(cut), dictionary));
    }

    @Test
    void lengthShorterThanHeaderCarriesPartialMessage()
    {
        DiameterHeader bad = new DiameterHeader(1, 8, 0x80, 257, 0, 7, 9);
        byte[] wire = DefaultHeaderCodec.INSTANCE.encode(bad);

        MessageReadException e = assertThrows(MessageReadException.class,
                () -> reader.read(new ByteArrayInputStream(wire), dictionary));
        Message partial = e.partialMessage().orElseThrow();
        assertEquals(257, partial.header().commandCode());
        assertEquals(7L, partial.header().hopByHopId());
    }

    @Test
    void lengthAboveLimitIsRejected()
    {
        PayloadMessageReader strict = new PayloadMessageReader(DefaultHeaderCodec.INSTANCE, 64);
        byte[] wire = TestMessages.capabilitiesExchangeRequest(new byte[100]).toBytes();

        MessageReadException e = assertThrows(MessageReadException.class,
                () -> strict.read(new ByteArrayInputStream(wire), dictionary));
        assertTrue(e.partialMessage().isPresent());
    }

    @Test
    void invalidVersionPropagates()
    {
        byte[] wire = TestMessages.capabilitiesExchangeRequest().toBytes();
        wire[0] = 3;

        assertThrows(InvalidVersionException.class,
                () -> reader.read(new ByteArrayInputStream(wire), dictionary));
    }

    @Test
    void messagePayloadIsDefensivelyCopied()
    {
        byte[] payload = { 5, 6 };
        Message message = TestMessages.capabilitiesExchangeRequest(payload);
        payload[0] = 0;
        message.payload()[1] = 0;

        assertArrayEquals(new byte[] { 5, 6 }, message.payload());
        assertEquals(22, message.header().messageLength());
    }
}
