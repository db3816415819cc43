package com.questrail.diameter.message;

import com.questrail.diameter.codec.DiameterHeader;
import com.questrail.diameter.codec.impl.DefaultHeaderCodec;
import com.questrail.diameter.dict.Dictionary;

import java.util.Objects;

/**
 * Message
 * -----------------------------------------------------------------------------
 * A Diameter message as seen by the connection core: the decoded header, the
 * undecoded AVP payload that followed it, and the {@link Dictionary} the
 * message was read against.
 *
 * <h2>Why the payload stays raw</h2>
 * The core routes on header fields only. AVP decoding belongs to the
 * application layer, which can interpret {@link #payload()} with whatever
 * codec it uses.
 *
 * Immutability is enforced via defensive copying.
 */
public final class Message
{
    private final DiameterHeader header;
    private final byte[] payload;
    private final Dictionary dictionary;

    /**
     * Wraps a header and payload as read from the wire. The header's message
     * length is kept as received.
     */
    public Message(DiameterHeader header, byte[] payload, Dictionary dictionary) {
        this.header = Objects.requireNonNull(header, "header");
        this.payload = (payload == null) ? new byte[0] : payload.clone();
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
    }

    /**
     * Builds an outbound message. The header's message length is set to
     * {@code 20 + payload.length}.
     */
    public static Message of(DiameterHeader header, byte[] payload, Dictionary dictionary) {
        Objects.requireNonNull(header, "header");
        byte[] body = (payload == null) ? new byte[0] : payload;
        return new Message(header.withPayloadLength(body.length), body, dictionary);
    }

    public DiameterHeader header() {
        return header;
    }

    /**
     * Returns a copy of the AVP payload bytes (may be empty, never null).
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    /**
     * The dictionary this message was decoded against; the multiplexer
     * resolves the command name through it.
     */
    public Dictionary dictionary() {
        return dictionary;
    }

    /**
     * Wire form: encoded header followed by the payload.
     */
    public byte[] toBytes() {
        byte[] head = DefaultHeaderCodec.INSTANCE.encode(header);
        byte[] out = new byte[head.length + payload.length];
        System.arraycopy(head, 0, out, 0, head.length);
        System.arraycopy(payload, 0, out, head.length, payload.length);
        return out;
    }

    @Override
    public String toString() {
        return "Message[" + header + ", payloadLength=" + payload.length + ']';
    }
}
