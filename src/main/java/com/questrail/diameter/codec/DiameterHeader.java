package com.questrail.diameter.codec;

/**
 * DiameterHeader
 * -----------------------------------------------------------------------------
 * Immutable representation of the fixed 20-byte Diameter message header
 * (RFC 6733 §3).
 *
 * <pre>
 *   offset  size  field
 *   0       1     version            (always 1)
 *   1       3     messageLength      (includes these 20 bytes)
 *   4       1     commandFlags       (R P E T r r r r)
 *   5       3     commandCode
 *   8       4     applicationId
 *   12      4     hopByHopId
 *   16      4     endToEndId
 * </pre>
 *
 * <p>The 24-bit fields are carried as {@code int}, the unsigned 32-bit
 * identifiers as {@code long}. Construction rejects values that cannot be
 * represented on the wire; it does <em>not</em> enforce the version or the
 * minimum message length, which are validated by the decode path so that a
 * malformed header can still be described in diagnostics.</p>
 *
 * <p>The message length is never derived implicitly. Callers building an
 * outbound header set it with {@link #withPayloadLength(int)}.</p>
 */
public record DiameterHeader(
        int version,
        int messageLength,
        int commandFlags,
        int commandCode,
        long applicationId,
        long hopByHopId,
        long endToEndId
) {
    /** Size of the header on the wire, in bytes. */
    public static final int LENGTH = 20;

    /** The only protocol version defined by RFC 6733. */
    public static final int VERSION = 1;

    public static final int FLAG_REQUEST = 0x80;
    public static final int FLAG_PROXIABLE = 0x40;
    public static final int FLAG_ERROR = 0x20;
    public static final int FLAG_RETRANSMITTED = 0x10;

    static final int MAX_UINT24 = 0xFF_FFFF;
    static final long MAX_UINT32 = 0xFFFF_FFFFL;

    public DiameterHeader {
        checkRange("version", version, 0xFF);
        checkRange("messageLength", messageLength, MAX_UINT24);
        checkRange("commandFlags", commandFlags, 0xFF);
        checkRange("commandCode", commandCode, MAX_UINT24);
        checkRange("applicationId", applicationId, MAX_UINT32);
        checkRange("hopByHopId", hopByHopId, MAX_UINT32);
        checkRange("endToEndId", endToEndId, MAX_UINT32);
    }

    /**
     * Creates a version 1 header with a message length covering the header
     * only. Use {@link #withPayloadLength(int)} once the payload is known.
     */
    public static DiameterHeader of(int commandFlags,
                                    int commandCode,
                                    long applicationId,
                                    long hopByHopId,
                                    long endToEndId) {
        return new DiameterHeader(VERSION, LENGTH, commandFlags, commandCode,
                applicationId, hopByHopId, endToEndId);
    }

    /**
     * Returns a copy whose message length is {@code 20 + payloadLength}.
     *
     * @throws IllegalArgumentException if the result does not fit in 24 bits
     */
    public DiameterHeader withPayloadLength(int payloadLength) {
        if (payloadLength < 0) {
            throw new IllegalArgumentException("payloadLength must be >= 0 (was " + payloadLength + ")");
        }
        return new DiameterHeader(version, LENGTH + payloadLength, commandFlags, commandCode,
                applicationId, hopByHopId, endToEndId);
    }

    /**
     * Returns a copy with the given command flags.
     */
    public DiameterHeader withCommandFlags(int flags) {
        return new DiameterHeader(version, messageLength, flags, commandCode,
                applicationId, hopByHopId, endToEndId);
    }

    /**
     * Number of AVP payload bytes announced by {@link #messageLength()}.
     * Negative when the announced length is shorter than the header itself.
     */
    public int payloadLength() {
        return messageLength - LENGTH;
    }

    public boolean isRequest() {
        return (commandFlags & FLAG_REQUEST) != 0;
    }

    public boolean isProxiable() {
        return (commandFlags & FLAG_PROXIABLE) != 0;
    }

    public boolean isError() {
        return (commandFlags & FLAG_ERROR) != 0;
    }

    public boolean isRetransmitted() {
        return (commandFlags & FLAG_RETRANSMITTED) != 0;
    }

    /**
     * Human readable command name for this header, for example
     * {@code Capabilities-Exchange-Request (CER)}.
     *
     * @see CommandNames#lookup(int, boolean)
     */
    public Command commandName() {
        return CommandNames.lookup(commandCode, isRequest());
    }

    @Override
    public String toString() {
        Command cmd = commandName();
        return cmd.name() + " (" + cmd.abbrev() + ") Header{"
                + "Code=" + commandCode
                + ",Version=" + version
                + ",MessageLength=" + messageLength
                + ",CommandFlags={r=" + isRequest()
                + ",p=" + isProxiable()
                + ",e=" + isError()
                + ",t=" + isRetransmitted() + "}"
                + ",ApplicationId=" + applicationId
                + ",HopByHopId=0x" + Long.toHexString(hopByHopId)
                + ",EndToEndId=0x" + Long.toHexString(endToEndId)
                + "}";
    }

    private static void checkRange(String field, long value, long max) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(
                    field + " must be in range 0.." + max + " (was " + value + ")");
        }
    }
}
