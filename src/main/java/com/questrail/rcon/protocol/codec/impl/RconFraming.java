package com.questrail.rcon.protocol.codec.impl;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * RconFraming
 * -----------------------------------------------------------------------------
 * Layout constants and size checks for a single Source RCON packet.
 *
 * <p>This class only locates the fields of a packet. Text decoding and type
 * mapping happen in {@link DefaultRconPacketDecoder}.</p>
 */
final class RconFraming
{
    /** Width of the size prefix. */
    static final int SIZE_FIELD_LENGTH = 4;

    /** id + type fields. */
    static final int HEADER_LENGTH = 8;

    /** Body NUL + empty-string NUL. */
    static final int TERMINATOR_LENGTH = 2;

    /** Smallest value the size field may carry (empty body). */
    static final int MIN_DECLARED_SIZE = HEADER_LENGTH + TERMINATOR_LENGTH;

    /** Smallest complete packet on the wire. */
    static final int MIN_PACKET_LENGTH = SIZE_FIELD_LENGTH + MIN_DECLARED_SIZE;

    /** Offset of the first body byte. */
    static final int BODY_OFFSET = SIZE_FIELD_LENGTH + HEADER_LENGTH;

    private RconFraming() {}

    static ByteBuffer littleEndian(byte[] bytes) {
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Validate the size prefix and terminator of one complete packet.
     *
     * @throws RconFramingException if the message is truncated, oversized
     *         relative to its prefix, or not NUL-terminated
     */
    static void validate(byte[] message)
            throws RconFramingException
    {
        if (message == null || message.length < MIN_PACKET_LENGTH) {
            throw new RconFramingException("Message too short for an RCON packet");
        }

        final int declared = littleEndian(message).getInt(0);
        if (declared < MIN_DECLARED_SIZE) {
            throw new RconFramingException("Declared size " + declared + " below minimum " + MIN_DECLARED_SIZE);
        }
        if (declared != message.length - SIZE_FIELD_LENGTH) {
            throw new RconFramingException("Declared size " + declared
                    + " does not match message length " + message.length);
        }

        // Only the final NUL is mandatory. Some servers omit the body NUL.
        if (message[message.length - 1] != 0) {
            throw new RconFramingException("Missing RCON packet terminator");
        }
    }
}
