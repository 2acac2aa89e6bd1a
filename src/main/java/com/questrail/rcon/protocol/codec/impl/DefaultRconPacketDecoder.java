package com.questrail.rcon.protocol.codec.impl;

import com.questrail.rcon.protocol.codec.RconPacketDecoder;
import com.questrail.rcon.protocol.codec.RconTextEncoding;
import com.questrail.rcon.protocol.model.RconPacket;
import com.questrail.rcon.protocol.model.RconPacketType;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultRconPacketDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RconPacketDecoder}.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Size prefix and terminator validation ({@link RconFraming})</li>
 *   <li>id / type extraction (little-endian)</li>
 *   <li>Inbound type-code mapping</li>
 *   <li>Body text decoding, trailing NUL bytes removed</li>
 * </ol>
 */
public final class DefaultRconPacketDecoder implements RconPacketDecoder
{
    @Override
    public Optional<RconPacket> decode(byte[] message, RconTextEncoding encoding)
    {
        Objects.requireNonNull(encoding, "encoding");

        try {
            RconFraming.validate(message);
        }
        catch (RconFramingException e) {
            // Wire-level failure → drop message
            return Optional.empty();
        }

        ByteBuffer in = RconFraming.littleEndian(message);
        final int id = in.getInt(RconFraming.SIZE_FIELD_LENGTH);
        final int typeCode = in.getInt(RconFraming.SIZE_FIELD_LENGTH + 4);

        Optional<RconPacketType> type = RconPacketType.fromInboundCode(typeCode);
        if (type.isEmpty()) {
            return Optional.empty();
        }

        int end = message.length - 1;
        while (end > RconFraming.BODY_OFFSET && message[end - 1] == 0) {
            end--;
        }

        String body = new String(message, RconFraming.BODY_OFFSET, end - RconFraming.BODY_OFFSET, encoding.charset());
        return Optional.of(new RconPacket(type.get(), id, body));
    }
}
