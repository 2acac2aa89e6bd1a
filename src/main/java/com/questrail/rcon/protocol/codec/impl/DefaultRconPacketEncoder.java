package com.questrail.rcon.protocol.codec.impl;

import com.questrail.rcon.protocol.codec.RconPacketEncoder;
import com.questrail.rcon.protocol.codec.RconTextEncoding;
import com.questrail.rcon.protocol.model.RconPacket;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * DefaultRconPacketEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RconPacketEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultRconPacketDecoder}. Body
 * characters the chosen encoding cannot represent are replaced by the
 * charset's replacement byte.</p>
 */
public final class DefaultRconPacketEncoder implements RconPacketEncoder
{
    @Override
    public byte[] encode(RconPacket packet, RconTextEncoding encoding)
    {
        Objects.requireNonNull(packet, "packet");
        Objects.requireNonNull(encoding, "encoding");

        final byte[] body = packet.body().getBytes(encoding.charset());

        // size counts everything after the size field itself
        final int declared = RconFraming.HEADER_LENGTH + body.length + RconFraming.TERMINATOR_LENGTH;
        final byte[] message = new byte[RconFraming.SIZE_FIELD_LENGTH + declared];

        ByteBuffer out = RconFraming.littleEndian(message);
        out.putInt(declared);
        out.putInt(packet.id());
        out.putInt(packet.type().wireCode());
        out.put(body);
        // trailing two bytes are already zero

        return message;
    }
}
