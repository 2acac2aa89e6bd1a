package com.questrail.rcon.protocol.codec;

import com.questrail.rcon.protocol.model.RconPacket;

/**
 * RconPacketEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between a logical {@link RconPacket} and wire bytes.
 *
 * <p>The encoder applies only the mechanical rules of the packet layout (size
 * prefix, byte order, NUL terminators). It does not decide which packet to
 * send and does not check packet size limits; the session layer does that on
 * the returned bytes.</p>
 */
public interface RconPacketEncoder
{
    /**
     * Encode a packet into a message ready for the transport.
     *
     * @param packet   logical packet
     * @param encoding body text encoding
     * @return the complete wire message, size prefix included
     */
    byte[] encode(RconPacket packet, RconTextEncoding encoding);
}
