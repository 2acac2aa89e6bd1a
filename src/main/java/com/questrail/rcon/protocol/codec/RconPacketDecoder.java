package com.questrail.rcon.protocol.codec;

import com.questrail.rcon.protocol.model.RconPacket;

import java.util.Optional;

/**
 * RconPacketDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between one transport message and a logical
 * {@link RconPacket}.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating the size prefix against the message length</li>
 *   <li>Detecting truncation and missing terminators</li>
 *   <li>Mapping the inbound type code to a {@link com.questrail.rcon.protocol.model.RconPacketType}</li>
 * </ul>
 *
 * <p>It never correlates packets with requests. Failures here are transport
 * defects and must not influence session state.</p>
 */
public interface RconPacketDecoder
{
    /**
     * Decode exactly one packet from a complete transport message.
     *
     * @param message  raw bytes of one message
     * @param encoding body text encoding
     * @return the decoded packet, or {@link Optional#empty()} if the message is
     *         malformed or carries an unknown type code
     */
    Optional<RconPacket> decode(byte[] message, RconTextEncoding encoding);
}
