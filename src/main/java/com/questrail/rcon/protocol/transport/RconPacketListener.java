package com.questrail.rcon.protocol.transport;

import com.questrail.rcon.protocol.model.RconPacket;

/**
 * Receiver of decoded packets and transport lifecycle signals from an
 * {@link RconTransportAdapter}. Implemented by the session.
 */
public interface RconPacketListener
{
    void onConnected();

    void onPacket(RconPacket packet);

    void onTransportError(Throwable cause);

    /**
     * @param cause failure that closed the transport, or {@code null} for an
     *              orderly close
     */
    void onDisconnected(Throwable cause);
}
