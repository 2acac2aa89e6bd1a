package com.questrail.rcon.protocol.model;

import java.util.Objects;

/**
 * Logical RCON packet: type, request id and text body.
 *
 * <p>This is the only packet form the session layer reasons about. Byte
 * order, size prefix and NUL terminators belong to the codec.</p>
 */
public record RconPacket(RconPacketType type, int id, String body)
{
    public RconPacket {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(body, "body");
    }

    public static RconPacket auth(String password) {
        return new RconPacket(RconPacketType.AUTH, RconProtocol.ID_AUTH, password);
    }

    public static RconPacket command(int id, String command) {
        return new RconPacket(RconPacketType.EXECCOMMAND, id, command);
    }

    /**
     * Empty RESPONSE_VALUE packet sent after a command. The server mirrors it,
     * which marks the end of the command's (possibly fragmented) reply.
     */
    public static RconPacket terminatorProbe(int id) {
        return new RconPacket(RconPacketType.RESPONSE_VALUE, id, "");
    }

    @Override
    public String toString() {
        // Body omitted: it may carry the RCON password.
        return "RconPacket[type=" + type + ", id=" + id + ", bodyLength=" + body.length() + "]";
    }
}
