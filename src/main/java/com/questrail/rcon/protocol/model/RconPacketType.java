package com.questrail.rcon.protocol.model;

import java.util.Optional;

/**
 * RconPacketType
 * -----------------------------------------------------------------------------
 * Logical packet types of the Source RCON protocol.
 *
 * <p>The wire code alone is ambiguous: {@code 2} means {@link #EXECCOMMAND}
 * when the client sends it and {@link #AUTH_RESPONSE} when the server sends
 * it. Decoding is therefore direction-aware; see {@link #fromInboundCode(int)}.</p>
 */
public enum RconPacketType
{
    /** Client → server: credential request ({@code SERVERDATA_AUTH}). */
    AUTH(3),

    /** Server → client: authoritative auth verdict ({@code SERVERDATA_AUTH_RESPONSE}). */
    AUTH_RESPONSE(2),

    /** Client → server: command request ({@code SERVERDATA_EXECCOMMAND}). */
    EXECCOMMAND(2),

    /** Server → client: command output ({@code SERVERDATA_RESPONSE_VALUE}). */
    RESPONSE_VALUE(0);

    private final int wireCode;

    RconPacketType(int wireCode) {
        this.wireCode = wireCode;
    }

    public int wireCode() {
        return wireCode;
    }

    /**
     * Map a type code received from the server to its logical type.
     *
     * @return the logical type, or empty for codes the server never sends
     */
    public static Optional<RconPacketType> fromInboundCode(int code) {
        switch (code) {
            case 0:
                return Optional.of(RESPONSE_VALUE);
            case 2:
                return Optional.of(AUTH_RESPONSE);
            case 3:
                // Not sent by real servers, but test peers echo it back.
                return Optional.of(AUTH);
            default:
                return Optional.empty();
        }
    }
}
