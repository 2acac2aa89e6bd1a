package com.questrail.rcon.protocol.model;

/**
 * RconProtocol
 * -----------------------------------------------------------------------------
 * Named protocol constants shared by the codec and the session layer.
 *
 * <p>Command request ids are drawn from {@code [MIN_REQUEST_ID, MAX_REQUEST_ID]}.
 * {@link #ID_AUTH} lies outside that range so an auth reply can never be
 * mistaken for a command reply.</p>
 */
public final class RconProtocol
{
    /** Request id tagging the AUTH packet; echoed back on success. */
    public static final int ID_AUTH = 0x999;

    /** Id the server places on AUTH_RESPONSE when the password is rejected. */
    public static final int ID_AUTH_FAILURE = -1;

    public static final int MIN_REQUEST_ID = 1;
    public static final int MAX_REQUEST_ID = 255;

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 27015;
    public static final int DEFAULT_MAX_PACKET_SIZE = 4096;

    private RconProtocol() {}

    public static boolean isAuthAccepted(int replyId) {
        return replyId == ID_AUTH;
    }
}
