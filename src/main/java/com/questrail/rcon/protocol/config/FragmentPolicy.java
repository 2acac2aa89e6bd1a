package com.questrail.rcon.protocol.config;

/**
 * How the session decides that a command's reply is complete.
 */
public enum FragmentPolicy
{
    /**
     * The first non-empty fragment carrying the command id completes the reply.
     * Correct for servers whose replies fit one packet.
     */
    FIRST_FRAGMENT,

    /**
     * An empty RESPONSE_VALUE probe with its own id follows each command.
     * Fragments carrying the command id accumulate until the server's mirror of
     * the probe arrives.
     */
    TERMINATOR_PROBE
}
