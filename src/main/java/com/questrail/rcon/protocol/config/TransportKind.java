package com.questrail.rcon.protocol.config;

/**
 * Which transport carries the RCON packets.
 */
public enum TransportKind
{
    /** One packet per binary WebSocket frame at {@code ws://host:port/path}. */
    WEBSOCKET,

    /** Raw TCP stream; packets are split on their little-endian size prefix. */
    TCP
}
