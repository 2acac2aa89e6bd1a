package com.questrail.rcon.protocol.codec.impl;

/**
 * Raised inside the codec when a message violates the packet layout. Never
 * escapes the codec: the decoder converts it to an empty result.
 */
final class RconFramingException extends Exception
{
    RconFramingException(String message) {
        super(message);
    }
}
