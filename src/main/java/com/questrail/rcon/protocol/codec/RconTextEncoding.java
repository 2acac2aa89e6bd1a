package com.questrail.rcon.protocol.codec;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Text encoding applied to packet bodies.
 *
 * <p>The codec treats the option opaquely apart from mapping it to a
 * {@link Charset}. Source servers speak ASCII; some game servers emit UTF-8
 * in command output.</p>
 */
public enum RconTextEncoding
{
    ASCII(StandardCharsets.US_ASCII),
    UTF_8(StandardCharsets.UTF_8),
    ISO_8859_1(StandardCharsets.ISO_8859_1);

    private final Charset charset;

    RconTextEncoding(Charset charset) {
        this.charset = charset;
    }

    public Charset charset() {
        return charset;
    }
}
