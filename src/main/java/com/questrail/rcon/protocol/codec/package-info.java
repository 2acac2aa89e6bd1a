/**
 * RCON Packet Codec
 * =============================================================================
 *
 * Framework-agnostic boundary between logical packets and wire bytes.
 *
 * <h2>Wire layout (Source RCON)</h2>
 * <pre>
 *   int32 LE  size   number of bytes following this field
 *   int32 LE  id     request id
 *   int32 LE  type   packet type code
 *   byte[]    body   text in the configured encoding
 *   0x00 0x00        body terminator + empty string terminator
 * </pre>
 *
 * <p>The smallest legal packet is therefore 14 bytes (size 10).</p>
 *
 * <h2>Layering</h2>
 * <ul>
 *   <li>Codecs see bytes and {@code RconPacket} only, never sockets or channels</li>
 *   <li>Codecs never correlate replies with requests</li>
 *   <li>Malformed input yields {@code Optional.empty()} and is dropped upstream</li>
 * </ul>
 */
package com.questrail.rcon.protocol.codec;
