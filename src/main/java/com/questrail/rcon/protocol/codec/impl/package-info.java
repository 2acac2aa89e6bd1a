/**
 * Default Source RCON codec implementation.
 *
 * <p>Only {@link com.questrail.rcon.protocol.codec.impl.DefaultRconPacketEncoder}
 * and {@link com.questrail.rcon.protocol.codec.impl.DefaultRconPacketDecoder}
 * are public. Layout helpers stay package-private so callers depend on the
 * codec interfaces, not on byte offsets.</p>
 */
package com.questrail.rcon.protocol.codec.impl;
