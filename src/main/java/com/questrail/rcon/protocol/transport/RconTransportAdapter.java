package com.questrail.rcon.protocol.transport;

import com.questrail.rcon.protocol.codec.RconPacketDecoder;
import com.questrail.rcon.protocol.codec.RconPacketEncoder;
import com.questrail.rcon.protocol.codec.RconTextEncoding;
import com.questrail.rcon.protocol.model.RconPacket;
import com.questrail.rcon.protocol.observability.RconErrorEvent;
import com.questrail.rcon.protocol.observability.RconObservabilitySink;
import com.questrail.rcon.protocol.observability.RconTransportObservabilityEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * RconTransportAdapter
 * =============================================================================
 * Translation layer between a {@link MessageEndpoint} and the RCON session.
 *
 * <h2>Inbound path (decode-before-dispatch)</h2>
 *
 * <pre>
 *   MessageEndpoint
 *        → RconPacketDecoder
 *            → RconPacketListener.onPacket
 * </pre>
 *
 * <h2>Outbound path</h2>
 *
 * <pre>
 *   RconPacket
 *        → RconPacketEncoder   ({@link #encode(RconPacket)})
 *            → size check      (session)
 *                → MessageEndpoint.send   ({@link #send(byte[])})
 * </pre>
 *
 * <p>Encoding and sending are separate calls so the session can reject an
 * oversized packet before anything reaches the wire.</p>
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class MUST NOT add retries, timing, or request correlation. Malformed
 * messages are transport defects: they are dropped, reported to the
 * observability sink, and never reach the session.
 */
public final class RconTransportAdapter implements MessageEndpointListener
{
    private final MessageEndpoint endpoint;
    private final RconPacketEncoder encoder;
    private final RconPacketDecoder decoder;
    private final RconTextEncoding encoding;
    private final RconObservabilitySink observabilitySink;
    private final Supplier<Instant> wallClock;

    private volatile RconPacketListener listener;

    public RconTransportAdapter(MessageEndpoint endpoint,
                                RconPacketEncoder encoder,
                                RconPacketDecoder decoder,
                                RconTextEncoding encoding,
                                RconObservabilitySink observabilitySink)
    {
        this(endpoint, encoder, decoder, encoding, observabilitySink, Instant::now);
    }

    public RconTransportAdapter(MessageEndpoint endpoint,
                                RconPacketEncoder encoder,
                                RconPacketDecoder decoder,
                                RconTextEncoding encoding,
                                RconObservabilitySink observabilitySink,
                                Supplier<Instant> wallClock)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoding = Objects.requireNonNull(encoding, "encoding");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        // The endpoint is the raw I/O surface; this adapter is the translation layer.
        this.endpoint.setListener(this);
    }

    /**
     * Register the session that receives decoded packets. Must be called before
     * {@link #start()}.
     */
    public void setListener(RconPacketListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public void start() {
        if (listener == null) {
            throw new IllegalStateException("RconPacketListener must be set before start()");
        }
        endpoint.start();
    }

    public void close() {
        endpoint.close();
    }

    public boolean isWritable() {
        return endpoint.isWritable();
    }

    public byte[] encode(RconPacket packet) {
        return encoder.encode(Objects.requireNonNull(packet, "packet"), encoding);
    }

    public void send(byte[] message) {
        endpoint.send(Objects.requireNonNull(message, "message"));
    }

    // -------------------------------------------------------------------------
    // MessageEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        observabilitySink.onTransportEvent(new RconTransportObservabilityEvent(
                wallClock.get(), RconTransportObservabilityEvent.Kind.UP, null));
        listener.onConnected();
    }

    @Override
    public void onMessage(byte[] message) {
        Objects.requireNonNull(message, "message");

        Optional<RconPacket> packet = decoder.decode(message, encoding);
        if (packet.isEmpty()) {
            observabilitySink.onError(new RconErrorEvent(
                    wallClock.get(), "Dropped malformed RCON message of " + message.length + " bytes", null));
            return;
        }

        listener.onPacket(packet.get());
    }

    @Override
    public void onTransportError(Throwable cause) {
        observabilitySink.onTransportEvent(new RconTransportObservabilityEvent(
                wallClock.get(), RconTransportObservabilityEvent.Kind.ERROR, cause));
        listener.onTransportError(cause);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        observabilitySink.onTransportEvent(new RconTransportObservabilityEvent(
                wallClock.get(), RconTransportObservabilityEvent.Kind.DOWN, cause));
        listener.onDisconnected(cause);
    }
}
