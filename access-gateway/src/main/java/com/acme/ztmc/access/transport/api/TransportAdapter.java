package com.acme.ztmc.access.transport.api;

/**
 * SPI for network front ends of the access pipeline.
 *
 * <p>Lifecycle: call {@link #setInboundHandler} before {@link #start()}.
 * {@link #close()} delegates to {@link #stop()}. Implementations must
 * tolerate multiple stop/close calls without error.
 */
public interface TransportAdapter extends AutoCloseable {

    /** Starts accepting inbound connections. */
    void start() throws Exception;

    /** Stops the transport and releases its threads. */
    void stop() throws Exception;

    /** Port the transport is bound to, or the configured port before start. */
    int listenPort();

    void setInboundHandler(InboundHandler handler);

    /** Receives decoded inbound requests. */
    interface InboundHandler {
        TransportResponse onRequest(InboundAccessRequest request);
    }

    @Override
    default void close() throws Exception { stop(); }
}
