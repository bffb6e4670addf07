package com.acme.ztmc.access.transport.api;

import java.util.Objects;

/**
 * Raw request as received by a transport, before decoding.
 *
 * @param remoteAddress peer address as seen by the transport, informational only
 */
public record InboundAccessRequest(long requestId, String body, String remoteAddress) {
    public InboundAccessRequest {
        Objects.requireNonNull(body, "body");
        remoteAddress = remoteAddress == null ? "" : remoteAddress;
    }
}
