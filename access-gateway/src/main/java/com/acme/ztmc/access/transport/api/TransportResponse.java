package com.acme.ztmc.access.transport.api;

public sealed interface TransportResponse permits TransportAck, TransportNack {
    int statusCode();
}
