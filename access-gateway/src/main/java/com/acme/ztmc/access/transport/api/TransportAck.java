package com.acme.ztmc.access.transport.api;

/**
 * @param jsonBody response body, already serialized
 */
public record TransportAck(int statusCode, String jsonBody) implements TransportResponse { }
