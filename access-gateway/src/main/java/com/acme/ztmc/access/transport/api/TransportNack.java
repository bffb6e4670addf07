package com.acme.ztmc.access.transport.api;

public record TransportNack(int statusCode, String error) implements TransportResponse { }
