package com.gorax.collab.message;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound envelope. {@code type} stays a string so unknown types can be answered with an error
 * instead of failing the whole parse.
 */
public record ClientMessage(
    String type,
    JsonNode payload,
    String timestamp
) {}
