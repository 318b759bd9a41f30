package dao.sol.bundler.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Relay acknowledgement; {@code result} is the relay's opaque payload (usually the bundle id).
 */
public record RelayAck(
        boolean success,
        JsonNode result,
        String error,
        String details
) {}
