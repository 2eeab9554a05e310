package dev.contentfarm.transport.correlation;

import dev.contentfarm.transport.JsonRpcMessage;

/**
 * Receives inbound envelopes. Used both for the upper-layer protocol handler and for the inbound
 * hook an endpoint is bound to.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(JsonRpcMessage message) throws Exception;
}
