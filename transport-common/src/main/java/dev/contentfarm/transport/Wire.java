package dev.contentfarm.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging envelope traffic in a consistent format so that inbound and outbound
 * lines look identical.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_JSON = 200;

    private Wire() {
    }

    public static void rx(String endpoint, JsonRpcMessage message, String json) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX endpoint={} type={} method={} id={} json={}",
                endpoint,
                message.kind(),
                method(message),
                id(message),
                truncate(json, MAX_JSON));
        }
    }

    public static void tx(String endpoint, JsonRpcMessage message, String json) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX endpoint={} type={} method={} id={} json={}",
                endpoint,
                message.kind(),
                method(message),
                id(message),
                truncate(json, MAX_JSON));
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }

    static String method(JsonRpcMessage message) {
        if (message instanceof JsonRpcRequest request) {
            return request.method();
        }
        if (message instanceof JsonRpcNotification notification) {
            return notification.method();
        }
        return null;
    }

    static RequestId id(JsonRpcMessage message) {
        if (message instanceof JsonRpcRequest request) {
            return request.id();
        }
        if (message instanceof JsonRpcResponse response) {
            return response.id();
        }
        return null;
    }
}
