package dev.contentfarm.transport.correlation;

/**
 * Something that can deliver inbound envelopes arriving on a route to a transport, such as an
 * HTTP POST handler.
 */
public interface InboundEndpoint {

    /**
     * Route envelopes arriving on {@code path} to {@code inbound}.
     */
    void bind(String path, MessageHandler inbound);

    /**
     * Stop routing envelopes arriving on {@code path}.
     */
    void unbind(String path);
}
