package dev.contentfarm.transport.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contentfarm.transport.AlreadyStartedException;
import dev.contentfarm.transport.HandlerNotSetException;
import dev.contentfarm.transport.JsonRpcMessage;
import dev.contentfarm.transport.JsonRpcRequest;
import dev.contentfarm.transport.JsonRpcResponse;
import dev.contentfarm.transport.NotStartedException;
import dev.contentfarm.transport.RequestId;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a one-shot inbound channel into a correlated request/response exchange.
 *
 * <p>The transport never writes bytes itself. Sending a request with
 * {@link SendOptions#expectReply()} arms the wait for its reply; the layer above makes the actual
 * network call. Replies come back through the endpoint bound in {@link #start()}, which feeds
 * {@link #onMessage(JsonRpcMessage)}: responses settle their pending call, requests and
 * notifications go to the handler set with {@link #setMessageHandler(MessageHandler)}.
 *
 * <p>Lifecycle is {@code CREATED -> STARTED -> CLOSED}; closing is terminal.
 */
public class CorrelatedTransport implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorrelatedTransport.class);

    public static final String DEFAULT_BASE_PATH = "/mcp";

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    static final String CLOSE_REASON = "transport closed";

    enum State {
        CREATED, STARTED, CLOSED
    }

    private final InboundEndpoint endpoint;
    private final String basePath;
    private final Duration requestTimeout;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final PendingCallRegistry registry;
    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);

    private volatile MessageHandler messageHandler;
    private volatile Runnable closeHandler;

    private CorrelatedTransport(Builder builder) {
        this.endpoint = Objects.requireNonNull(builder.endpoint, "endpoint");
        this.basePath = builder.basePath;
        this.requestTimeout = builder.requestTimeout;
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler ? newScheduler() : builder.scheduler;
        this.registry = new PendingCallRegistry(scheduler);
    }

    public static Builder builder(InboundEndpoint endpoint) {
        return new Builder(endpoint);
    }

    /**
     * Bind the inbound route. Pure setup: no network I/O beyond the route registration.
     *
     * @throws AlreadyStartedException when called a second time or after {@link #close()}
     */
    public void start() {
        if (!state.compareAndSet(State.CREATED, State.STARTED)) {
            throw new AlreadyStartedException(state.get().name());
        }
        try {
            endpoint.bind(basePath, this::onMessage);
        } catch (RuntimeException e) {
            state.compareAndSet(State.STARTED, State.CREATED);
            throw e;
        }
        LOGGER.info("Correlated transport started on {} (request timeout {}ms)", basePath, requestTimeout.toMillis());
    }

    /**
     * Hand one outbound envelope to the transport.
     *
     * <ul>
     * <li>A request sent with {@link SendOptions#expectReply()} parks a pending call; the returned
     * future completes with the reply's result, or fails with a timeout, a remote error or
     * transport closure.</li>
     * <li>A response with an id settles the local waiter for that id, if there is one; otherwise it
     * is discarded.</li>
     * <li>Everything else completes immediately with {@code null}.</li>
     * </ul>
     * A resumption token in {@code options} is passed to its callback before anything else happens.
     *
     * @throws NotStartedException before {@link #start()} or after {@link #close()}
     * @throws dev.contentfarm.transport.DuplicateIdException when the correlation id is already outstanding
     */
    public CompletableFuture<JsonNode> send(JsonRpcMessage message, SendOptions options) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(options, "options");
        ensureStarted();
        if (options.expectsReply() && !(message instanceof JsonRpcRequest)) {
            throw new IllegalArgumentException("Only requests can wait for a correlated reply, got a " + message.kind());
        }

        if (options.resumptionToken() != null && options.onResumptionToken() != null) {
            options.onResumptionToken().accept(options.resumptionToken());
        }

        if (message instanceof JsonRpcRequest request && options.expectsReply()) {
            RequestId id = options.correlationId() != null ? options.correlationId() : request.id();
            Duration timeout = options.timeout() != null ? options.timeout() : requestTimeout;
            LOGGER.debug("Waiting for reply to {} {} (timeout {}ms)", request.method(), id, timeout.toMillis());
            return registry.await(id, timeout);
        }
        if (message instanceof JsonRpcResponse response) {
            if (response.id() == null) {
                LOGGER.debug("Discarding response without id");
            } else if (!registry.settle(response.id(), Outcome.of(response))) {
                LOGGER.debug("No waiter for response {}; discarded", response.id());
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Inbound hook. Responses settle their pending call; requests and notifications go to the
     * message handler.
     *
     * @throws NotStartedException when the transport is not started
     * @throws HandlerNotSetException when a request or notification arrives before a handler is set
     * @throws Exception whatever the message handler throws
     */
    public void onMessage(JsonRpcMessage message) throws Exception {
        Objects.requireNonNull(message, "message");
        ensureStarted();
        if (message instanceof JsonRpcResponse response) {
            if (response.id() == null) {
                LOGGER.warn("Peer reported an error with no identifiable origin: {}",
                    response.isError() ? response.error().message() : response.result());
                return;
            }
            if (!registry.settle(response.id(), Outcome.of(response))) {
                LOGGER.debug("Late or unsolicited response {} ignored", response.id());
            }
            return;
        }
        MessageHandler handler = messageHandler;
        if (handler == null) {
            throw new HandlerNotSetException();
        }
        handler.handle(message);
    }

    /**
     * Close the transport. Idempotent: only the first call drains outstanding calls and runs the
     * close handler.
     */
    @Override
    public void close() {
        State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED) {
            return;
        }
        if (previous == State.STARTED) {
            endpoint.unbind(basePath);
        }
        registry.drain(CLOSE_REASON);
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        LOGGER.info("Correlated transport on {} closed", basePath);
        Runnable hook = closeHandler;
        if (hook != null) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                LOGGER.warn("Close handler failed", e);
            }
        }
    }

    public void setMessageHandler(MessageHandler messageHandler) {
        this.messageHandler = messageHandler;
    }

    public void setCloseHandler(Runnable closeHandler) {
        this.closeHandler = closeHandler;
    }

    public boolean isStarted() {
        return state.get() == State.STARTED;
    }

    public int pendingCount() {
        return registry.size();
    }

    public String basePath() {
        return basePath;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    PendingCallRegistry registry() {
        return registry;
    }

    private void ensureStarted() {
        State current = state.get();
        if (current != State.STARTED) {
            throw new NotStartedException(current.name());
        }
    }

    private static ScheduledExecutorService newScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "correlated-transport-timer");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    public static final class Builder {

        private final InboundEndpoint endpoint;
        private String basePath = DEFAULT_BASE_PATH;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private ScheduledExecutorService scheduler;

        private Builder(InboundEndpoint endpoint) {
            this.endpoint = endpoint;
        }

        public Builder basePath(String basePath) {
            if (basePath == null || !basePath.startsWith("/")) {
                throw new IllegalArgumentException("basePath must start with '/': " + basePath);
            }
            this.basePath = basePath;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            Objects.requireNonNull(requestTimeout, "requestTimeout");
            if (requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new IllegalArgumentException("requestTimeout must be positive: " + requestTimeout);
            }
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * Arm timers on a caller-owned scheduler instead of a transport-owned one. The transport
         * does not shut a caller-owned scheduler down.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public CorrelatedTransport build() {
            return new CorrelatedTransport(this);
        }
    }
}
