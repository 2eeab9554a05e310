package dev.contentfarm.transport.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contentfarm.transport.RequestId;
import dev.contentfarm.transport.TransportException;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Bookkeeping for one outstanding request. Only the registry touches it, and only after the entry
 * has been taken out of the registry map, so each callback runs at most once.
 */
final class PendingCall {

    private final RequestId id;
    private final Consumer<JsonNode> resolve;
    private final Consumer<? super TransportException> reject;
    private final Instant deadline;

    private volatile ScheduledFuture<?> timer;

    PendingCall(RequestId id, Consumer<JsonNode> resolve, Consumer<? super TransportException> reject, Instant deadline) {
        this.id = id;
        this.resolve = resolve;
        this.reject = reject;
        this.deadline = deadline;
    }

    RequestId id() {
        return id;
    }

    Instant deadline() {
        return deadline;
    }

    void arm(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    void disarm() {
        ScheduledFuture<?> current = timer;
        if (current != null) {
            current.cancel(false);
        }
    }

    void resolve(JsonNode result) {
        resolve.accept(result);
    }

    void reject(TransportException error) {
        reject.accept(error);
    }
}
