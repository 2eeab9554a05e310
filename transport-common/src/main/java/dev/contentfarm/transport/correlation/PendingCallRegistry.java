package dev.contentfarm.transport.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contentfarm.transport.DuplicateIdException;
import dev.contentfarm.transport.RemoteErrorException;
import dev.contentfarm.transport.RequestId;
import dev.contentfarm.transport.RequestTimeoutException;
import dev.contentfarm.transport.TransportClosedException;
import dev.contentfarm.transport.TransportException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks outbound calls that are waiting for a correlated response.
 *
 * <p>Every entry leaves the map exactly once, through one of three paths: a matching
 * {@link #settle settle}, its timer firing, or {@link #drain drain}. Each path first removes the
 * entry atomically and only then cancels the timer and runs a callback, so whichever path loses
 * the race finds nothing to remove and does nothing. Callbacks therefore run outside any map
 * operation and may safely call back into the registry.
 *
 * <p>The registry does not own the scheduler it arms timers on.
 */
public final class PendingCallRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(PendingCallRegistry.class);

    private final ScheduledExecutorService scheduler;
    private final Map<RequestId, PendingCall> calls = new ConcurrentHashMap<>();

    private volatile String closedReason;

    public PendingCallRegistry(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Park a call until its response arrives, its timeout fires, or the registry is drained.
     *
     * @throws DuplicateIdException if a call with the same id is still outstanding
     */
    public void register(RequestId id, Consumer<JsonNode> resolve, Consumer<? super TransportException> reject,
        Duration timeout) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(resolve, "resolve");
        Objects.requireNonNull(reject, "reject");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }

        PendingCall call = new PendingCall(id, resolve, reject, Instant.now().plus(timeout));
        String reason = closedReason;
        if (reason != null) {
            rejectSafely(call, new TransportClosedException(id, reason));
            return;
        }
        if (calls.putIfAbsent(id, call) != null) {
            throw new DuplicateIdException(id);
        }
        try {
            call.arm(scheduler.schedule(() -> expire(call, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            if (calls.remove(id, call)) {
                LOGGER.warn("Timer scheduler rejected call {}", id, e);
                rejectSafely(call, new TransportClosedException(id, "timer scheduler unavailable"));
            }
            return;
        }
        // a settle between the insert and arm() found no timer to cancel
        if (calls.get(id) != call) {
            call.disarm();
            return;
        }
        // drain() may have taken its snapshot between the closed check and the insert
        reason = closedReason;
        if (reason != null && calls.remove(id, call)) {
            call.disarm();
            rejectSafely(call, new TransportClosedException(id, reason));
            return;
        }
        LOGGER.debug("Registered pending call {} (deadline {})", id, call.deadline());
    }

    /**
     * Register a call and expose its settlement as a future.
     */
    public CompletableFuture<JsonNode> await(RequestId id, Duration timeout) {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        register(id, future::complete, future::completeExceptionally, timeout);
        return future;
    }

    /**
     * Settle the call registered under {@code id}, if there is one.
     *
     * @return {@code true} when a pending call was found and settled; {@code false} for ids that
     * were never registered or have already been settled, timed out or drained
     */
    public boolean settle(RequestId id, Outcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (id == null) {
            return false;
        }
        PendingCall call = calls.remove(id);
        if (call == null) {
            LOGGER.debug("No pending call for id {}; late or unsolicited response ignored", id);
            return false;
        }
        call.disarm();
        if (outcome instanceof Outcome.Success success) {
            resolveSafely(call, success.result());
        } else if (outcome instanceof Outcome.Failure failure) {
            rejectSafely(call, new RemoteErrorException(id, failure.error()));
        }
        return true;
    }

    /**
     * Reject every outstanding call with {@link TransportClosedException}. Calls registered after
     * this point are rejected immediately with the same reason.
     */
    public void drain(String reason) {
        Objects.requireNonNull(reason, "reason");
        closedReason = reason;
        List<RequestId> snapshot = new ArrayList<>(calls.keySet());
        int drained = 0;
        for (RequestId id : snapshot) {
            PendingCall call = calls.remove(id);
            if (call == null) {
                continue;
            }
            call.disarm();
            rejectSafely(call, new TransportClosedException(id, reason));
            drained++;
        }
        if (drained > 0) {
            LOGGER.info("Drained {} pending call(s): {}", drained, reason);
        }
    }

    public boolean contains(RequestId id) {
        return id != null && calls.containsKey(id);
    }

    public int size() {
        return calls.size();
    }

    private void expire(PendingCall call, Duration timeout) {
        if (!calls.remove(call.id(), call)) {
            return;
        }
        LOGGER.warn("Request {} timed out after {}ms", call.id(), timeout.toMillis());
        rejectSafely(call, new RequestTimeoutException(call.id(), timeout));
    }

    private static void resolveSafely(PendingCall call, JsonNode result) {
        try {
            call.resolve(result);
        } catch (RuntimeException e) {
            LOGGER.warn("Resolve callback for call {} failed", call.id(), e);
        }
    }

    private static void rejectSafely(PendingCall call, TransportException error) {
        try {
            call.reject(error);
        } catch (RuntimeException e) {
            LOGGER.warn("Reject callback for call {} failed", call.id(), e);
        }
    }
}
