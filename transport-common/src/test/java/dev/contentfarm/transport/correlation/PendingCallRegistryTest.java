package dev.contentfarm.transport.correlation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contentfarm.transport.DuplicateIdException;
import dev.contentfarm.transport.JsonRpcResponse.JsonRpcError;
import dev.contentfarm.transport.RemoteErrorException;
import dev.contentfarm.transport.RequestId;
import dev.contentfarm.transport.RequestTimeoutException;
import dev.contentfarm.transport.TransportClosedException;
import dev.contentfarm.transport.TransportException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PendingCallRegistryTest {

    private static final Duration LONG = Duration.ofSeconds(30);

    private final ObjectMapper mapper = new ObjectMapper();

    private ScheduledExecutorService scheduler;
    private PendingCallRegistry registry;

    @BeforeEach
    void setUp() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1);
        executor.setRemoveOnCancelPolicy(true);
        scheduler = executor;
        registry = new PendingCallRegistry(scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void timesOutWhenNoResponseArrives() throws Exception {
        CompletableFuture<JsonNode> future = registry.await(RequestId.of("r1"), Duration.ofMillis(50));

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        RequestTimeoutException timeout = assertInstanceOf(RequestTimeoutException.class, error.getCause());
        assertEquals(RequestId.of("r1"), timeout.id());
        assertEquals(50, timeout.timeout().toMillis());
        assertFalse(registry.contains(RequestId.of("r1")));
        assertEquals(0, registry.size());
    }

    @Test
    void settlesMatchingCallWithResult() throws Exception {
        CompletableFuture<JsonNode> future = registry.await(RequestId.of(7), LONG);
        ObjectNode result = mapper.createObjectNode().put("ok", true);

        assertTrue(registry.settle(RequestId.of(7), Outcome.success(result)));

        assertEquals(result, future.get(1, TimeUnit.SECONDS));
        assertEquals(0, registry.size());
    }

    @Test
    void drainRejectsEveryOutstandingCall() {
        CompletableFuture<JsonNode> a = registry.await(RequestId.of("a"), LONG);
        CompletableFuture<JsonNode> b = registry.await(RequestId.of("b"), LONG);

        registry.drain("shutdown");

        for (CompletableFuture<JsonNode> future : List.of(a, b)) {
            ExecutionException error = assertThrows(ExecutionException.class, future::get);
            TransportClosedException closed = assertInstanceOf(TransportClosedException.class, error.getCause());
            assertEquals("shutdown", closed.reason());
        }
        assertFalse(registry.settle(RequestId.of("a"), Outcome.success(null)));
        assertEquals(0, registry.size());
    }

    @Test
    void rejectsDuplicateIdAndKeepsOriginalCall() throws Exception {
        CompletableFuture<JsonNode> first = registry.await(RequestId.of("dup"), LONG);

        assertThrows(DuplicateIdException.class, () -> registry.await(RequestId.of("dup"), LONG));

        assertTrue(registry.settle(RequestId.of("dup"), Outcome.success(mapper.createObjectNode())));
        assertTrue(first.get(1, TimeUnit.SECONDS).isObject());
    }

    @Test
    void stringAndNumericIdsAreDistinct() {
        registry.await(RequestId.of("7"), LONG);

        assertFalse(registry.settle(RequestId.of(7), Outcome.success(null)));
        assertTrue(registry.contains(RequestId.of("7")));
    }

    @Test
    void unknownIdIsIgnored() {
        assertFalse(registry.settle(RequestId.of("nope"), Outcome.success(null)));
        assertFalse(registry.settle(null, Outcome.success(null)));
    }

    @Test
    void failureOutcomeRejectsWithRemoteError() {
        CompletableFuture<JsonNode> future = registry.await(RequestId.of(1), LONG);

        registry.settle(RequestId.of(1), Outcome.failure(JsonRpcError.of(-32000, "boom")));

        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        RemoteErrorException remote = assertInstanceOf(RemoteErrorException.class, error.getCause());
        assertEquals(-32000, remote.error().code());
        assertEquals("boom", remote.getMessage());
    }

    @Test
    void nullResultSettlesAsJsonNull() throws Exception {
        CompletableFuture<JsonNode> future = registry.await(RequestId.of(2), LONG);

        registry.settle(RequestId.of(2), Outcome.success(null));

        assertTrue(future.get().isNull());
    }

    @Test
    void lateSettleAfterTimeoutHasNoEffect() throws Exception {
        AtomicInteger outcomes = new AtomicInteger();
        CountDownLatch rejected = new CountDownLatch(1);
        registry.register(RequestId.of("late"), result -> outcomes.incrementAndGet(), error -> {
            outcomes.incrementAndGet();
            rejected.countDown();
        }, Duration.ofMillis(20));

        assertTrue(rejected.await(2, TimeUnit.SECONDS));
        assertFalse(registry.settle(RequestId.of("late"), Outcome.success(null)));
        assertEquals(1, outcomes.get());
    }

    @Test
    void settledCallNeverTimesOut() throws Exception {
        List<Object> outcomes = new CopyOnWriteArrayList<>();
        registry.register(RequestId.of("fast"), outcomes::add, outcomes::add, Duration.ofMillis(30));

        assertTrue(registry.settle(RequestId.of("fast"), Outcome.success(mapper.createObjectNode())));
        Thread.sleep(100);

        assertEquals(1, outcomes.size());
        assertInstanceOf(JsonNode.class, outcomes.get(0));
    }

    @Test
    void callbackMayRegisterTheSameIdAgain() throws Exception {
        CompletableFuture<JsonNode> second = new CompletableFuture<>();
        registry.register(RequestId.of("again"),
            result -> registry.register(RequestId.of("again"), second::complete, second::completeExceptionally, LONG),
            error -> { },
            LONG);

        assertTrue(registry.settle(RequestId.of("again"), Outcome.success(null)));
        assertTrue(registry.contains(RequestId.of("again")));

        registry.settle(RequestId.of("again"), Outcome.success(mapper.createObjectNode().put("n", 2)));
        assertEquals(2, second.get(1, TimeUnit.SECONDS).get("n").asInt());
    }

    @Test
    void registerAfterDrainIsRejectedImmediately() {
        registry.drain("gone");
        List<TransportException> errors = new CopyOnWriteArrayList<>();

        registry.register(RequestId.of("x"), result -> { }, errors::add, LONG);

        assertEquals(1, errors.size());
        assertInstanceOf(TransportClosedException.class, errors.get(0));
        assertEquals(0, registry.size());
    }

    @Test
    void throwingCallbackDoesNotBreakDrain() {
        registry.register(RequestId.of("bad"), result -> { }, error -> {
            throw new IllegalStateException("callback failure");
        }, LONG);
        CompletableFuture<JsonNode> good = registry.await(RequestId.of("good"), LONG);

        registry.drain("stop");

        assertTrue(good.isCompletedExceptionally());
        assertEquals(0, registry.size());
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> registry.await(RequestId.of(1), Duration.ZERO));
    }

    @Test
    void settleBeforeTimerIsArmedLeavesNoTimerQueued() {
        RequestId id = RequestId.of("racy");
        AtomicReference<PendingCallRegistry> racy = new AtomicReference<>();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1) {
            @Override
            public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
                // the response lands after the call is visible but before its timer exists
                racy.get().settle(id, Outcome.success(mapper.createObjectNode()));
                return super.schedule(command, delay, unit);
            }
        };
        executor.setRemoveOnCancelPolicy(true);
        try {
            racy.set(new PendingCallRegistry(executor));
            AtomicInteger resolved = new AtomicInteger();

            racy.get().register(id, result -> resolved.incrementAndGet(),
                error -> fail("unexpected rejection: " + error), LONG);

            assertEquals(1, resolved.get());
            assertEquals(0, racy.get().size());
            assertTrue(executor.getQueue().isEmpty());
        } finally {
            executor.shutdownNow();
        }
    }
}
