package dev.contentfarm.transport.correlation;

import dev.contentfarm.transport.RequestId;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Per-send options. Whether a request waits for a correlated reply is always stated explicitly by
 * the caller: {@link #none()} never registers anything, {@link #expectReply()} always does.
 *
 * @param expectsReply whether to park a pending call for the reply
 * @param correlationId id to wait on, or {@code null} to use the request's own id
 * @param timeout timeout override, or {@code null} for the transport default
 * @param resumptionToken optional resumption token handed to {@code onResumptionToken}
 * @param onResumptionToken callback receiving the resumption token
 */
public record SendOptions(boolean expectsReply, RequestId correlationId, Duration timeout, String resumptionToken,
    Consumer<String> onResumptionToken) {

    private static final SendOptions NONE = new SendOptions(false, null, null, null, null);

    public static SendOptions none() {
        return NONE;
    }

    public static SendOptions expectReply() {
        return new SendOptions(true, null, null, null, null);
    }

    public static SendOptions expectReply(RequestId correlationId) {
        return new SendOptions(true, Objects.requireNonNull(correlationId, "correlationId"), null, null, null);
    }

    public SendOptions withTimeout(Duration timeout) {
        return new SendOptions(expectsReply, correlationId, Objects.requireNonNull(timeout, "timeout"), resumptionToken,
            onResumptionToken);
    }

    public SendOptions withResumptionToken(String token, Consumer<String> callback) {
        return new SendOptions(expectsReply, correlationId, timeout, Objects.requireNonNull(token, "token"),
            Objects.requireNonNull(callback, "callback"));
    }
}
