package com.vtrader.dispatch;

import com.vtrader.exception.QueueClearedException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import lombok.Getter;

/**
 * One pending entry in the {@link DispatchQueue}.
 *
 * <p>The result future is handed to the caller at enqueue time and settled exactly once:
 * with the upstream outcome after dispatch, or with {@link QueueClearedException} when the
 * queue is cleared first.
 */
@Getter
class QueuedRequest<T> {

    private final String id;
    private final int priority;
    private final long sequenceNumber;
    private final long enqueuedAt;
    private final UpstreamCall<T> call;
    private final CompletableFuture<T> result = new CompletableFuture<>();

    QueuedRequest(String id, int priority, long sequenceNumber, long enqueuedAt, UpstreamCall<T> call) {
        this.id = id;
        this.priority = priority;
        this.sequenceNumber = sequenceNumber;
        this.enqueuedAt = enqueuedAt;
        this.call = call;
    }

    /**
     * Starts the upstream call and links its outcome to {@link #getResult()}.
     * Never throws; a synchronous failure settles the result exceptionally.
     */
    CompletableFuture<T> run() {
        CompletionStage<T> stage;
        try {
            stage = call.execute();
        } catch (Exception e) {
            result.completeExceptionally(e);
            return result;
        }
        if (stage == null) {
            result.completeExceptionally(new IllegalStateException("Upstream call returned no result: " + id));
            return result;
        }
        stage.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    void reject(Throwable cause) {
        result.completeExceptionally(cause);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
