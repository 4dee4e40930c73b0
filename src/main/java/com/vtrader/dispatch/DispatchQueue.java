package com.vtrader.dispatch;

import com.vtrader.config.DispatchQueueConfig;
import com.vtrader.exception.QueueClearedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Process-wide gate in front of every outbound Vortex call.
 *
 * <p>Callers hand in a deferred {@link UpstreamCall} and get a future for its result.
 * A single drain loop dispatches pending work one at a time:
 * <ol>
 *   <li>Highest priority first, FIFO within the same priority (sequence number).</li>
 *   <li>Never more than {@code maxRequestsPerMinute} dispatches inside any rolling
 *       {@code windowMs}; the loop sleeps until the oldest dispatch ages out.</li>
 *   <li>Consecutive dispatches are at least {@code minIntervalMs} apart.</li>
 * </ol>
 *
 * <p>Each call is awaited before the next one starts. Failures are delivered to the
 * owning caller only; the loop keeps going. The dispatch timestamp is recorded when the
 * call starts, whatever its outcome, because the upstream counts attempts, not successes.
 *
 * <p>Nothing here retries: a 429 or any other failure goes straight back to the caller.
 */
@Component
public class DispatchQueue {

    private static final Logger log = LoggerFactory.getLogger(DispatchQueue.class);

    private static final int INITIAL_CAPACITY = 64;

    private static final Comparator<QueuedRequest<?>> DISPATCH_ORDER = (a, b) -> {
        int byPriority = Integer.compare(b.getPriority(), a.getPriority());
        return byPriority != 0 ? byPriority : Long.compare(a.getSequenceNumber(), b.getSequenceNumber());
    };

    private final DispatchQueueConfig config;
    private final Executor drainExecutor;
    private final Clock clock;
    private final Sleeper sleeper;

    /** Monotonically increasing counter for FIFO ordering within the same priority. */
    private final AtomicLong sequenceCounter = new AtomicLong(0);

    private final AtomicLong totalDispatched = new AtomicLong(0);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final PriorityBlockingQueue<QueuedRequest<?>> queue =
            new PriorityBlockingQueue<>(INITIAL_CAPACITY, DISPATCH_ORDER);
    private final RateWindow rateWindow = new RateWindow();

    private final Counter succeededCounter;
    private final Counter failedCounter;
    private final Counter rateLimitWaitCounter;

    public DispatchQueue(
            DispatchQueueConfig config,
            @Qualifier("dispatchExecutor") Executor drainExecutor,
            Clock clock,
            Sleeper sleeper,
            MeterRegistry meterRegistry) {
        this.config = config;
        this.drainExecutor = drainExecutor;
        this.clock = clock;
        this.sleeper = sleeper;

        Gauge.builder("dispatch.queue.length", queue, PriorityBlockingQueue::size)
                .description("Upstream calls waiting for rate budget")
                .register(meterRegistry);
        this.succeededCounter = Counter.builder("dispatch.requests")
                .tag("outcome", "success")
                .description("Upstream calls dispatched")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("dispatch.requests")
                .tag("outcome", "failure")
                .description("Upstream calls dispatched")
                .register(meterRegistry);
        this.rateLimitWaitCounter = Counter.builder("dispatch.rate.limit.waits")
                .description("Times the drain loop paused because the rolling window was full")
                .register(meterRegistry);
    }

    /**
     * Queues upstream work and returns a future settled with its outcome.
     *
     * <p>The future completes on the drain thread. Dependents that block, or that fan the
     * result out to other callers, should use an async stage with their own executor.
     *
     * @param call      deferred work; not invoked until dispatch
     * @param priority  higher dispatches first, see {@link DispatchPriority}
     * @param requestId optional correlation id for logs; generated when null
     */
    public <T> CompletableFuture<T> enqueue(UpstreamCall<T> call, int priority, String requestId) {
        String id = requestId != null ? requestId : "req-" + UUID.randomUUID();
        QueuedRequest<T> request =
                new QueuedRequest<>(id, priority, sequenceCounter.incrementAndGet(), clock.millis(), call);

        queue.put(request);
        log.debug("Upstream call enqueued: requestId={}, priority={}, queueSize={}", id, priority, queue.size());

        scheduleDrain();
        return request.getResult();
    }

    public <T> CompletableFuture<T> enqueue(UpstreamCall<T> call, int priority) {
        return enqueue(call, priority, null);
    }

    /** Rejects every pending entry with {@link QueueClearedException}. In-flight work is untouched. */
    public int clear() {
        List<QueuedRequest<?>> pending = new ArrayList<>();
        queue.drainTo(pending);
        for (QueuedRequest<?> request : pending) {
            request.reject(new QueueClearedException(request.getId()));
        }
        if (!pending.isEmpty()) {
            log.warn("Dispatch queue cleared: {} pending requests rejected", pending.size());
        }
        return pending.size();
    }

    public DispatchQueueStatus status() {
        long now = clock.millis();
        boolean dispatched = rateWindow.hasDispatched();
        long last = rateWindow.getLastDispatchAt();
        return DispatchQueueStatus.builder()
                .queueLength(queue.size())
                .draining(draining.get())
                .totalDispatched(totalDispatched.get())
                .requestsInWindow(rateWindow.countAfter(now - config.getWindowMs()))
                .lastDispatchAt(dispatched ? last : null)
                .millisSinceLastDispatch(dispatched ? now - last : null)
                .maxRequestsPerMinute(config.getMaxRequestsPerMinute())
                .minIntervalMs(config.getMinIntervalMs())
                .build();
    }

    public int size() {
        return queue.size();
    }

    private void scheduleDrain() {
        if (queue.isEmpty() || !draining.compareAndSet(false, true)) {
            return;
        }
        try {
            drainExecutor.execute(this::drainLoop);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("Dispatch drain loop could not be started, {} requests stay queued", queue.size(), e);
        }
    }

    private void drainLoop() {
        try {
            while (!queue.isEmpty()) {
                awaitRateBudget();
                QueuedRequest<?> next = queue.poll();
                if (next == null) {
                    break;
                }
                dispatch(next);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dispatch drain loop interrupted, {} requests stay queued", queue.size());
            return;
        } finally {
            draining.set(false);
        }
        // An enqueue that raced with the flag release would otherwise find draining=true and wait forever.
        scheduleDrain();
    }

    /** Blocks until both the rolling window and the minimum spacing allow one more dispatch. */
    private void awaitRateBudget() throws InterruptedException {
        long windowMs = config.getWindowMs();
        long now = clock.millis();
        rateWindow.prune(now, windowMs);

        while (rateWindow.size() >= Math.max(1, config.getMaxRequestsPerMinute())) {
            long waitMs = rateWindow.oldest() + windowMs - now;
            rateLimitWaitCounter.increment();
            log.warn(
                    "Rate limit reached, waiting: inWindow={}, max={}, waitMs={}, queued={}",
                    rateWindow.size(),
                    config.getMaxRequestsPerMinute(),
                    waitMs,
                    queue.size());
            if (waitMs > 0) {
                sleeper.sleep(Duration.ofMillis(waitMs));
            }
            now = clock.millis();
            rateWindow.prune(now, windowMs);
        }

        if (rateWindow.hasDispatched()) {
            long sinceLast = now - rateWindow.getLastDispatchAt();
            long minIntervalMs = config.getMinIntervalMs();
            if (sinceLast < minIntervalMs) {
                sleeper.sleep(Duration.ofMillis(minIntervalMs - sinceLast));
            }
        }
    }

    private void dispatch(QueuedRequest<?> request) {
        long dispatchedAt = clock.millis();
        rateWindow.record(dispatchedAt);
        totalDispatched.incrementAndGet();

        log.debug(
                "Dispatching upstream call: requestId={}, priority={}, queueLatency={}ms, inWindow={}",
                request.getId(),
                request.getPriority(),
                dispatchedAt - request.getEnqueuedAt(),
                rateWindow.size());

        try {
            request.run().join();
            succeededCounter.increment();
            log.debug(
                    "Upstream call completed: requestId={}, duration={}ms",
                    request.getId(),
                    clock.millis() - dispatchedAt);
        } catch (CompletionException | CancellationException e) {
            failedCounter.increment();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error(
                    "Upstream call failed: requestId={}, duration={}ms, error={}",
                    request.getId(),
                    clock.millis() - dispatchedAt,
                    cause.getMessage());
        }
    }
}
