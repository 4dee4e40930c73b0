package com.vtrader.broker;

import com.vtrader.dispatch.DispatchPriority;
import com.vtrader.dispatch.DispatchQueue;
import com.vtrader.domain.model.OrderSubmission;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Submits orders to Vortex through the shared {@link DispatchQueue}.
 *
 * <p>Orders share the upstream rate budget with market data but are queued at
 * {@link DispatchPriority#ORDERS}, so a pending order always goes out before pending
 * quote fetches.
 */
@Service
public class VortexOrderService {

    private static final Logger log = LoggerFactory.getLogger(VortexOrderService.class);

    private final DispatchQueue dispatchQueue;
    private final UpstreamClient upstreamClient;

    public VortexOrderService(DispatchQueue dispatchQueue, UpstreamClient upstreamClient) {
        this.dispatchQueue = dispatchQueue;
        this.upstreamClient = upstreamClient;
    }

    /** Returns a future with the broker order id. Failures are not retried. */
    public CompletableFuture<String> submitOrder(OrderSubmission submission) {
        String requestId = "order-" + submission.getToken() + "-" + System.nanoTime();
        log.info(
                "Order queued for submission: requestId={}, token={}, side={}, qty={}",
                requestId,
                submission.getToken(),
                submission.getSide(),
                submission.getQuantity());
        return dispatchQueue.enqueue(
                () -> CompletableFuture.completedFuture(upstreamClient.submitOrder(submission)),
                DispatchPriority.ORDERS,
                requestId);
    }
}
