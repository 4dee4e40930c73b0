package com.vtrader.dispatch;

import java.util.concurrent.CompletionStage;

/**
 * A deferred unit of upstream work. Nothing is sent until the dispatch queue invokes
 * {@link #execute()}; an exception thrown here counts as a failed call.
 */
@FunctionalInterface
public interface UpstreamCall<T> {

    CompletionStage<T> execute() throws Exception;
}
