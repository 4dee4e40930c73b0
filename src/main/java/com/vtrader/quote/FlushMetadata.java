package com.vtrader.quote;

import lombok.Builder;
import lombok.Getter;

/** What the most recent flush did. Exposed on the admin status endpoint. */
@Getter
@Builder
public class FlushMetadata {

    private final String mode;
    private final String batchId;

    /** {@code timer}, {@code max_union}, {@code manual}, or one of those with {@code _cache_hit}. */
    private final String reason;

    private final int uniqueInstrumentCount;
    private final int requestCount;

    /** Upstream round trip including time spent in the dispatch queue. 0 for cache hits. */
    private final long upstreamMs;

    /** Time from batch creation to flush start. */
    private final long waitMs;

    private final String timestamp;
}
