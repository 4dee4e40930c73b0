package com.vtrader.quote;

import com.vtrader.domain.model.Quote;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
class CachedQuotes {

    private final Map<String, Quote> quotes;
    private final long ttlMs;
}
