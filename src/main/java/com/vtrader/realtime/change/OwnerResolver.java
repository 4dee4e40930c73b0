package com.vtrader.realtime.change;

import com.vtrader.repository.jpa.TradingAccountJpaRepository;
import com.vtrader.repository.jpa.WatchlistJpaRepository;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds the user that owns a trading account or a watchlist.
 *
 * <p>Owners are cached for the lifetime of the process. The caches only save lookups: a
 * miss always goes to the database, and only found owners are cached. A failed lookup is
 * logged and reported as unknown.
 */
@Component
public class OwnerResolver {

    private static final Logger log = LoggerFactory.getLogger(OwnerResolver.class);

    private final Map<String, String> accountOwners = new ConcurrentHashMap<>();
    private final Map<String, String> watchlistOwners = new ConcurrentHashMap<>();

    private final TradingAccountJpaRepository tradingAccountJpaRepository;
    private final WatchlistJpaRepository watchlistJpaRepository;

    public OwnerResolver(
            TradingAccountJpaRepository tradingAccountJpaRepository, WatchlistJpaRepository watchlistJpaRepository) {
        this.tradingAccountJpaRepository = tradingAccountJpaRepository;
        this.watchlistJpaRepository = watchlistJpaRepository;
    }

    public Optional<String> ownerOfTradingAccount(String tradingAccountId) {
        return resolve("tradingAccount", tradingAccountId, accountOwners, tradingAccountJpaRepository::findUserIdById);
    }

    public Optional<String> ownerOfWatchlist(String watchlistId) {
        return resolve("watchlist", watchlistId, watchlistOwners, watchlistJpaRepository::findUserIdById);
    }

    /** Caches an owner seen on a direct write, sparing the lookup for the next indirect one. */
    public void rememberTradingAccount(String tradingAccountId, String userId) {
        remember(accountOwners, tradingAccountId, userId);
    }

    public void rememberWatchlist(String watchlistId, String userId) {
        remember(watchlistOwners, watchlistId, userId);
    }

    public int cachedOwnerCount() {
        return accountOwners.size() + watchlistOwners.size();
    }

    public void clear() {
        accountOwners.clear();
        watchlistOwners.clear();
    }

    private Optional<String> resolve(
            String kind, String id, Map<String, String> cache, Function<String, Optional<String>> lookup) {
        if (id == null) {
            return Optional.empty();
        }
        String cached = cache.get(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            Optional<String> owner = lookup.apply(id);
            owner.ifPresent(userId -> cache.put(id, userId));
            if (owner.isEmpty()) {
                log.debug("No owner found: {}Id={}", kind, id);
            }
            return owner;
        } catch (RuntimeException e) {
            log.error("Owner lookup failed: {}Id={}, error={}", kind, id, e.getMessage());
            return Optional.empty();
        }
    }

    private static void remember(Map<String, String> cache, String id, String userId) {
        if (id != null && userId != null) {
            cache.put(id, userId);
        }
    }
}
