package rs.lukaj.webfetch.connections;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * In-memory cache holding one response per authority. Entries are immutable and replaced wholesale.
 * <br/>
 * Stale entries are dropped when they're looked up, and every {@link #put} sweeps the rest, so an authority
 * that's never fetched again doesn't keep its stale response forever. Entries without max-age never go stale.
 */
public class AuthorityHttpCache implements HttpCache {
    private static final Logger LOGGER = Logger.getLogger(AuthorityHttpCache.class.getName());

    private final Map<Authority, Entry> cache = new ConcurrentHashMap<>();
    private final Clock clock;

    public AuthorityHttpCache() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock clock used for timestamps and freshness checks
     */
    public AuthorityHttpCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public HttpResponse get(Authority authority) {
        Entry entry = cache.get(authority);
        if(entry == null) return null;
        if(!entry.isFresh(clock.instant())) {
            cache.remove(authority, entry);
            LOGGER.fine("Dropped stale response for " + authority);
            return null;
        }
        return entry.response;
    }

    @Override
    public void put(Authority authority, HttpResponse response, Duration maxAge) {
        evictStale();
        cache.put(authority, new Entry(response, clock.instant(), maxAge));
        LOGGER.fine("Cached response for " + authority + (maxAge == null ? "" : " for " + maxAge.getSeconds() + "s"));
    }

    @Override
    public boolean exists(Authority authority) {
        return get(authority) != null;
    }

    @Override
    public void evict(Authority authority) {
        cache.remove(authority);
    }

    @Override
    public int size() {
        return cache.size();
    }

    /**
     * Removes every entry which is no longer fresh.
     */
    public void evictStale() {
        Instant now = clock.instant();
        cache.values().removeIf(e -> !e.isFresh(now));
    }

    /**
     * @param authority authority to look for
     * @return entry cached for the authority, fresh or not, or null
     */
    Entry getEntry(Authority authority) {
        return cache.get(authority);
    }

    /**
     * Cached response, the moment it was stored and, optionally, for how long it stays fresh.
     */
    static class Entry {
        final HttpResponse response;
        final Instant timestamp;
        final Duration maxAge;

        Entry(HttpResponse response, Instant timestamp, Duration maxAge) {
            this.response = response;
            this.timestamp = timestamp;
            this.maxAge = maxAge;
        }

        boolean isFresh(Instant now) {
            if(maxAge == null) return true;
            return Duration.between(timestamp, now).compareTo(maxAge) < 0;
        }
    }
}
