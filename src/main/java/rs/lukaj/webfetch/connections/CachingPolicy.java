package rs.lukaj.webfetch.connections;

import java.time.Duration;

/**
 * Defines a caching policy for responses. Methods provided in this interface are used by the fetcher to figure
 * out whether a response should be stored in cache and for how long it stays fresh.
 */
public interface CachingPolicy {
    /**
     * Should the response be stored in cache.
     * @param response response got from the server
     * @return whether response should be in cache
     */
    boolean shouldStoreInCache(HttpResponse response);

    /**
     * How long the response may be served from cache.
     * @param response response got from the server
     * @return freshness lifetime, or null if the response stays fresh for as long as it's cached
     */
    Duration getMaxAge(HttpResponse response);
}
