package rs.lukaj.webfetch.connections;

import java.time.Duration;

/**
 * Common interface for implementing cache used by {@link ResourceFetcher}. Responses are keyed by
 * {@link Authority}, not by path: every resource on one host shares the same slot.
 */
public interface HttpCache {
    /**
     * Get a fresh response cached for the authority. Stale responses are never returned.
     * @param authority authority of the request
     * @return cached response, or null if there's no fresh one
     */
    HttpResponse get(Authority authority);

    /**
     * Store the response, replacing whatever was cached for this authority.
     * @param authority authority of the request
     * @param response response with decoded body
     * @param maxAge how long the response stays fresh, or null for as long as it's cached
     */
    void put(Authority authority, HttpResponse response, Duration maxAge);

    /**
     * @param authority authority to look for
     * @return whether a fresh response is cached for this authority
     */
    boolean exists(Authority authority);

    /**
     * Removes the response cached for the authority, if any.
     * @param authority authority to remove
     */
    void evict(Authority authority);

    /**
     * @return number of entries currently held, fresh or not
     */
    int size();


    /**
     * An empty cache. It doesn't store anything, {@link #get(Authority)} always returns null and
     * {@link #exists(Authority)} always returns false.
     */
    class Empty implements HttpCache {

        @Override
        public HttpResponse get(Authority authority) {
            return null;
        }

        @Override
        public void put(Authority authority, HttpResponse response, Duration maxAge) {
        }

        @Override
        public boolean exists(Authority authority) {
            return false;
        }

        @Override
        public void evict(Authority authority) {
        }

        @Override
        public int size() {
            return 0;
        }
    }
}
