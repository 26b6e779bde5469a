package rs.lukaj.webfetch.client;

import rs.lukaj.webfetch.connections.*;

import java.io.Closeable;
import java.io.IOException;

/**
 * Top-level class for fetching resources. Used to create {@link ResourceFetcher}s which share one
 * {@link ConnectionPool} and one {@link HttpCache} per client, which can be adjusted on the fly.
 * <br/>
 * Example with default values:
 * <br/>
 * <pre>
 *     String body = FetchClient.create().load("https://example.com/");
 * </pre>
 * <br/>
 * More customized example:
 * <br/>
 * <pre>
 *     FetchClient client = FetchClient.create()
 *                                     .withPool(new SingleSlotConnectionPool.Config(Duration.ofSeconds(5), Duration.ofSeconds(30)))
 *                                     .withMaxRedirects(3);
 *     ResourceFetcher fetcher = client.newFetcher();
 *     String body = fetcher.fetch("http://example.com/a");
 * </pre>
 */
public class FetchClient implements Closeable {
    private ConnectionPool connectionPool = new SingleSlotConnectionPool();
    private HttpCache      cache          = new AuthorityHttpCache();
    private CachingPolicy  cachingPolicy  = new SimpleCachingPolicy();
    private int            maxRedirects   = RedirectResolver.DEFAULT_MAX_REDIRECTS;
    private String         userAgent      = RequestHeaders.DEFAULT_USER_AGENT;

    private FetchClient() {
    }

    /**
     * Create a {@link FetchClient} with default parameters.
     * @return a new {@link FetchClient} instance
     */
    public static FetchClient create() {
        return new FetchClient();
    }

    /**
     * Set {@link ConnectionPool} used for obtaining {@link HttpSocket}s. All new fetchers will use sockets from that
     * pool, but any ongoing fetch will continue using the old pool. Close the old pool yourself if it's no longer
     * needed.
     * @param connectionPool new pool to be used with this client
     * @return this instance, to allow chaining
     */
    public FetchClient withPool(ConnectionPool connectionPool) {
        this.connectionPool = connectionPool;
        return this;
    }

    /**
     * Create a new {@link SingleSlotConnectionPool} for any new fetchers.
     * @param config configuration parameters for the new pool
     * @return this instance, to allow chaining
     * @see #withPool(ConnectionPool)
     */
    public FetchClient withPool(SingleSlotConnectionPool.Config config) {
        this.connectionPool = new SingleSlotConnectionPool(config);
        return this;
    }

    /**
     * Set {@link HttpCache} to be used by fetchers of this client, according to the {@link CachingPolicy}. Null
     * disables caching.
     * @param cache cache to use for caching responses
     * @return this instance, to allow chaining
     */
    public FetchClient withCache(HttpCache cache) {
        this.cache = cache == null ? new HttpCache.Empty() : cache;
        return this;
    }

    /**
     * Set {@link CachingPolicy} describing which responses are cached and for how long.
     * @param policy caching policy to use for this client
     * @return this instance, to allow chaining
     */
    public FetchClient withCachingPolicy(CachingPolicy policy) {
        this.cachingPolicy = policy;
        return this;
    }

    /**
     * @param maxRedirects how many redirects a single fetch may follow
     * @return this instance, to allow chaining
     */
    public FetchClient withMaxRedirects(int maxRedirects) {
        if(maxRedirects < 0) throw new InvalidConfigException("maxRedirects can't be negative!");
        this.maxRedirects = maxRedirects;
        return this;
    }

    public FetchClient withUserAgent(String userAgent) {
        this.userAgent = userAgent;
        return this;
    }

    /**
     * Get {@link ConnectionPool} used by this client.
     * @return connection pool associated with this client
     */
    public ConnectionPool getConnectionPool() {
        return connectionPool;
    }

    /**
     * Get {@link HttpCache} used by this client.
     * @return cache associated with this client
     */
    public HttpCache getCache() {
        return cache;
    }

    /**
     * Create a new fetcher with parameters of this client. This step does not open any connection.
     * @return new {@link ResourceFetcher} instance
     */
    public ResourceFetcher newFetcher() {
        return new ResourceFetcher(connectionPool)
                .useCache(cache)
                .useCachingPolicy(cachingPolicy)
                .setMaxRedirects(maxRedirects)
                .setUserAgent(userAgent);
    }

    /**
     * Fetch the resource on this thread using a new fetcher.
     * @param url locator string
     * @return decoded body
     * @throws IOException if fetching fails
     * @see ResourceFetcher#fetch(String)
     */
    public String load(String url) throws IOException {
        return newFetcher().fetch(url);
    }

    /**
     * Closes idle pooled connections.
     */
    @Override
    public void close() throws IOException {
        connectionPool.close();
    }
}
