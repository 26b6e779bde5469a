package rs.lukaj.webfetch.connections;

import rs.lukaj.webfetch.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.logging.Logger;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Fetches a single resource and returns its decoded body. Network resources go through the {@link HttpCache},
 * then a {@link HttpSocket} obtained from a {@link ConnectionPool}; redirects are followed in a loop until a
 * non-redirect response arrives or {@link RedirectResolver} gives up. {@code data:} and {@code file://} resources
 * never touch the network.
 * <br/>
 * Nothing is retried: the first failure ends the fetch. A fetcher holds only configuration, so one instance can be
 * used for any number of fetches, from any number of threads.
 */
//similar role to HttpURLConnection in standard library, but without any of the request options
public class ResourceFetcher {
    private static final Logger LOGGER = Logger.getLogger(ResourceFetcher.class.getName());
    private static final int READ_BUFFER_SIZE = 8192;

    private final ConnectionPool connectionPool;
    private HttpCache cache = new AuthorityHttpCache();
    private CachingPolicy cachingPolicy = new SimpleCachingPolicy();
    private int maxRedirects = RedirectResolver.DEFAULT_MAX_REDIRECTS;
    private String userAgent = RequestHeaders.DEFAULT_USER_AGENT;

    /**
     * Create a new fetcher which uses given connection pool to obtain {@link HttpSocket}s.
     * @param connectionPool connection pool used for obtaining sockets
     */
    public ResourceFetcher(ConnectionPool connectionPool) {
        this.connectionPool = connectionPool;
    }

    /**
     * Set cache consulted before, and filled after, every network request. Null disables caching.
     * @param cache cache to use
     * @return this, to allow chaining
     */
    public ResourceFetcher useCache(HttpCache cache) {
        this.cache = cache == null ? new HttpCache.Empty() : cache;
        return this;
    }

    public ResourceFetcher useCachingPolicy(CachingPolicy policy) {
        this.cachingPolicy = policy;
        return this;
    }

    /**
     * Set maximum number of redirects which are followed. If server tries to redirect more than
     * maxRedirects times, {@link TooManyRedirectsException} is thrown.
     * @param maxRedirects maximum number of redirects followed
     * @return this, to allow chaining
     */
    public ResourceFetcher setMaxRedirects(int maxRedirects) {
        if(maxRedirects < 0) throw new InvalidConfigException("maxRedirects can't be negative!");
        this.maxRedirects = maxRedirects;
        return this;
    }

    public ResourceFetcher setUserAgent(String userAgent) {
        this.userAgent = userAgent;
        return this;
    }

    public HttpCache getCache() {
        return cache;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    /**
     * Parse the locator (falling back to the default resource if it's malformed) and fetch it.
     * @param url locator string
     * @return decoded body
     * @see #fetch(ResourceLocator)
     */
    public String fetch(String url) throws IOException {
        return fetch(ResourceLocator.parse(url));
    }

    /**
     * Fetch the resource on this thread. Blocks until the whole body has been received and decoded.
     * @param locator what to fetch
     * @return decoded body
     * @throws IOException if connecting, reading or writing fails
     * @throws ContentDecodingException if body can't be decoded
     * @throws FileReadException if a file:// resource can't be read
     * @throws TooManyRedirectsException if server redirects more than {@link #setMaxRedirects(int) allowed}
     * @throws InvalidResponseException if response doesn't look like HTTP
     */
    public String fetch(ResourceLocator locator) throws IOException {
        RedirectResolver redirects = new RedirectResolver(maxRedirects);
        ResourceLocator current = locator;
        while(true) {
            switch (current.getScheme()) {
                case DATA: return fetchData(current);
                case FILE: return fetchFile(current);
                default: break;
            }

            Authority authority = current.getAuthority();
            HttpResponse cached = cache.get(authority);
            if(cached != null) {
                LOGGER.fine("Serving " + current + " from cache");
                return cached.getBody();
            }

            HttpResponse response = exchange(current);
            if(cachingPolicy.shouldStoreInCache(response)) {
                cache.put(authority, response, cachingPolicy.getMaxAge(response));
            }
            ResourceLocator next = redirects.next(current, response);
            if(next == null) return response.getBody();
            current = next;
        }
    }

    /**
     * Sends one request and reads one response, decoding its body. Socket goes back to the pool if server asked
     * for keep-alive and the response was framed without closing the stream; otherwise it's closed.
     */
    private HttpResponse exchange(ResourceLocator target) throws IOException {
        Authority authority = target.getAuthority();
        ResponseAssembler assembler = new ResponseAssembler();
        HttpSocket socket = connectionPool.acquire(authority);
        try {
            HttpRequest.create(target).setUserAgent(userAgent).writeTo(socket);
            assembler.connected();
            boolean streamEnded = readResponse(socket, assembler);

            HttpResponse response = HttpResponse.parse(assembler.toByteArray());
            response.decodeBody();
            LOGGER.fine(target + " -> " + response.getStatus());
            connectionPool.release(authority, socket, response.getHeaders().isKeepAlive() && !streamEnded);
            return response;
        } catch (IOException | RuntimeException e) {
            assembler.fail();
            connectionPool.destroy(socket);
            throw e;
        }
    }

    /**
     * Reads from socket until the assembler is done.
     * @return true if response was ended by server closing the stream
     */
    private static boolean readResponse(HttpSocket socket, ResponseAssembler assembler) throws IOException {
        byte[] buf = new byte[READ_BUFFER_SIZE];
        boolean streamEnded = false;
        while(!assembler.getState().isTerminal()) {
            int read = socket.read(buf, 0, buf.length);
            if(read == -1) {
                streamEnded = true;
                assembler.endOfStream();
            } else if(read > 0) {
                assembler.feed(buf, 0, read);
            }
        }
        return streamEnded;
    }

    /**
     * data:[mediatype],payload - everything after the first comma is percent-decoded. No comma, no body.
     */
    private static String fetchData(ResourceLocator locator) throws ContentDecodingException {
        String spec = locator.getPath();
        int comma = spec.indexOf(',');
        if(comma == -1) return "";
        try {
            return Utils.percentDecode(spec.substring(comma + 1));
        } catch (IllegalArgumentException e) {
            throw new ContentDecodingException("Malformed data URI: " + e.getMessage(), e);
        }
    }

    private static String fetchFile(ResourceLocator locator) throws FileReadException {
        try {
            return Files.readString(Path.of(locator.getPath()), UTF_8);
        } catch (IOException | InvalidPathException e) {
            throw new FileReadException("Failed to read file: " + locator.getPath() + " (" + e + ")", e);
        }
    }
}
