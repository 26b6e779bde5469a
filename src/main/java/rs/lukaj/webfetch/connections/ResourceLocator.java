package rs.lukaj.webfetch.connections;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Parsed form of a locator string: scheme, host, port and path. Immutable. Created once per fetch, using
 * {@link #parse(String)}, which never fails: anything it can't make sense of becomes the {@link #fallback()}
 * resource.
 * <br/>
 * For {@code data:} locators path holds everything after the scheme (media type, comma and payload), and
 * {@code view-source:} locators take over scheme, host, port and path of the locator they wrap.
 */
public class ResourceLocator {
    private static final Logger LOGGER = Logger.getLogger(ResourceLocator.class.getName());

    public static final String DEFAULT_HOST = "browser.engineering";
    private static final String VIEW_SOURCE_PREFIX = "view-source:";
    private static final String DATA_PREFIX = "data:";

    /**
     * Schemes known to the parser.
     */
    public enum Scheme {
        HTTP("http", 80),
        HTTPS("https", 443),
        FILE("file", -1),
        DATA("data", -1),
        VIEW_SOURCE("view-source", -1);

        private final String text;
        private final int defaultPort;

        Scheme(String text, int defaultPort) {
            this.text = text;
            this.defaultPort = defaultPort;
        }

        /**
         * @return port used if locator doesn't specify one, or -1 if scheme doesn't use network
         */
        public int getDefaultPort() {
            return defaultPort;
        }

        /**
         * @return true for schemes which are fetched over a socket
         */
        public boolean isNetwork() {
            return this == HTTP || this == HTTPS;
        }

        /**
         * Find scheme by its textual name (as it appears before "://").
         * @param text scheme name, case-sensitive
         * @return matching scheme
         * @throws InvalidLocatorException if no scheme has the given name
         */
        public static Scheme fromText(String text) {
            for(Scheme s : values()) {
                if(s.text.equals(text)) return s;
            }
            throw new InvalidLocatorException("Invalid URL scheme: " + text);
        }

        @Override
        public String toString() {
            return text;
        }
    }

    private final Scheme scheme;
    private final String host;
    private final int port;
    private final String path;
    private final boolean viewSource;

    private ResourceLocator(Scheme scheme, String host, int port, String path, boolean viewSource) {
        this.scheme = scheme;
        this.host = host;
        this.port = port;
        this.path = path;
        this.viewSource = viewSource;
    }

    /**
     * The resource used in place of every locator which fails to parse: {@code https://browser.engineering/}
     * @return fallback locator
     */
    public static ResourceLocator fallback() {
        return new ResourceLocator(Scheme.HTTPS, DEFAULT_HOST, Scheme.HTTPS.defaultPort, "/", false);
    }

    /**
     * Parse a locator string. Malformed input and unknown schemes are logged and replaced with
     * {@link #fallback()}, so this method always returns a usable locator.
     * @param url locator string, e.g. {@code https://example.com:8443/a/b} or {@code data:text/plain,hi}
     * @return parsed locator
     */
    public static ResourceLocator parse(String url) {
        try {
            return parseStrict(url);
        } catch (RuntimeException e) {
            LOGGER.warning("Malformed URL found, falling back to default. URL was: " + url + " (" + e.getMessage() + ")");
            return fallback();
        }
    }

    /**
     * Parse a locator string, throwing on malformed input.
     * @param url locator string
     * @return parsed locator
     * @throws InvalidLocatorException if scheme is unknown or locator is malformed
     */
    static ResourceLocator parseStrict(String url) {
        if(url == null) throw new InvalidLocatorException("URL is null");
        if(url.startsWith(DATA_PREFIX)) {
            return new ResourceLocator(Scheme.DATA, "", -1, url.substring(DATA_PREFIX.length()), false);
        }
        if(url.startsWith(VIEW_SOURCE_PREFIX)) {
            ResourceLocator inner = parseStrict(url.substring(VIEW_SOURCE_PREFIX.length()));
            return new ResourceLocator(inner.scheme, inner.host, inner.port, inner.path, true);
        }

        String[] tokens = url.split("://", 2);
        if(tokens.length < 2) throw new InvalidLocatorException("Missing '://' in " + url);
        Scheme scheme = Scheme.fromText(tokens[0]);
        String remaining = tokens[1];

        switch (scheme) {
            case FILE:
                return new ResourceLocator(scheme, "", -1, remaining, false);
            case HTTP:
            case HTTPS:
                return parseNetworkLocator(scheme, remaining);
            default: //data: and view-source: are prefixes, "data://" or "view-source://" makes no sense
                throw new InvalidLocatorException("Scheme " + scheme + " can't be followed by '://'");
        }
    }

    private static ResourceLocator parseNetworkLocator(Scheme scheme, String remaining) {
        if(!remaining.contains("/")) remaining = remaining + "/"; //bare host always gets the root path
        int slash = remaining.indexOf('/');
        String host = remaining.substring(0, slash);
        String path = remaining.substring(slash);
        int port = scheme.defaultPort;

        int colon = host.indexOf(':');
        if(colon != -1) {
            String portStr = host.substring(colon + 1);
            host = host.substring(0, colon);
            try {
                port = Integer.parseInt(portStr);
            } catch (NumberFormatException e) {
                throw new InvalidLocatorException("Invalid port: " + portStr, e);
            }
            if(port < 0 || port > 65535) throw new InvalidLocatorException("Port out of range: " + port);
        }
        if(host.isEmpty()) throw new InvalidLocatorException("Empty host");
        return new ResourceLocator(scheme, host, port, path, false);
    }

    /**
     * Builds the locator a redirect points to: same scheme, host and port, new path. Explicit ports are
     * written out, default ones aren't.
     * @param path new path, should start with '/'
     * @return locator string
     */
    public String withPath(String path) {
        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if(port != scheme.defaultPort) sb.append(':').append(port);
        return sb.append(path).toString();
    }

    /**
     * @return authority of this locator, used to look up connections and cached responses
     */
    public Authority getAuthority() {
        return new Authority(scheme, host, port);
    }

    public Scheme getScheme() {
        return scheme;
    }
    public String getHost() {
        return host;
    }
    public int getPort() {
        return port;
    }
    public String getPath() {
        return path;
    }
    public boolean isViewSource() {
        return viewSource;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceLocator other = (ResourceLocator) o;
        return port == other.port && viewSource == other.viewSource && scheme == other.scheme
                && host.equals(other.host) && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, host, port, path, viewSource);
    }

    @Override
    public String toString() {
        String base;
        switch (scheme) {
            case DATA: base = DATA_PREFIX + path; break;
            case FILE: base = scheme + "://" + path; break;
            default: base = withPath(path);
        }
        return viewSource ? VIEW_SOURCE_PREFIX + base : base;
    }
}
