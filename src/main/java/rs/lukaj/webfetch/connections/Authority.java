package rs.lukaj.webfetch.connections;

import java.util.Objects;

/**
 * Endpoint to which connections are made, and the key under which responses are cached. Consists of scheme,
 * host and port, and is written as {@code scheme://host:port}.
 */
public class Authority {
    private final ResourceLocator.Scheme scheme;
    private final String host;
    private final int port;

    /**
     * Create a new authority
     * @param scheme scheme of the locator (http or https if anything is going to connect to it)
     * @param host hostname of the server, empty for file and data locators
     * @param port port on which to connect (e.g. 80 for HTTP, 443 for HTTPS)
     */
    public Authority(ResourceLocator.Scheme scheme, String host, int port) {
        if(scheme == null) throw new NullPointerException("Scheme can't be null!");
        if(host == null) throw new NullPointerException("Host can't be null!");
        this.scheme = scheme;
        this.host = host;
        this.port = port;
    }

    public ResourceLocator.Scheme getScheme() {
        return scheme;
    }
    public String getHost() {
        return host;
    }
    public int getPort() {
        return port;
    }
    public boolean isHttps() {
        return scheme == ResourceLocator.Scheme.HTTPS;
    }

    @Override
    public boolean equals(Object obj) {
        if(!(obj instanceof Authority)) return false;
        Authority other = (Authority)obj;
        return port == other.port && scheme == other.scheme && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, host, port);
    }

    @Override
    public String toString() {
        return scheme + "://" + host + ":" + port;
    }
}
