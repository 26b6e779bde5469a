package rs.lukaj.webfetch.connections;

import java.io.IOException;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Represents a single GET request for a network locator. Knows how to frame the request line and headers.
 */
public class HttpRequest {
    private static final String METHOD = "GET";

    private final ResourceLocator target;
    private final Http.Version httpVersion = Http.Version.HTTP11;
    private final RequestHeaders headers;

    private HttpRequest(ResourceLocator target, RequestHeaders headers) {
        this.target = target;
        this.headers = headers;
    }

    /**
     * Create a new request for the given locator, using {@link RequestHeaders#createDefault(String) default}
     * headers.
     * @param target http or https locator
     * @return new request
     * @throws InvalidLocatorException if locator isn't fetched over network
     */
    public static HttpRequest create(ResourceLocator target) {
        if(!target.getScheme().isNetwork())
            throw new InvalidLocatorException("Not a network locator: " + target);
        return new HttpRequest(target, RequestHeaders.createDefault(target.getHost()));
    }

    /**
     * Set User-Agent sent with this request.
     * @param userAgent user agent
     * @return this, to allow chaining
     */
    public HttpRequest setUserAgent(String userAgent) {
        headers.setUserAgent(userAgent);
        return this;
    }

    /**
     * @return headers used for this request
     */
    public RequestHeaders getHeaders() {
        return headers;
    }

    /**
     * Request line, headers and the terminating blank line, as they go over the wire.
     * Connection header always goes out as "close", whatever it was set to before; whether the socket is
     * actually kept is decided by the response (see {@link ResponseHeaders#isKeepAlive()}).
     * @return framed request
     */
    public String frame() {
        headers.setConnection("close");
        return METHOD + " " + target.getPath() + " " + httpVersion + Http.CRLF
                + headers
                + Http.CRLF;
    }

    /**
     * Write this request to the socket and flush it.
     * @param conn socket connected to the target's authority
     * @throws IOException if writing fails
     */
    public void writeTo(HttpSocket conn) throws IOException {
        conn.write(frame().getBytes(UTF_8));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HttpRequest request = (HttpRequest) o;
        return target.equals(request.target) && Objects.equals(headers, request.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, headers);
    }
}
