/**
 * This package implements fetching of a single resource: talking to the server, framing the response, decoding the
 * body, caching and following redirects. More high-level (i.e. usable) stuff is located inside the client package.
 *
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.webfetch.connections.ResourceLocator} parses a URL into scheme, host, port and path. Anything
 * it can't make sense of becomes the fallback locator instead of an error.
 * <br/>
 * {@link rs.lukaj.webfetch.connections.HttpSocket} provides a way to send raw data to server, over TLS for https.
 * Doesn't actually implement any HTTP.
 * <br/>
 * {@link rs.lukaj.webfetch.connections.ConnectionPool} (implemented as
 * {@link rs.lukaj.webfetch.connections.SingleSlotConnectionPool}) keeps at most one idle socket per
 * {@link rs.lukaj.webfetch.connections.Authority}. A socket belongs to exactly one fetch while it's in use.
 * <br/>
 * {@link rs.lukaj.webfetch.connections.HttpRequest} frames the request.
 * {@link rs.lukaj.webfetch.connections.ResponseAssembler} collects raw bytes until the response is complete
 * (Content-Length, chunked terminator or end of stream), {@link rs.lukaj.webfetch.connections.HttpResponse}
 * parses them and {@link rs.lukaj.webfetch.connections.ContentDecoder} undoes chunking and gzip.
 * <br/>
 * {@link rs.lukaj.webfetch.connections.HttpCache} (implemented as
 * {@link rs.lukaj.webfetch.connections.AuthorityHttpCache}) stores responses which
 * {@link rs.lukaj.webfetch.connections.CachingPolicy} allows, for as long as max-age says.
 * <br/>
 * {@link rs.lukaj.webfetch.connections.ResourceFetcher} puts it all together, with
 * {@link rs.lukaj.webfetch.connections.RedirectResolver} deciding where to go next. It also serves data: and
 * file:// resources, which never touch the network.
 */
package rs.lukaj.webfetch.connections;
