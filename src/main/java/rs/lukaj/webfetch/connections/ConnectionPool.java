package rs.lukaj.webfetch.connections;

import java.io.Closeable;
import java.io.IOException;

/**
 * Provides connections to the fetcher. Connections == {@link HttpSocket}s
 */
public interface ConnectionPool extends Closeable {
    /**
     * Get connection to a given authority, opening a new one if the pool has none. The returned connection
     * belongs to the caller until it's handed back using {@link #release(Authority, HttpSocket, boolean)}.
     * @param authority authority to which connection should go
     * @return HttpSocket to the authority
     * @throws IOException if a new connection can't be opened
     */
    HttpSocket acquire(Authority authority) throws IOException;

    /**
     * Hand the connection back after a response has been read. If keepAlive is set, connection is kept for
     * the next request to the same authority, otherwise it's closed.
     * @param authority authority the connection was acquired for
     * @param connection connection obtained from {@link #acquire(Authority)}
     * @param keepAlive whether server asked to keep the connection alive
     */
    void release(Authority authority, HttpSocket connection, boolean keepAlive);

    /**
     * Close the connection without returning it to the pool, e.g. after a failed exchange.
     * @param connection connection obtained from {@link #acquire(Authority)}
     */
    void destroy(HttpSocket connection);
}
