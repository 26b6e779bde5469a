package rs.lukaj.webfetch.connections;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connection pool keeping at most one idle connection per {@link Authority}. Connections are opened lazily and
 * can be configured using values in {@link Config}.
 * <br/>
 * Acquiring a connection takes it out of its slot, so a connection is never used by two fetches at once. If two
 * fetches go to the same authority simultaneously, the second one opens its own connection; whichever is
 * released last with keep-alive stays in the slot, and the one it displaces is closed.
 */
public class SingleSlotConnectionPool implements ConnectionPool {
    private static final Logger LOGGER = Logger.getLogger(SingleSlotConnectionPool.class.getName());

    private final Map<Authority, HttpSocket> connections = new ConcurrentHashMap<>();
    private volatile Config config;

    public SingleSlotConnectionPool() {
        this(new Config());
    }
    public SingleSlotConnectionPool(Config config) {
        this.config = config;
    }
    public SingleSlotConnectionPool(Duration connectTimeout, Duration readTimeout) {
        this(new Config(connectTimeout, readTimeout));
    }

    /**
     * Returns config for this connection pool. Changes apply to connections opened afterwards.
     * @return config for this connection pool
     */
    public Config getConfig() {
        return config;
    }

    /**
     * Sets new config by replacing current config object. Changes apply to connections opened afterwards.
     * @param config new config
     */
    public void setConfig(Config config) {
        this.config = config;
    }

    @Override
    public HttpSocket acquire(Authority authority) throws IOException {
        HttpSocket conn = connections.remove(authority);
        if(conn != null && !conn.isClosed()) {
            LOGGER.fine("Reusing pooled connection to " + authority);
            return conn;
        }
        LOGGER.fine("Opening new connection to " + authority);
        return openConnection(authority);
    }

    /**
     * Opens a new socket. Separate so tests can count connections.
     */
    protected HttpSocket openConnection(Authority authority) throws IOException {
        Config c = config;
        return new HttpSocket(authority, c.connectTimeout, c.readTimeout);
    }

    @Override
    public void release(Authority authority, HttpSocket connection, boolean keepAlive) {
        if(!keepAlive || connection.isClosed()) {
            destroy(connection);
            return;
        }
        HttpSocket displaced = connections.put(authority, connection);
        if(displaced != null && displaced != connection) destroy(displaced);
        LOGGER.fine("Keeping connection to " + authority + " alive");
    }

    @Override
    public void destroy(HttpSocket connection) {
        try {
            connection.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Error closing connection to " + connection.getAuthority(), e);
        }
    }

    /**
     * @return number of idle connections currently in the pool
     */
    public int getPoolSize() {
        connections.values().removeIf(HttpSocket::isClosed);
        return connections.size();
    }

    /**
     * @param authority authority to look for
     * @return whether an open connection to this authority is waiting in the pool
     */
    public boolean hasConnection(Authority authority) {
        HttpSocket conn = connections.get(authority);
        return conn != null && !conn.isClosed();
    }

    /**
     * Closes all idle connections. Pool can still be used afterwards.
     */
    @Override
    public void close() {
        for(Authority authority : connections.keySet()) {
            HttpSocket conn = connections.remove(authority);
            if(conn != null) destroy(conn);
        }
    }


    public static class Config {
        //zero means no timeout, which is the default: a silent server stalls the fetch
        private Duration connectTimeout = Duration.ZERO;
        private Duration readTimeout = Duration.ZERO;

        public Config() {
        }

        public Config(Duration connectTimeout, Duration readTimeout) {
            setConnectTimeout(connectTimeout);
            setReadTimeout(readTimeout);
        }

        /**
         * Sets maximum time spent establishing a TCP connection. Zero disables the timeout.
         * @param connectTimeout connect timeout
         */
        public void setConnectTimeout(Duration connectTimeout) {
            checkTimeout(connectTimeout, "connectTimeout");
            this.connectTimeout = connectTimeout;
        }

        /**
         * Sets maximum time a single read from the socket can block. Zero disables the timeout.
         * @param readTimeout read timeout
         */
        public void setReadTimeout(Duration readTimeout) {
            checkTimeout(readTimeout, "readTimeout");
            this.readTimeout = readTimeout;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        private static void checkTimeout(Duration timeout, String name) {
            if(timeout == null || timeout.isNegative())
                throw new InvalidConfigException(name + " must be zero or positive!");
            if(timeout.toMillis() > Integer.MAX_VALUE)
                throw new InvalidConfigException(name + " is too large!");
        }
    }
}
