package rs.lukaj.webfetch.connections;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class SingleSlotConnectionPoolTest {

    private static Authority authorityOf(ScriptedHttpServer server) {
        return new Authority(ResourceLocator.Scheme.HTTP, "127.0.0.1", server.getPort());
    }

    /**
     * Acquiring, releasing with keep-alive and reusing a connection.
     */
    @Test
    public void reuseAfterKeepAlive() throws IOException {
        try(ScriptedHttpServer server = new ScriptedHttpServer(path -> ScriptedHttpServer.Reply.keepOpen(ScriptedHttpServer.ok("")));
            SingleSlotConnectionPool pool = new SingleSlotConnectionPool()) {
            Authority authority = authorityOf(server);
            HttpSocket first = pool.acquire(authority);
            assertFalse(pool.hasConnection(authority)); //in use, so not in the slot
            pool.release(authority, first, true);
            assertTrue(pool.hasConnection(authority));
            assertEquals(1, pool.getPoolSize());

            HttpSocket second = pool.acquire(authority);
            assertSame(first, second);
            pool.release(authority, second, false);
            assertTrue(second.isClosed());
            assertEquals(0, pool.getPoolSize());
        }
    }

    /**
     * Two simultaneous users each get their own connection; the displaced one is closed.
     */
    @Test
    public void concurrentAcquire() throws IOException {
        try(ScriptedHttpServer server = new ScriptedHttpServer(path -> ScriptedHttpServer.Reply.keepOpen(ScriptedHttpServer.ok("")));
            SingleSlotConnectionPool pool = new SingleSlotConnectionPool()) {
            Authority authority = authorityOf(server);
            HttpSocket a = pool.acquire(authority);
            HttpSocket b = pool.acquire(authority);
            assertNotSame(a, b);
            pool.release(authority, a, true);
            pool.release(authority, b, true);
            assertTrue(a.isClosed());
            assertFalse(b.isClosed());
            assertEquals(1, pool.getPoolSize());
            pool.close();
            assertTrue(b.isClosed());
            assertEquals(0, pool.getPoolSize());
        }
    }

    @Test
    public void closedSocketIsNotReused() throws IOException {
        try(ScriptedHttpServer server = new ScriptedHttpServer(path -> ScriptedHttpServer.Reply.keepOpen(ScriptedHttpServer.ok("")));
            SingleSlotConnectionPool pool = new SingleSlotConnectionPool()) {
            Authority authority = authorityOf(server);
            HttpSocket first = pool.acquire(authority);
            pool.release(authority, first, true);
            first.close();
            assertNotSame(first, pool.acquire(authority));
        }
    }

    @Test
    public void config() {
        SingleSlotConnectionPool.Config config = new SingleSlotConnectionPool.Config();
        assertEquals(Duration.ZERO, config.getConnectTimeout());
        assertEquals(Duration.ZERO, config.getReadTimeout());
        config.setReadTimeout(Duration.ofSeconds(3));
        assertEquals(Duration.ofSeconds(3), config.getReadTimeout());
        assertThrows(InvalidConfigException.class, () -> config.setConnectTimeout(Duration.ofSeconds(-1)));
        assertThrows(InvalidConfigException.class, () -> config.setReadTimeout(null));
        assertThrows(InvalidConfigException.class, () -> new SingleSlotConnectionPool(Duration.ofDays(365), Duration.ZERO));
    }
}
