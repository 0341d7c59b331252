package org.chunkcast;

import static org.junit.Assert.*;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import net.i2p.I2PAppContext;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

/**
 * Pool bound, LRU eviction, reuse, liveness, waiting for busy connections
 * and idle reaping.
 */
public class ConnectionPoolTest {

    private static final long IDLE = 60 * 1000;

    private I2PAppContext ctx;
    private CannedServer server;
    private List<String> connects;
    private ConnectionPool pool;

    @Before
    public void setUp() throws IOException {
        ctx = I2PAppContext.getGlobalContext();
        server = new CannedServer(null, false);
        connects = Collections.synchronizedList(new ArrayList<String>());
        // every peer name goes to the one local server
        final ConnectionPool.TcpConnector tcp = new ConnectionPool.TcpConnector(server.getPort());
        pool = new ConnectionPool(ctx, 2, IDLE, new PeerConnector() {
            public Socket connect(String peer) throws IOException {
                connects.add(peer);
                return tcp.connect("127.0.0.1");
            }
        });
    }

    @After
    public void tearDown() {
        pool.stop();
        pool.closeAll();
        server.close();
    }

    /** acquire and hand straight back */
    private static PooledConnection take(ConnectionPool p, String peer) throws IOException {
        PooledConnection rv = p.acquire(peer);
        rv.unlock();
        return rv;
    }

    private PooledConnection take(String peer) throws IOException {
        return take(pool, peer);
    }

    /**
     * Tracks how many of its sockets are open at once.
     */
    private class CountingConnector implements PeerConnector {
        final AtomicInteger open = new AtomicInteger();
        final AtomicInteger peak = new AtomicInteger();

        public Socket connect(String peer) throws IOException {
            Socket s = new Socket() {
                private boolean released;

                @Override
                public synchronized void close() throws IOException {
                    if (!released) {
                        released = true;
                        open.decrementAndGet();
                    }
                    super.close();
                }
            };
            int now = open.incrementAndGet();
            synchronized (peak) {
                if (now > peak.get()) {
                    peak.set(now);
                }
            }
            try {
                s.connect(new InetSocketAddress("127.0.0.1", server.getPort()), 5000);
                // give concurrent callers a chance to overlap
                Thread.sleep(20);
            } catch (InterruptedException ie) {
                s.close();
                throw new IOException(ie);
            } catch (IOException ioe) {
                s.close();
                throw ioe;
            }
            return s;
        }
    }

    @Test
    public void reuseTest() throws IOException {
        PooledConnection a = take("p1");
        PooledConnection b = take("p1");
        assertSame(a, b);
        assertEquals(1, pool.size());
        assertEquals(Arrays.asList("p1"), connects);
    }

    @Test
    public void acquireHandsOutLockedTest() throws IOException {
        PooledConnection c = pool.acquire("p1");
        assertTrue(c.isInUse());
        c.unlock();
        assertFalse(c.isInUse());
    }

    @Test
    public void boundAndLruTest() throws IOException {
        PooledConnection p1 = take("p1");
        PooledConnection p2 = take("p2");
        // p1 becomes most recently used
        assertSame(p1, take("p1"));
        PooledConnection p3 = take("p3");
        assertEquals(2, pool.size());
        assertTrue(pool.contains("p1"));
        assertFalse(pool.contains("p2"));
        assertTrue(pool.contains("p3"));
        assertTrue(p2.isClosed());
        assertFalse(p1.isClosed());
        assertFalse(p3.isClosed());
        assertEquals(Arrays.asList("p1", "p3"), pool.getPeers());
    }

    @Test
    public void busyConnectionNeverEvictedTest() throws IOException {
        PooledConnection p1 = pool.acquire("p1");
        try {
            PooledConnection p2 = take("p2");
            take("p3");
            assertFalse(p1.isClosed());
            assertTrue(p2.isClosed());
        } finally {
            p1.unlock();
        }
    }

    @Test(timeout = 10000)
    public void waitsForReleaseWhenAllBusyTest() throws Exception {
        final PooledConnection p1 = pool.acquire("p1");
        final PooledConnection p2 = pool.acquire("p2");
        final AtomicReference<PooledConnection> got = new AtomicReference<PooledConnection>();
        final AtomicReference<Throwable> error = new AtomicReference<Throwable>();
        Thread t = new Thread(new Runnable() {
            public void run() {
                try {
                    got.set(take(pool, "p3"));
                } catch (Throwable e) {
                    error.set(e);
                }
            }
        });
        t.start();
        Thread.sleep(300);
        // both exchanges are still going, nothing closed under them
        assertTrue(t.isAlive());
        assertFalse(p1.isClosed());
        assertFalse(p2.isClosed());
        p1.unlock();
        t.join(5000);
        assertFalse(t.isAlive());
        assertNull(error.get());
        assertNotNull(got.get());
        assertTrue(p1.isClosed());
        assertFalse(p2.isClosed());
        assertEquals(Arrays.asList("p2", "p3"), pool.getPeers());
        p2.unlock();
    }

    @Test(timeout = 20000)
    public void concurrentAcquireStaysWithinMaxTest() throws Exception {
        CountingConnector counting = new CountingConnector();
        final ConnectionPool single = new ConnectionPool(ctx, 1, IDLE, counting);
        final List<Throwable> errors = Collections.synchronizedList(new ArrayList<Throwable>());
        try {
            take(single, "p0");
            List<Thread> threads = new ArrayList<Thread>();
            for (int i = 1; i <= 4; i++) {
                final String peer = "p" + i;
                Thread t = new Thread(new Runnable() {
                    public void run() {
                        try {
                            PooledConnection c = single.acquire(peer);
                            try {
                                Thread.sleep(20);
                            } finally {
                                c.unlock();
                            }
                        } catch (Throwable e) {
                            errors.add(e);
                        }
                    }
                });
                threads.add(t);
                t.start();
            }
            for (Thread t : threads) {
                t.join();
            }
        } finally {
            single.closeAll();
        }
        assertTrue(errors.toString(), errors.isEmpty());
        assertEquals(1, counting.peak.get());
        assertEquals(0, counting.open.get());
    }

    @Test
    public void neverExceedsMaxTest() throws IOException {
        for (int i = 0; i < 10; i++) {
            take("p" + i);
            assertTrue(pool.size() <= 2);
        }
    }

    @Test
    public void deadConnectionReplacedTest() throws Exception {
        PooledConnection a = take("p1");
        server.awaitAccepted(1);
        server.accepted.get(0).close();
        Thread.sleep(200);
        PooledConnection b = take("p1");
        assertNotSame(a, b);
        assertTrue(a.isClosed());
        assertEquals(2, connects.size());
        assertEquals(1, pool.size());
    }

    @Test
    public void strayBytesMeanDeadTest() throws Exception {
        PooledConnection a = take("p1");
        server.awaitAccepted(1);
        server.accepted.get(0).getOutputStream().write('x');
        server.accepted.get(0).getOutputStream().flush();
        Thread.sleep(200);
        assertNotSame(a, take("p1"));
    }

    @Test
    public void removeTest() throws IOException {
        PooledConnection a = pool.acquire("p1");
        pool.remove(a);
        a.unlock();
        assertTrue(a.isClosed());
        assertEquals(0, pool.size());
        PooledConnection b = take("p1");
        // removing a stale handle leaves the new one alone
        pool.remove(a);
        assertTrue(pool.contains("p1"));
        assertFalse(b.isClosed());
    }

    @Test
    public void reapIdleTest() throws IOException {
        PooledConnection a = take("p1");
        PooledConnection b = pool.acquire("p2");
        try {
            long now = ctx.clock().now();
            assertEquals(0, pool.reapIdle(now));
            // in use, not reaped
            assertEquals(1, pool.reapIdle(now + IDLE + 1000));
        } finally {
            b.unlock();
        }
        assertTrue(a.isClosed());
        assertFalse(b.isClosed());
        assertEquals(Arrays.asList("p2"), pool.getPeers());
    }

    @Test
    public void closeAllTest() throws IOException {
        PooledConnection a = take("p1");
        PooledConnection b = take("p2");
        pool.closeAll();
        assertEquals(0, pool.size());
        assertTrue(a.isClosed());
        assertTrue(b.isClosed());
    }

    @Test(expected = IOException.class)
    public void connectFailureTest() throws IOException {
        int port = server.getPort();
        server.close();
        new ConnectionPool(ctx, 2, IDLE, port).acquire("127.0.0.1");
    }

    @Test(timeout = 10000)
    public void connectFailureFreesSlotTest() {
        int port = server.getPort();
        server.close();
        ConnectionPool p = new ConnectionPool(ctx, 1, IDLE, port);
        for (int i = 0; i < 3; i++) {
            try {
                p.acquire("127.0.0.1");
                fail("connected to a closed port");
            } catch (IOException expected) {}
        }
        assertEquals(0, p.size());
    }

    @Test
    public void peerPortInNameTest() throws IOException {
        ConnectionPool p = new ConnectionPool(ctx, 2, IDLE, 1);
        try {
            PooledConnection c = take(p, "127.0.0.1:" + server.getPort());
            assertFalse(c.isClosed());
        } finally {
            p.closeAll();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroMaxTest() {
        new ConnectionPool(ctx, 0, IDLE, 5000);
    }
}
