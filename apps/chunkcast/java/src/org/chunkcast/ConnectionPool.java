package org.chunkcast;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import net.i2p.I2PAppContext;
import net.i2p.data.DataHelper;
import net.i2p.util.Log;
import net.i2p.util.SimpleTimer2;

/**
 * Bounded cache of transfer connections, one per peer, least recently used
 * first out.
 *
 * <p>Connections are opened on demand, checked for liveness when handed out again,
 * and closed by a reaper after sitting idle. Connects in progress count against
 * the maximum, so there are never more open sockets than that. The least recently
 * used idle entry is closed to make room; when none is idle, callers wait.
 *
 * @since 0.9.0
 */
public class ConnectionPool {

    /** how often idle connections are looked for */
    static final long REAP_INTERVAL = 60 * 1000;
    public static final int CONNECT_TIMEOUT = 10 * 1000;
    public static final int READ_TIMEOUT = 10 * 1000;

    private final I2PAppContext _context;
    private final Log _log;
    private final int _maxConnections;
    private final long _idleTimeout;
    private final PeerConnector _connector;
    /** access ordered, eldest first */
    private final LinkedHashMap<String, PooledConnection> _connections =
        new LinkedHashMap<String, PooledConnection>(16, 0.75f, true);
    /** peers being connected to, each holding a slot; synch on _connections */
    private final Set<String> _connecting = new HashSet<String>();
    private volatile boolean _isRunning;
    private Reaper _reaper;

    /**
     * Plain TCP to the given port, unless the peer names its own port.
     */
    public ConnectionPool(I2PAppContext ctx, int maxConnections, long idleTimeout, int peerPort) {
        this(ctx, maxConnections, idleTimeout, new TcpConnector(peerPort));
    }

    public ConnectionPool(I2PAppContext ctx, int maxConnections, long idleTimeout, PeerConnector connector) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be at least 1");
        }
        _context = ctx;
        _log = ctx.logManager().getLog(ConnectionPool.class);
        _maxConnections = maxConnections;
        _idleTimeout = idleTimeout;
        _connector = connector;
    }

    /**
     * Start the idle reaper. May be called again after stop().
     */
    public synchronized void start() {
        if (_isRunning) {return;}
        _isRunning = true;
        _reaper = new Reaper();
        _reaper.schedule(REAP_INTERVAL);
    }

    /**
     * Stop the reaper. Connections stay open, see {@link #closeAll()}.
     */
    public synchronized void stop() {
        _isRunning = false;
        if (_reaper != null) {
            _reaper.cancel();
            _reaper = null;
        }
    }

    /**
     * A live connection to the peer, cached or new, locked by the caller.
     * The caller must {@link PooledConnection#unlock()} it after the exchange.
     *
     * <p>When the pool is full and every connection is busy this waits for
     * one to be released. A busy connection is never closed to make room.
     *
     * @throws IOException if a new connection cannot be opened, or on interrupt
     */
    public PooledConnection acquire(String peer) throws IOException {
        synchronized (_connections) {
            while (true) {
                PooledConnection conn = _connections.get(peer);
                if (conn != null) {
                    if (conn.tryLock()) {
                        if (conn.isAlive()) {
                            conn.touch(_context.clock().now());
                            if (_log.shouldDebug()) {_log.debug("Reusing " + conn);}
                            return conn;
                        }
                        if (_log.shouldInfo()) {_log.info("Dropping dead " + conn);}
                        _connections.remove(peer);
                        conn.close();
                        conn.unlock();
                        continue;
                    }
                } else if (!_connecting.contains(peer)) {
                    if (_connections.size() + _connecting.size() < _maxConnections) {
                        break;
                    }
                    PooledConnection victim = locked_pickVictim();
                    if (victim != null) {
                        _connections.remove(victim.getPeer());
                        if (_log.shouldDebug()) {_log.debug("Evicting least recently used " + victim);}
                        victim.close();
                        victim.unlock();
                        break;
                    }
                }
                // busy with this peer, or everything busy
                try {
                    _connections.wait();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("Interrupted waiting for a connection to " + peer);
                }
            }
            // slot reserved
            _connecting.add(peer);
        }
        PooledConnection fresh = null;
        try {
            Socket sock = _connector.connect(peer);
            try {
                fresh = new PooledConnection(this, peer, sock, _context.clock().now());
            } catch (IOException ioe) {
                try {sock.close();}
                catch (IOException ioe2) {}
                throw ioe;
            }
            fresh.lock();
        } finally {
            synchronized (_connections) {
                _connecting.remove(peer);
                if (fresh != null) {
                    _connections.put(peer, fresh);
                }
                _connections.notifyAll();
            }
        }
        if (_log.shouldDebug()) {_log.debug("Opened " + fresh);}
        return fresh;
    }

    /**
     * Eldest entry nobody holds, locked, or null if all are busy.
     * Caller must synch on _connections.
     */
    private PooledConnection locked_pickVictim() {
        for (PooledConnection c : _connections.values()) {
            if (!c.isInUse() && c.tryLock()) {
                return c;
            }
        }
        return null;
    }

    /**
     * Called by a connection after its holder unlocks it.
     */
    void released(PooledConnection conn) {
        synchronized (_connections) {
            _connections.notifyAll();
        }
    }

    /**
     * Close and forget a connection after a transport or protocol error.
     * Call before unlocking it.
     * No-op for the map if the pool already holds a different connection for the peer.
     */
    public void remove(PooledConnection conn) {
        synchronized (_connections) {
            if (_connections.get(conn.getPeer()) == conn) {
                _connections.remove(conn.getPeer());
            }
            conn.close();
            _connections.notifyAll();
        }
        if (_log.shouldDebug()) {_log.debug("Removed " + conn);}
    }

    /**
     * Close and forget whatever connection is cached for the peer.
     */
    public void remove(String peer) {
        synchronized (_connections) {
            PooledConnection conn = _connections.remove(peer);
            if (conn != null) {
                conn.close();
                _connections.notifyAll();
            }
        }
    }

    /**
     * Close connections idle longer than the timeout and not in use.
     *
     * @return the number closed
     */
    public int reapIdle(long now) {
        int closed = 0;
        synchronized (_connections) {
            for (Iterator<PooledConnection> iter = _connections.values().iterator(); iter.hasNext(); ) {
                PooledConnection c = iter.next();
                if (now - c.getLastUsed() > _idleTimeout && !c.isInUse()) {
                    iter.remove();
                    c.close();
                    closed++;
                }
            }
            if (closed > 0) {
                _connections.notifyAll();
            }
        }
        if (closed > 0 && _log.shouldInfo()) {
            _log.info("Closed " + closed + " connections idle for over " + DataHelper.formatDuration(_idleTimeout));
        }
        return closed;
    }

    /**
     * Close everything, at shutdown.
     */
    public void closeAll() {
        int closed;
        synchronized (_connections) {
            closed = _connections.size();
            for (PooledConnection c : _connections.values()) {
                c.close();
            }
            _connections.clear();
            _connections.notifyAll();
        }
        if (_log.shouldInfo()) {_log.info("Closed all " + closed + " pooled connections");}
    }

    public int size() {
        synchronized (_connections) {
            return _connections.size();
        }
    }

    /** does not refresh LRU order */
    public boolean contains(String peer) {
        synchronized (_connections) {
            return _connections.containsKey(peer);
        }
    }

    /** peers eldest first */
    public List<String> getPeers() {
        synchronized (_connections) {
            return new ArrayList<String>(_connections.keySet());
        }
    }

    public int getMaxConnections() {return _maxConnections;}

    /**
     * Plain TCP with the pool's connect and read timeouts.
     */
    public static class TcpConnector implements PeerConnector {
        private final int _port;

        public TcpConnector(int port) {_port = port;}

        public Socket connect(String peer) throws IOException {
            String host = peer;
            int port = _port;
            int colon = peer.lastIndexOf(':');
            if (colon > 0 && peer.indexOf(':') == colon) {
                host = peer.substring(0, colon);
                try {
                    port = Integer.parseInt(peer.substring(colon + 1));
                } catch (NumberFormatException nfe) {
                    throw new IOException("Bad peer address " + peer);
                }
            }
            Socket s = new Socket();
            try {
                s.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT);
                s.setSoTimeout(READ_TIMEOUT);
                s.setTcpNoDelay(true);
            } catch (IOException ioe) {
                try {s.close();}
                catch (IOException ioe2) {}
                throw ioe;
            }
            return s;
        }
    }

    private class Reaper extends SimpleTimer2.TimedEvent {

        public Reaper() {
            super(_context.simpleTimer2());
        }

        public void timeReached() {
            if (!_isRunning) {return;}
            try {
                reapIdle(_context.clock().now());
            } catch (RuntimeException re) {
                _log.error("Error closing idle connections", re);
            }
            if (_isRunning) {
                schedule(REAP_INTERVAL);
            }
        }
    }
}
