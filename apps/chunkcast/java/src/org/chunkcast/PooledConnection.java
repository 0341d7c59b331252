package org.chunkcast;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One cached connection to a peer.
 *
 * <p>A connection carries one request/response exchange at a time.
 * {@link ConnectionPool#acquire(String)} hands it out locked, and the holder
 * {@link #unlock()}s it after the exchange, which returns it to the pool.
 *
 * @since 0.9.0
 */
public class PooledConnection {

    private final ConnectionPool _pool;
    private final String _peer;
    private final Socket _socket;
    private final InputStream _in;
    private final OutputStream _out;
    private final ReentrantLock _lock = new ReentrantLock();
    private volatile long _lastUsed;
    private volatile boolean _closed;

    /**
     * @param pool notified on unlock, may be null
     */
    PooledConnection(ConnectionPool pool, String peer, Socket socket, long now) throws IOException {
        _pool = pool;
        _peer = peer;
        _socket = socket;
        _in = new BufferedInputStream(socket.getInputStream(), ChunkProtocol.BLOCK_SIZE);
        _out = new BufferedOutputStream(socket.getOutputStream(), ChunkProtocol.BLOCK_SIZE);
        _lastUsed = now;
    }

    public String getPeer() {return _peer;}

    /** only while locked */
    public InputStream getInputStream() {return _in;}

    /** only while locked */
    public OutputStream getOutputStream() {return _out;}

    void lock() {_lock.lock();}

    /**
     * Release after an exchange. Only the holder may call this.
     */
    public void unlock() {
        _lock.unlock();
        if (_pool != null && !_lock.isHeldByCurrentThread()) {
            _pool.released(this);
        }
    }

    boolean tryLock() {return _lock.tryLock();}

    public boolean isInUse() {return _lock.isLocked();}

    public long getLastUsed() {return _lastUsed;}

    void touch(long now) {_lastUsed = now;}

    public boolean isClosed() {return _closed || _socket.isClosed();}

    /**
     * Non-blocking check for a connection the peer has closed.
     * A connection in use by another thread is assumed alive.
     * Bytes waiting outside an exchange mean the stream is out of sync,
     * which counts as dead.
     */
    boolean isAlive() {
        if (isClosed() || !_socket.isConnected() || _socket.isInputShutdown() || _socket.isOutputShutdown()) {
            return false;
        }
        if (!_lock.tryLock()) {
            return true;
        }
        try {
            if (_in.available() > 0) {
                return false;
            }
            int timeout = _socket.getSoTimeout();
            _socket.setSoTimeout(1);
            try {
                _in.read();
                // EOF or a stray byte
                return false;
            } catch (SocketTimeoutException ste) {
                return true;
            } finally {
                if (!_socket.isClosed()) {
                    _socket.setSoTimeout(timeout);
                }
            }
        } catch (IOException ioe) {
            return false;
        } finally {
            _lock.unlock();
        }
    }

    /**
     * Close the socket. Safe from any thread, an exchange in progress fails.
     */
    public void close() {
        _closed = true;
        try {_socket.close();}
        catch (IOException ioe) {}
    }

    @Override
    public String toString() {
        return "Connection to " + _peer + (isClosed() ? " (closed)" : "");
    }
}
