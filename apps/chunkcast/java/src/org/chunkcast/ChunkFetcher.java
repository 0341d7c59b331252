package org.chunkcast;

import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.security.MessageDigest;

import net.i2p.I2PAppContext;
import net.i2p.crypto.SHA256Generator;
import net.i2p.util.Log;

/**
 * Fetches chunks over pooled connections.
 *
 * <p>The body is hashed while it is written to a hidden temp file in the chunk
 * directory. Only a chunk whose SHA-256 matches is renamed into place; anything
 * else is deleted. A connection that failed mid-exchange is dropped from the pool,
 * one that returned a complete but unwanted answer is kept.
 *
 * @since 0.9.0
 */
public class ChunkFetcher implements ChunkSource {

    private final Log _log;
    private final ConnectionPool _pool;
    private final ChunkStore _store;

    public ChunkFetcher(I2PAppContext ctx, ConnectionPool pool, ChunkStore store) {
        _log = ctx.logManager().getLog(ChunkFetcher.class);
        _pool = pool;
        _store = store;
    }

    public FetchResult fetch(String peer, String chunkName, String checksum) {
        File tmp;
        try {
            tmp = _store.createTempFile(chunkName);
        } catch (IOException ioe) {
            _log.error("Cannot create temp file for " + chunkName + " in " + _store.getDirectory(), ioe);
            return FetchResult.TRANSPORT_ERROR;
        }
        PooledConnection conn;
        try {
            conn = _pool.acquire(peer);
        } catch (IOException ioe) {
            tmp.delete();
            if (_log.shouldWarn()) {_log.warn("Cannot connect to " + peer + ": " + ioe.getMessage());}
            return FetchResult.TRANSPORT_ERROR;
        }
        FetchResult rv = FetchResult.TRANSPORT_ERROR;
        boolean committed = false;
        try {
            rv = exchange(conn, chunkName, checksum, tmp);
            if (rv == FetchResult.OK) {
                _store.commit(tmp, chunkName);
                committed = true;
            }
        } catch (IOException ioe) {
            // local storage failure, the stream may be out of sync
            _log.error("Cannot store " + chunkName + " from " + peer, ioe);
            rv = FetchResult.TRANSPORT_ERROR;
        } finally {
            if (!committed) {
                tmp.delete();
            }
            // out of the pool before anyone else can pick it up
            if (rv.isConnectionBroken()) {
                _pool.remove(conn);
            }
            conn.unlock();
        }
        if (rv == FetchResult.OK) {
            if (_log.shouldInfo()) {_log.info("Received " + chunkName + " from " + peer);}
        } else if (_log.shouldWarn()) {
            _log.warn("Fetch of " + chunkName + " from " + peer + " failed: " + rv);
        }
        return rv;
    }

    /**
     * One request/response exchange on a connection the caller holds.
     *
     * @throws IOException only for failures writing the temp file
     */
    private FetchResult exchange(PooledConnection conn, String chunkName, String checksum, File tmp) throws IOException {
        InputStream in = conn.getInputStream();
        long size;
        try {
            ChunkProtocol.writeRequest(conn.getOutputStream(), chunkName);
            size = ChunkProtocol.readResponseHeader(in);
        } catch (ChunkProtocol.ProtocolException pe) {
            if (_log.shouldWarn()) {_log.warn("Bad response from " + conn.getPeer() + ": " + pe.getMessage());}
            return FetchResult.PROTOCOL_ERROR;
        } catch (SocketTimeoutException ste) {
            if (_log.shouldWarn()) {_log.warn("Timeout waiting for " + conn.getPeer());}
            return FetchResult.TRANSPORT_ERROR;
        } catch (IOException ioe) {
            if (_log.shouldWarn()) {_log.warn("Request to " + conn.getPeer() + " failed: " + ioe.getMessage());}
            return FetchResult.TRANSPORT_ERROR;
        }
        if (size < 0) {
            return FetchResult.NOT_FOUND;
        }
        MessageDigest sha = SHA256Generator.getDigestInstance();
        byte[] buf = new byte[ChunkProtocol.BLOCK_SIZE];
        long received = 0;
        OutputStream out = new BufferedOutputStream(new FileOutputStream(tmp));
        try {
            while (received < size) {
                int read;
                try {
                    read = in.read(buf, 0, (int) Math.min(buf.length, size - received));
                    if (read < 0) {
                        throw new EOFException("Connection closed after " + received + " of " + size + " bytes");
                    }
                } catch (IOException ioe) {
                    if (_log.shouldWarn()) {_log.warn("Transfer of " + chunkName + " from " + conn.getPeer() + " failed: " + ioe.getMessage());}
                    return FetchResult.TRANSPORT_ERROR;
                }
                sha.update(buf, 0, read);
                out.write(buf, 0, read);
                received += read;
            }
        } finally {
            out.close();
        }
        String actual = ChunkStore.toHex(sha.digest());
        if (!actual.equalsIgnoreCase(checksum)) {
            if (_log.shouldWarn()) {
                _log.warn("Checksum mismatch for " + chunkName + " from " + conn.getPeer() +
                          ": expected " + checksum + ", got " + actual);
            }
            return FetchResult.INTEGRITY_ERROR;
        }
        return FetchResult.OK;
    }
}
