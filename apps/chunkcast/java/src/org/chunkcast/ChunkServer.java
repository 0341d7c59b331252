/* ChunkServer - Serves local chunks to downloading peers.
   This file is part of Chunkcast.
   Licensed under the GPL version 2 or later.
*/

package org.chunkcast;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;

import net.i2p.I2PAppContext;
import net.i2p.util.I2PAppThread;
import net.i2p.util.Log;
import net.i2p.util.ObjectCounter;
import net.i2p.util.SimpleTimer2;

/**
 * Accepts transfer connections and serves chunk requests on each one until
 * the client closes it or it sits idle.
 *
 * <p>Every connection gets its own handler thread, so the accept loop never
 * waits on a client. Clients that keep breaking the framing are refused
 * for a while.
 *
 * @since 0.9.0
 */
public class ChunkServer implements Runnable {

    /** a connection with no request for this long is closed */
    public static final int IDLE_TIMEOUT = 30 * 1000;
    /** protocol errors before refusing a client */
    private static final int MAX_BAD = 5;
    private static final long BAD_CLEAN_INTERVAL = 15 * 60 * 1000;

    private final I2PAppContext _context;
    private final Log _log;
    private final ChunkStore _store;
    private final int _port;
    private final ObjectCounter<InetAddress> _badCounter = new ObjectCounter<InetAddress>();
    private final SimpleTimer2.TimedEvent _cleaner;
    private volatile boolean stop;
    private ServerSocket _serverSocket;
    private Thread thread;
    private volatile int _served;

    /**
     * @param port 0 for any free port, see {@link #getPort()}
     */
    public ChunkServer(I2PAppContext ctx, ChunkStore store, int port) {
        _context = ctx;
        _log = ctx.logManager().getLog(ChunkServer.class);
        _store = store;
        _port = port;
        _cleaner = new Cleaner();
    }

    /**
     * Bind and start accepting. May be called even when already running.
     * May be called to start up again after halt().
     *
     * @throws IOException if the port cannot be bound
     */
    public synchronized void startAccepting() throws IOException {
        if (thread != null) {return;}
        stop = false;
        ServerSocket ss = new ServerSocket();
        ss.setReuseAddress(true);
        try {
            ss.bind(new InetSocketAddress(_port));
        } catch (IOException ioe) {
            try {ss.close();}
            catch (IOException ioe2) {}
            throw ioe;
        }
        _serverSocket = ss;
        thread = new I2PAppThread(this, "Chunkcast acceptor " + ss.getLocalPort());
        thread.setDaemon(true);
        thread.start();
        _cleaner.reschedule(BAD_CLEAN_INTERVAL, false);
        if (_log.shouldInfo()) {_log.info("Serving chunks from " + _store.getDirectory() + " on TCP port " + ss.getLocalPort());}
    }

    /**
     * Stop accepting. Connections being served finish their current transfer.
     * May be restarted later with startAccepting().
     */
    public synchronized void halt() {
        if (stop) {return;}
        stop = true;
        if (_serverSocket != null) {
            try {_serverSocket.close();}
            catch (IOException ioe) {}
        }
        _badCounter.clear();
        _cleaner.cancel();
        Thread t = thread;
        if (t != null) {
            t.interrupt();
            thread = null;
        }
    }

    /** @return the bound port, or -1 if not bound */
    public int getPort() {
        ServerSocket ss = _serverSocket;
        return ss != null ? ss.getLocalPort() : -1;
    }

    /** successful transfers since start */
    public int getServed() {return _served;}

    public void run() {
        ServerSocket ss;
        synchronized (this) {
            ss = _serverSocket;
        }
        while (!stop) {
            Socket socket;
            try {
                socket = ss.accept();
            } catch (IOException ioe) {
                if (stop || ss.isClosed()) {break;}
                _log.error("Error while accepting", ioe);
                continue;
            }
            InetAddress from = socket.getInetAddress();
            int bad = _badCounter.count(from);
            if (bad >= MAX_BAD) {
                if (_log.shouldWarn()) {
                    _log.warn("Rejecting connection from " + from.getHostAddress() + " after " + bad + " protocol errors");
                }
                try {socket.close();}
                catch (IOException ioe) {}
                continue;
            }
            Thread t = new I2PAppThread(new Handler(socket), "Chunkcast connection " + from.getHostAddress());
            t.setDaemon(true);
            t.start();
        }
        if (_log.shouldInfo()) {_log.info("Chunk server closed");}
    }

    /**
     * Serve one request.
     *
     * @return true if the chunk was sent
     */
    private boolean serve(String name, OutputStream out) throws IOException {
        File f = _store.getChunk(name);
        if (f == null) {
            if (_log.shouldInfo()) {_log.info("Chunk not found: " + name);}
            ChunkProtocol.writeNotFound(out);
            return false;
        }
        InputStream in = null;
        try {
            in = new FileInputStream(f);
            long size = f.length();
            ChunkProtocol.writeHeader(out, size);
            byte[] buf = new byte[ChunkProtocol.BLOCK_SIZE];
            long remaining = size;
            int read;
            while (remaining > 0 &&
                   (read = in.read(buf, 0, (int) Math.min(buf.length, remaining))) > 0) {
                out.write(buf, 0, read);
                remaining -= read;
            }
            if (remaining > 0) {
                // truncated under us, the client sees a short read
                throw new IOException("Chunk " + name + " shrank while sending");
            }
            out.flush();
            return true;
        } finally {
            if (in != null) {
                try {in.close();}
                catch (IOException ioe) {}
            }
        }
    }

    private class Handler implements Runnable {
        private final Socket _socket;

        public Handler(Socket socket) {_socket = socket;}

        public void run() {
            String from = _socket.getInetAddress().getHostAddress();
            try {
                _socket.setSoTimeout(IDLE_TIMEOUT);
                _socket.setTcpNoDelay(true);
                InputStream in = new BufferedInputStream(_socket.getInputStream());
                OutputStream out = new BufferedOutputStream(_socket.getOutputStream(), ChunkProtocol.BLOCK_SIZE);
                if (_log.shouldDebug()) {_log.debug("Handling connection from " + from);}
                while (!stop) {
                    ChunkProtocol.Request req = ChunkProtocol.readRequest(in);
                    if (req == null) {
                        if (_log.shouldDebug()) {_log.debug("Connection closed by " + from);}
                        break;
                    }
                    if (req.getChunk() == null) {
                        if (_log.shouldWarn()) {_log.warn("Malformed request from " + from + ": " + req.getError());}
                        continue;
                    }
                    if (serve(req.getChunk(), out)) {
                        _served++;
                        if (_log.shouldDebug()) {_log.debug("Sent " + req.getChunk() + " to " + from);}
                    }
                }
            } catch (ChunkProtocol.ProtocolException pe) {
                _badCounter.increment(_socket.getInetAddress());
                if (_log.shouldInfo()) {_log.info("Protocol error from " + from + ": " + pe.getMessage());}
            } catch (SocketTimeoutException ste) {
                if (_log.shouldDebug()) {_log.debug("Idle connection from " + from + " closed");}
            } catch (IOException ioe) {
                if (_log.shouldDebug()) {_log.debug("Error handling connection from " + from, ioe);}
            } finally {
                try {_socket.close();}
                catch (IOException ignored) {}
            }
        }
    }

    private class Cleaner extends SimpleTimer2.TimedEvent {

        public Cleaner() {super(_context.simpleTimer2());}

        public void timeReached() {
            if (stop) {return;}
            _badCounter.clear();
            schedule(BAD_CLEAN_INTERVAL);
        }
    }
}
