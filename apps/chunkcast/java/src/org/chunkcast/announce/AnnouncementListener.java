package org.chunkcast.announce;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;

import net.i2p.I2PAppContext;
import net.i2p.util.I2PAppThread;
import net.i2p.util.Log;

/**
 * Receives announcement datagrams on the broadcast port and feeds them
 * into the {@link PeerDirectory}.
 * Malformed datagrams are logged and dropped.
 *
 * @since 0.9.0
 */
public class AnnouncementListener implements Runnable {

    /** largest UDP payload */
    private static final int BUFSIZE = 65535;

    private final Log _log;
    private final PeerDirectory _directory;
    private final int _port;
    private final AnnouncementCodec _codec = new AnnouncementCodec();
    private volatile boolean stop;
    private DatagramSocket _socket;
    private Thread _thread;
    private volatile int _received;
    private volatile int _dropped;

    /**
     * @param port 0 for any free port, see {@link #getLocalPort()}
     */
    public AnnouncementListener(I2PAppContext ctx, PeerDirectory directory, int port) {
        _log = ctx.logManager().getLog(AnnouncementListener.class);
        _directory = directory;
        _port = port;
    }

    /**
     * Bind and start receiving. May be called even when already running.
     *
     * @throws SocketException if the port cannot be bound
     */
    public synchronized void startListening() throws SocketException {
        if (_thread != null) {return;}
        stop = false;
        DatagramSocket s = new DatagramSocket(null);
        s.setReuseAddress(true);
        s.setBroadcast(true);
        try {
            s.bind(new InetSocketAddress(_port));
        } catch (SocketException se) {
            s.close();
            throw se;
        }
        _socket = s;
        _thread = new I2PAppThread(this, "Chunkcast listener " + s.getLocalPort(), true);
        _thread.start();
        if (_log.shouldInfo()) {_log.info("Listening for announcements on UDP port " + s.getLocalPort());}
    }

    /**
     * Close the socket, which ends the receive loop.
     */
    public synchronized void halt() {
        stop = true;
        if (_socket != null) {
            _socket.close();
        }
        _thread = null;
    }

    public boolean isListening() {
        DatagramSocket s = _socket;
        return !stop && s != null && !s.isClosed();
    }

    /** @return the bound port, or -1 if not listening */
    public int getLocalPort() {
        DatagramSocket s = _socket;
        return s != null ? s.getLocalPort() : -1;
    }

    /** datagrams applied to the directory */
    public int getReceived() {return _received;}

    /** malformed datagrams */
    public int getDropped() {return _dropped;}

    public void run() {
        DatagramSocket s;
        synchronized (this) {
            s = _socket;
        }
        byte[] buf = new byte[BUFSIZE];
        while (!stop) {
            DatagramPacket pkt = new DatagramPacket(buf, buf.length);
            try {
                s.receive(pkt);
            } catch (IOException ioe) {
                if (stop || s.isClosed()) {break;}
                _log.error("Error receiving announcement", ioe);
                continue;
            }
            try {
                handle(pkt);
            } catch (OutOfMemoryError oom) {
                throw oom;
            } catch (RuntimeException re) {
                _log.error("Error processing announcement from " + pkt.getAddress(), re);
            }
        }
        if (_log.shouldInfo()) {_log.info("Announcement listener stopped");}
    }

    /**
     * Decode and apply one datagram.
     */
    void handle(DatagramPacket pkt) {
        Announcement a;
        try {
            a = _codec.decode(pkt.getData(), pkt.getOffset(), pkt.getLength());
        } catch (AnnouncementException ae) {
            _dropped++;
            if (_log.shouldWarn()) {_log.warn("Dropping datagram from " + pkt.getAddress() + ": " + ae.getMessage());}
            return;
        }
        if (_log.shouldDebug()) {_log.debug("Received " + a);}
        _directory.update(a);
        _received++;
    }
}
