/* Announcer - Periodically broadcasts the chunks this peer holds.
   This file is part of Chunkcast.
   Licensed under the GPL version 2 or later.
*/

package org.chunkcast.announce;

import java.io.File;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InterfaceAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.chunkcast.ChunkStore;

import net.i2p.I2PAppContext;
import net.i2p.data.DataHelper;
import net.i2p.util.I2PAppThread;
import net.i2p.util.Log;

/**
 * Announces the local chunk inventory over UDP broadcast.
 *
 * <p>Every cycle the chunk directory is scanned, checksums are computed (and cached
 * per name, size and modification time, since a chunk never changes without its
 * checksum changing) and the inventory is sent as one or more batches to every
 * target port. Each batch is sent to the first destination that accepts it, in order:
 * <ol>
 * <li>the directed broadcast address of the local interface's subnet</li>
 * <li>the limited broadcast address 255.255.255.255</li>
 * <li>loopback</li>
 * </ol>
 * Failures are logged and never stop the loop.
 *
 * @since 0.9.0
 */
public class Announcer implements Runnable {

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String LIMITED_BROADCAST = "255.255.255.255";

    private final Log _log;
    private final ChunkStore _store;
    private final List<Integer> _ports;
    private final long _interval;
    private final AnnouncementCodec _codec = new AnnouncementCodec();
    private final Map<String, CachedSum> _sums = new HashMap<String, CachedSum>();
    private final Object _sleeper = new Object();
    private volatile String _peerIp;
    private volatile boolean _stop;
    private Thread _thread;
    private DatagramSocket _socket;

    /**
     * @param peerIp address to announce, or null to detect the local address each cycle
     * @param interval ms between cycles
     */
    public Announcer(I2PAppContext ctx, ChunkStore store, List<Integer> ports, long interval, String peerIp) {
        _log = ctx.logManager().getLog(Announcer.class);
        _store = store;
        _ports = new ArrayList<Integer>(ports);
        _interval = interval;
        _peerIp = peerIp;
    }

    /**
     * May be called even when already running.
     */
    public synchronized void startAnnouncing() throws SocketException {
        if (_thread != null) {return;}
        _stop = false;
        _socket = new DatagramSocket();
        _socket.setBroadcast(true);
        _thread = new I2PAppThread(this, "Chunkcast announcer", true);
        _thread.start();
        if (_log.shouldInfo()) {_log.info("Announcing to ports " + _ports + " every " + DataHelper.formatDuration(_interval));}
    }

    public synchronized void halt() {
        _stop = true;
        synchronized (_sleeper) {
            _sleeper.notifyAll();
        }
        Thread t = _thread;
        if (t != null) {
            t.interrupt();
            _thread = null;
        }
        if (_socket != null) {
            _socket.close();
            _socket = null;
        }
    }

    public void run() {
        while (!_stop) {
            try {
                announceOnce();
            } catch (OutOfMemoryError oom) {
                throw oom;
            } catch (Throwable t) {
                _log.error("Error in announcement cycle", t);
            }
            synchronized (_sleeper) {
                if (_stop) {break;}
                try {_sleeper.wait(_interval);}
                catch (InterruptedException ie) {}
            }
        }
        if (_log.shouldInfo()) {_log.info("Announcer stopped");}
    }

    /**
     * One announcement cycle.
     *
     * @return the number of batches delivered to at least one destination, summed over ports
     */
    public int announceOnce() {
        Map<String, ChunkMeta> chunks = scan();
        if (chunks.isEmpty()) {
            if (_log.shouldInfo()) {_log.info("No chunks available to announce");}
            return 0;
        }
        String ip = _peerIp != null ? _peerIp : localAddress();
        String now = LocalDateTime.now().format(TIMESTAMP);
        List<byte[]> batches = _codec.encodeBatches(ip, chunks, now, AnnouncementCodec.DEFAULT_BATCH_SIZE);
        int sent = 0;
        for (int port : _ports) {
            for (int i = 0; i < batches.size(); i++) {
                byte[] data = batches.get(i);
                if (data.length > AnnouncementCodec.MAX_DATAGRAM) {
                    _log.warn("Batch " + (i + 1) + '/' + batches.size() + " still too large (" + data.length + " bytes), not sent");
                    continue;
                }
                if (sendBatch(data, port, "batch " + (i + 1) + '/' + batches.size())) {
                    sent++;
                }
            }
        }
        if (_log.shouldInfo()) {
            _log.info("Announced " + chunks.size() + " chunks in " + batches.size() + " batches as " + ip);
        }
        return sent;
    }

    /**
     * Current inventory, checksums cached by name, size and modification time.
     */
    Map<String, ChunkMeta> scan() {
        Map<String, ChunkMeta> rv = new LinkedHashMap<String, ChunkMeta>();
        String now = LocalDateTime.now().format(TIMESTAMP);
        List<String> names = _store.list();
        synchronized (_sums) {
            _sums.keySet().retainAll(names);
            for (String name : names) {
                File f = new File(_store.getDirectory(), name);
                long size = f.length();
                long mod = f.lastModified();
                CachedSum c = _sums.get(name);
                if (c == null || c.size != size || c.modified != mod) {
                    try {
                        c = new CachedSum(size, mod, ChunkStore.checksum(f));
                    } catch (IOException ioe) {
                        if (_log.shouldWarn()) {_log.warn("Cannot checksum " + f, ioe);}
                        _sums.remove(name);
                        continue;
                    }
                    _sums.put(name, c);
                }
                rv.put(name, new ChunkMeta(size, c.checksum, now));
            }
        }
        return rv;
    }

    /**
     * Send to the first destination that takes it.
     *
     * @return false if every strategy failed
     */
    boolean sendBatch(byte[] data, int port, String desc) {
        for (InetAddress dest : destinations()) {
            try {
                send(new DatagramPacket(data, data.length, dest, port));
                if (_log.shouldDebug()) {_log.debug("Sent " + desc + " (" + data.length + " bytes) to " + dest.getHostAddress() + ':' + port);}
                return true;
            } catch (IOException ioe) {
                if (_log.shouldWarn()) {
                    _log.warn("Send of " + desc + " to " + dest.getHostAddress() + ':' + port + " failed: " + ioe.getMessage());
                }
            }
        }
        _log.error("All broadcast methods failed for " + desc + " on port " + port);
        return false;
    }

    /**
     * Delivery strategies in order of preference.
     */
    protected List<InetAddress> destinations() {
        List<InetAddress> rv = new ArrayList<InetAddress>(3);
        InetAddress subnet = subnetBroadcast();
        if (subnet != null) {
            rv.add(subnet);
        }
        try {
            rv.add(InetAddress.getByName(LIMITED_BROADCAST));
        } catch (UnknownHostException uhe) {}
        rv.add(InetAddress.getLoopbackAddress());
        return rv;
    }

    protected void send(DatagramPacket packet) throws IOException {
        DatagramSocket s;
        synchronized (this) {
            s = _socket;
            if (s == null) {
                if (_stop) {
                    throw new IOException("Announcer halted");
                }
                _socket = s = new DatagramSocket();
                s.setBroadcast(true);
            }
        }
        s.send(packet);
    }

    /**
     * @return the broadcast address of the interface carrying the local address, or null
     */
    InetAddress subnetBroadcast() {
        try {
            InetAddress local = InetAddress.getByName(localAddress());
            if (local.isLoopbackAddress()) {return null;}
            NetworkInterface ni = NetworkInterface.getByInetAddress(local);
            if (ni == null) {return null;}
            for (InterfaceAddress ia : ni.getInterfaceAddresses()) {
                if (local.equals(ia.getAddress()) && ia.getBroadcast() != null) {
                    return ia.getBroadcast();
                }
            }
        } catch (IOException ioe) {
            if (_log.shouldDebug()) {_log.debug("No subnet broadcast address", ioe);}
        }
        return null;
    }

    /**
     * The address other peers should connect to: the source address of a UDP
     * socket routed towards a public address, loopback when offline.
     */
    public static String localAddress() {
        try (DatagramSocket sock = new DatagramSocket()) {
            sock.connect(InetAddress.getByName("8.8.8.8"), 10002);
            InetAddress addr = sock.getLocalAddress();
            if (addr == null || addr.isAnyLocalAddress()) {
                return "127.0.0.1";
            }
            return addr.getHostAddress();
        } catch (IOException ioe) {
            return "127.0.0.1";
        }
    }

    /** @return the fixed announce address, or null when detected */
    public String getPeerIp() {return _peerIp;}

    public List<Integer> getPorts() {return Collections.unmodifiableList(_ports);}

    private static class CachedSum {
        final long size;
        final long modified;
        final String checksum;

        CachedSum(long size, long modified, String checksum) {
            this.size = size;
            this.modified = modified;
            this.checksum = checksum;
        }
    }
}
