package org.chunkcast.announce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import net.i2p.I2PAppContext;
import net.i2p.data.DataHelper;
import net.i2p.util.Log;
import net.i2p.util.SimpleTimer2;

/**
 * Which peer has which chunk with which checksum, as learned from announcements.
 *
 * <p>Announcements are lossy, duplicated and reordered. Each one replaces a whole
 * batch slot of one peer's inventory, so applying the same announcement twice is a
 * no-op and announcements from different peers commute.
 *
 * <p>All state is guarded by one lock, held for each complete read-modify-write and
 * released before the {@link DirectoryListener} is called.
 *
 * @since 0.9.0
 */
public class PeerDirectory {

    private final I2PAppContext _context;
    private final Log _log;
    private final long _expireTime;
    private final DirectoryListener _listener;
    private final Object _lock = new Object();
    /** address to peer, sorted so the content projection is deterministic */
    private final Map<String, PeerInfo> _peers = new TreeMap<String, PeerInfo>();
    private long _version;
    private volatile boolean _isRunning;
    private Cleaner _cleaner;

    /** how often stale peers are looked for */
    static final long CLEAN_TIME = 60 * 1000;

    /**
     * @param expireTime ms without announcement after which a peer is dropped
     * @param listener may be null
     */
    public PeerDirectory(I2PAppContext ctx, long expireTime, DirectoryListener listener) {
        _context = ctx;
        _log = ctx.logManager().getLog(PeerDirectory.class);
        _expireTime = expireTime;
        _listener = listener;
    }

    /**
     * Start the stale peer reaper. May be called again after stop().
     */
    public synchronized void start() {
        if (_isRunning) {return;}
        _isRunning = true;
        _cleaner = new Cleaner();
        _cleaner.schedule(CLEAN_TIME);
    }

    public synchronized void stop() {
        _isRunning = false;
        if (_cleaner != null) {
            _cleaner.cancel();
            _cleaner = null;
        }
    }

    public boolean isRunning() {return _isRunning;}

    /**
     * Apply an announcement received now.
     *
     * @return true if the directory changed
     */
    public boolean update(Announcement a) {
        return update(a, _context.clock().now());
    }

    /**
     * Apply an announcement. The peer's last seen time is refreshed even if
     * nothing else changed. Announcements without chunks are ignored.
     *
     * @return true if the directory changed
     */
    public boolean update(Announcement a, long now) {
        Map<String, ChunkMeta> chunks = a.getChunks();
        if (chunks.isEmpty()) {
            if (_log.shouldDebug()) {_log.debug("Ignoring empty announcement from " + a.getPeerIp());}
            return false;
        }
        String ip = a.getPeerIp();
        ContentDirectory changed = null;
        synchronized (_lock) {
            PeerInfo peer = _peers.get(ip);
            boolean isNew = peer == null;
            if (isNew) {
                peer = new PeerInfo(ip);
                _peers.put(ip, peer);
            }
            peer.setLastSeen(now);
            if (peer.apply(a.getBatchCurrent(), a.getBatchTotal(), chunks) || isNew) {
                _version++;
                changed = locked_getContentDirectory();
                if (_log.shouldDebug()) {
                    _log.debug("Updated chunks for peer " + ip + ", batch " + a.getBatchCurrent() +
                               '/' + a.getBatchTotal() + ": " + chunks.size() + " chunks");
                }
            }
        }
        if (changed != null) {
            notifyListener(changed);
            return true;
        }
        return false;
    }

    /**
     * Seed from a persisted content directory, as if every listed peer had just
     * announced the listed checksum. Seeded entries are replaced by the peer's
     * first real announcement.
     */
    public void seed(ContentDirectory content, long now) {
        if (content.isEmpty()) {return;}
        Map<String, Map<String, ChunkMeta>> byPeer = new HashMap<String, Map<String, ChunkMeta>>();
        for (Map.Entry<String, ContentEntry> e : content.getEntries().entrySet()) {
            for (String ip : e.getValue().getPeers()) {
                Map<String, ChunkMeta> m = byPeer.get(ip);
                if (m == null) {
                    m = new LinkedHashMap<String, ChunkMeta>();
                    byPeer.put(ip, m);
                }
                m.put(e.getKey(), new ChunkMeta(0, e.getValue().getChecksum(), null));
            }
        }
        synchronized (_lock) {
            for (Map.Entry<String, Map<String, ChunkMeta>> e : byPeer.entrySet()) {
                PeerInfo peer = _peers.get(e.getKey());
                if (peer == null) {
                    peer = new PeerInfo(e.getKey());
                    peer.setLastSeen(now);
                    peer.seed(e.getValue());
                    _peers.put(e.getKey(), peer);
                }
            }
            _version++;
        }
        if (_log.shouldInfo()) {_log.info("Seeded " + byPeer.size() + " peers from saved content directory");}
    }

    /**
     * Drop peers not seen for longer than the expire time.
     *
     * @return the number of peers removed
     */
    public int expireStale(long now) {
        List<String> removed = new ArrayList<String>();
        ContentDirectory changed = null;
        synchronized (_lock) {
            for (Iterator<PeerInfo> iter = _peers.values().iterator(); iter.hasNext(); ) {
                PeerInfo peer = iter.next();
                if (now - peer.lastSeen() > _expireTime) {
                    iter.remove();
                    removed.add(peer.getAddress());
                }
            }
            if (!removed.isEmpty()) {
                _version++;
                changed = locked_getContentDirectory();
            }
        }
        if (changed != null) {
            if (_log.shouldInfo()) {
                _log.info("Removed stale peers " + removed + ", none heard from in " +
                          DataHelper.formatDuration(_expireTime));
            }
            notifyListener(changed);
        }
        return removed.size();
    }

    /**
     * The content directory projection: chunk name to the first checksum seen,
     * with every peer claiming that checksum. Peers are visited in address order;
     * a peer reporting a different checksum is left out of that chunk's list.
     */
    public ContentDirectory getContentDirectory() {
        synchronized (_lock) {
            return locked_getContentDirectory();
        }
    }

    /** caller must synch on _lock */
    private ContentDirectory locked_getContentDirectory() {
        Map<String, String> checksums = new TreeMap<String, String>();
        Map<String, List<String>> peers = new TreeMap<String, List<String>>();
        for (PeerInfo peer : _peers.values()) {
            for (Map.Entry<String, String> e : peer.checksums().entrySet()) {
                String name = e.getKey();
                String sum = e.getValue();
                String known = checksums.get(name);
                if (known == null) {
                    checksums.put(name, sum);
                    List<String> list = new ArrayList<String>(4);
                    list.add(peer.getAddress());
                    peers.put(name, list);
                } else if (!known.equals(sum)) {
                    if (_log.shouldWarn()) {
                        _log.warn("Checksum conflict for " + name + " from " + peer.getAddress() +
                                  ", keeping " + known);
                    }
                } else {
                    List<String> list = peers.get(name);
                    if (!list.contains(peer.getAddress())) {
                        list.add(peer.getAddress());
                    }
                }
            }
        }
        Map<String, ContentEntry> entries = new TreeMap<String, ContentEntry>();
        for (Map.Entry<String, String> e : checksums.entrySet()) {
            entries.put(e.getKey(), new ContentEntry(e.getValue(), peers.get(e.getKey())));
        }
        return new ContentDirectory(entries, _version);
    }

    /** @return sorted snapshot of known peer addresses */
    public Set<String> getPeers() {
        synchronized (_lock) {
            return new TreeSet<String>(_peers.keySet());
        }
    }

    /**
     * @return the chunk name to checksum map last announced by a peer, empty if unknown
     */
    public Map<String, String> getChunks(String peerIp) {
        synchronized (_lock) {
            PeerInfo peer = _peers.get(peerIp);
            if (peer == null) {
                return Collections.emptyMap();
            }
            return peer.checksums();
        }
    }

    /** @return last seen time of a peer, or -1 if unknown */
    public long lastSeen(String peerIp) {
        synchronized (_lock) {
            PeerInfo peer = _peers.get(peerIp);
            return peer != null ? peer.lastSeen() : -1;
        }
    }

    public int size() {
        synchronized (_lock) {
            return _peers.size();
        }
    }

    private void notifyListener(ContentDirectory content) {
        if (_listener == null) {return;}
        try {
            _listener.directoryChanged(content);
        } catch (RuntimeException re) {
            _log.error("Directory listener failed", re);
        }
    }

    private class Cleaner extends SimpleTimer2.TimedEvent {

        public Cleaner() {
            super(_context.simpleTimer2());
        }

        public void timeReached() {
            if (!_isRunning) {return;}
            try {
                expireStale(_context.clock().now());
            } catch (RuntimeException re) {
                _log.error("Error removing stale peers", re);
            }
            if (_isRunning) {
                schedule(CLEAN_TIME);
            }
        }
    }
}
