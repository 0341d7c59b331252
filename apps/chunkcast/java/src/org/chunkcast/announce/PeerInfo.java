package org.chunkcast.announce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * What the directory knows about one peer.
 *
 * <p>A peer announces its inventory in numbered batches. Each batch slot is
 * replaced wholesale by the next announcement for that slot, and the peer's
 * chunk map is the union of its slots, the most recently written slot winning
 * if a chunk name shows up twice.
 *
 * <p>Not thread safe, PeerDirectory synchronizes.
 *
 * @since 0.9.0
 */
class PeerInfo {

    /** slot for entries loaded from a persisted content directory */
    static final int SEED_SLOT = 0;

    private final String _address;
    private long _lastSeen;
    private final Map<Integer, Slot> _slots = new HashMap<Integer, Slot>();
    private long _seq;

    PeerInfo(String address) {
        _address = address;
    }

    String getAddress() {return _address;}

    long lastSeen() {return _lastSeen;}

    void setLastSeen(long now) {_lastSeen = now;}

    /**
     * Replace one batch slot.
     *
     * @param current 1-based slot
     * @param total slots above this are dropped
     * @return true if the union of chunk checksums changed
     */
    boolean apply(int current, int total, Map<String, ChunkMeta> chunks) {
        Map<String, String> before = checksums();
        _slots.remove(Integer.valueOf(SEED_SLOT));
        for (Iterator<Integer> iter = _slots.keySet().iterator(); iter.hasNext(); ) {
            if (iter.next().intValue() > total) {
                iter.remove();
            }
        }
        _slots.put(Integer.valueOf(current), new Slot(chunks, ++_seq));
        return !before.equals(checksums());
    }

    /**
     * Entries known from disk, dropped at the first real announcement.
     */
    void seed(Map<String, ChunkMeta> chunks) {
        Slot s = _slots.get(Integer.valueOf(SEED_SLOT));
        Map<String, ChunkMeta> merged = new LinkedHashMap<String, ChunkMeta>();
        if (s != null) {
            merged.putAll(s.chunks);
        }
        merged.putAll(chunks);
        _slots.put(Integer.valueOf(SEED_SLOT), new Slot(merged, 0));
    }

    /**
     * @return chunk name to meta, sorted by name
     */
    Map<String, ChunkMeta> chunks() {
        List<Slot> ordered = new ArrayList<Slot>(_slots.values());
        Collections.sort(ordered, new Comparator<Slot>() {
            public int compare(Slot a, Slot b) {
                return Long.compare(a.seq, b.seq);
            }
        });
        Map<String, ChunkMeta> rv = new TreeMap<String, ChunkMeta>();
        for (Slot s : ordered) {
            rv.putAll(s.chunks);
        }
        return rv;
    }

    /**
     * @return chunk name to checksum, sorted by name
     */
    Map<String, String> checksums() {
        Map<String, String> rv = new TreeMap<String, String>();
        for (Map.Entry<String, ChunkMeta> e : chunks().entrySet()) {
            rv.put(e.getKey(), e.getValue().getChecksum());
        }
        return rv;
    }

    @Override
    public String toString() {
        return "Peer " + _address + " (" + _slots.size() + " batches)";
    }

    private static class Slot {
        final Map<String, ChunkMeta> chunks;
        final long seq;

        Slot(Map<String, ChunkMeta> chunks, long seq) {
            this.chunks = new LinkedHashMap<String, ChunkMeta>(chunks);
            this.seq = seq;
        }
    }
}
