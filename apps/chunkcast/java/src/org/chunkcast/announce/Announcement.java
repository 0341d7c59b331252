package org.chunkcast.announce;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.annotations.SerializedName;

/**
 * One announcement datagram: a batch of the chunks one peer holds.
 *
 * <pre>
 * {"peer_ip": "10.0.0.5",
 *  "chunks": {"movie_1.mp4": {"size": 102400, "checksum": "ab12...", "timestamp": "2024-05-01 10:00:00"}},
 *  "timestamp": "2024-05-01 10:00:00",
 *  "batch_info": {"current": 1, "total": 3}}
 * </pre>
 *
 * @since 0.9.0
 */
public class Announcement {

    @SerializedName("peer_ip")
    private String peerIp;

    private Map<String, ChunkMeta> chunks;

    private String timestamp;

    @SerializedName("batch_info")
    private BatchInfo batchInfo;

    /** for Gson */
    Announcement() {}

    /**
     * @param current 1-based batch index
     * @param total number of batches in this cycle
     */
    public Announcement(String peerIp, Map<String, ChunkMeta> chunks, String timestamp, int current, int total) {
        this.peerIp = peerIp;
        this.chunks = new LinkedHashMap<String, ChunkMeta>(chunks);
        this.timestamp = timestamp;
        this.batchInfo = new BatchInfo(current, total);
    }

    public String getPeerIp() {return peerIp;}

    /** @return non-null, unmodifiable */
    public Map<String, ChunkMeta> getChunks() {
        if (chunks == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(chunks);
    }

    public String getTimestamp() {return timestamp;}

    /** 1 if absent */
    public int getBatchCurrent() {
        return batchInfo != null ? batchInfo.current : 1;
    }

    /** 1 if absent */
    public int getBatchTotal() {
        return batchInfo != null ? batchInfo.total : 1;
    }

    @Override
    public String toString() {
        return "Announcement from " + peerIp + ": " + getChunks().size() + " chunks, batch " +
               getBatchCurrent() + '/' + getBatchTotal();
    }

    static class BatchInfo {
        private int current;
        private int total;

        BatchInfo() {}

        BatchInfo(int current, int total) {
            this.current = current;
            this.total = total;
        }
    }
}
