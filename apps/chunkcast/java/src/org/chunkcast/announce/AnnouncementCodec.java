package org.chunkcast.announce;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * JSON encoding of announcements, and the batching that keeps each
 * datagram under the UDP payload limit.
 *
 * @since 0.9.0
 */
public class AnnouncementCodec {

    /** working margin below the 65507 byte UDP payload limit */
    public static final int MAX_DATAGRAM = 60000;
    public static final int DEFAULT_BATCH_SIZE = 8;

    private final Gson _gson = new Gson();

    public byte[] encode(Announcement a) {
        return _gson.toJson(a).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws AnnouncementException on malformed JSON, a missing peer_ip,
     *         a chunk without checksum, or an inconsistent batch_info
     */
    public Announcement decode(byte[] data, int off, int len) throws AnnouncementException {
        String json = new String(data, off, len, StandardCharsets.UTF_8);
        Announcement rv;
        try {
            rv = _gson.fromJson(json, Announcement.class);
        } catch (JsonParseException jpe) {
            throw new AnnouncementException("Malformed announcement JSON", jpe);
        }
        if (rv == null) {
            throw new AnnouncementException("Empty announcement");
        }
        String ip = rv.getPeerIp();
        if (ip == null || ip.trim().length() <= 0) {
            throw new AnnouncementException("Announcement without peer_ip");
        }
        int cur = rv.getBatchCurrent();
        int tot = rv.getBatchTotal();
        if (tot < 1 || cur < 1 || cur > tot) {
            throw new AnnouncementException("Bad batch_info " + cur + '/' + tot + " from " + ip);
        }
        for (Map.Entry<String, ChunkMeta> e : rv.getChunks().entrySet()) {
            ChunkMeta m = e.getValue();
            if (m == null || m.getChecksum() == null || m.getChecksum().length() <= 0) {
                throw new AnnouncementException("Chunk " + e.getKey() + " without checksum from " + ip);
            }
        }
        return rv;
    }

    /**
     * Split the inventory into encoded batches of at most batchSize entries.
     * If any batch encodes larger than {@link #MAX_DATAGRAM}, the whole split is
     * redone with half the batch size, down to one entry per batch.
     *
     * @param chunks in announcement order
     * @return encoded datagrams, empty if chunks is empty
     */
    public List<byte[]> encodeBatches(String peerIp, Map<String, ChunkMeta> chunks, String timestamp, int batchSize) {
        List<Map.Entry<String, ChunkMeta>> items = new ArrayList<Map.Entry<String, ChunkMeta>>(chunks.entrySet());
        int total = (items.size() + batchSize - 1) / batchSize;
        List<byte[]> rv = new ArrayList<byte[]>(total);
        for (int b = 0; b < total; b++) {
            Map<String, ChunkMeta> batch = new LinkedHashMap<String, ChunkMeta>();
            int end = Math.min((b + 1) * batchSize, items.size());
            for (int i = b * batchSize; i < end; i++) {
                Map.Entry<String, ChunkMeta> e = items.get(i);
                batch.put(e.getKey(), e.getValue());
            }
            byte[] data = encode(new Announcement(peerIp, batch, timestamp, b + 1, total));
            if (data.length > MAX_DATAGRAM && batchSize > 1) {
                return encodeBatches(peerIp, chunks, timestamp, Math.max(1, batchSize / 2));
            }
            rv.add(data);
        }
        return rv;
    }
}
