package org.chunkcast.announce;

/**
 * What a peer reports about one chunk it holds.
 * Field names are those of the announcement JSON.
 *
 * @since 0.9.0
 */
public class ChunkMeta {

    private long size;
    private String checksum;
    private String timestamp;

    /** for Gson */
    ChunkMeta() {}

    public ChunkMeta(long size, String checksum, String timestamp) {
        this.size = size;
        this.checksum = checksum;
        this.timestamp = timestamp;
    }

    public long getSize() {return size;}

    /** lowercase hex SHA-256, may be null in a malformed announcement */
    public String getChecksum() {return checksum;}

    public String getTimestamp() {return timestamp;}

    @Override
    public String toString() {
        return "[size=" + size + " checksum=" + checksum + ']';
    }
}
