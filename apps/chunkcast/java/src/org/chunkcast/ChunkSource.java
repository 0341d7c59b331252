package org.chunkcast;

/**
 * Where the download workers get chunks from.
 *
 * @since 0.9.0
 */
public interface ChunkSource {

    /**
     * Fetch one chunk from one peer into the local chunk store, verified.
     * Never throws for network or integrity trouble, that is reported
     * in the result.
     *
     * @param checksum expected lowercase hex SHA-256
     */
    public FetchResult fetch(String peer, String chunkName, String checksum);
}
