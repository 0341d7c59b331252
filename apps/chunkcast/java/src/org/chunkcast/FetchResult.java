package org.chunkcast;

/**
 * Outcome of one attempt to fetch one chunk from one peer.
 *
 * @since 0.9.0
 */
public enum FetchResult {
    /** received, verified and stored */
    OK,
    /** connect, send or receive failed, timed out, or the peer closed early */
    TRANSPORT_ERROR,
    /** the response header could not be parsed */
    PROTOCOL_ERROR,
    /** the peer does not have the chunk */
    NOT_FOUND,
    /** wrong byte count or checksum */
    INTEGRITY_ERROR;

    /**
     * @return true if the connection used for the attempt can no longer be trusted
     */
    public boolean isConnectionBroken() {
        return this == TRANSPORT_ERROR || this == PROTOCOL_ERROR;
    }
}
