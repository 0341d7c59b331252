package org.chunkcast.announce;

/**
 * Callback when the peer directory changes.
 *
 * @since 0.9.0
 */
public interface DirectoryListener {

    /**
     * Called after a mutating update or a stale peer removal,
     * never while the directory lock is held.
     */
    void directoryChanged(ContentDirectory content);
}
