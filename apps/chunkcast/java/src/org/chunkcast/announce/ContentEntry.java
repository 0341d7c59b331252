package org.chunkcast.announce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One chunk of the content directory: its checksum and the peers that
 * currently claim that checksum, in the order they should be tried.
 *
 * @since 0.9.0
 */
public class ContentEntry {

    private String checksum;
    private List<String> peers;

    /** for Gson */
    ContentEntry() {}

    public ContentEntry(String checksum, List<String> peers) {
        this.checksum = checksum;
        this.peers = new ArrayList<String>(peers);
    }

    public String getChecksum() {return checksum;}

    /** @return non-null, unmodifiable */
    public List<String> getPeers() {
        if (peers == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(peers);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ContentEntry)) {
            return false;
        }
        ContentEntry e = (ContentEntry) o;
        return checksum != null && checksum.equals(e.checksum) && getPeers().equals(e.getPeers());
    }

    @Override
    public int hashCode() {
        return (checksum != null ? checksum.hashCode() : 0) ^ getPeers().hashCode();
    }

    @Override
    public String toString() {
        return "[checksum=" + checksum + " peers=" + getPeers() + ']';
    }
}
