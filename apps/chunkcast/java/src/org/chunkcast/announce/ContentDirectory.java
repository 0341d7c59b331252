package org.chunkcast.announce;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable snapshot of chunk name to {checksum, peers}, as derived from the
 * peer directory or loaded from disk.
 *
 * @since 0.9.0
 */
public class ContentDirectory {

    private final SortedMap<String, ContentEntry> _entries;
    private final long _version;

    /**
     * @param version increases with every change of the source directory, 0 if loaded
     */
    public ContentDirectory(Map<String, ContentEntry> entries, long version) {
        _entries = Collections.unmodifiableSortedMap(new TreeMap<String, ContentEntry>(entries));
        _version = version;
    }

    public static ContentDirectory empty() {
        return new ContentDirectory(Collections.<String, ContentEntry>emptyMap(), 0);
    }

    /** sorted by chunk name, unmodifiable */
    public SortedMap<String, ContentEntry> getEntries() {return _entries;}

    /** @return null if unknown */
    public ContentEntry get(String chunkName) {return _entries.get(chunkName);}

    public int size() {return _entries.size();}

    public boolean isEmpty() {return _entries.isEmpty();}

    public long getVersion() {return _version;}

    /** compares entries only, not the version */
    @Override
    public boolean equals(Object o) {
        return o instanceof ContentDirectory && _entries.equals(((ContentDirectory) o)._entries);
    }

    @Override
    public int hashCode() {
        return _entries.hashCode();
    }

    @Override
    public String toString() {
        return "ContentDirectory v" + _version + ' ' + _entries;
    }
}
