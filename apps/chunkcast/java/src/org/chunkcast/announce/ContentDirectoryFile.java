package org.chunkcast.announce;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import net.i2p.I2PAppContext;
import net.i2p.util.Log;

/**
 * The content directory as a JSON file:
 * <pre>
 * {"movie_1.mp4": {"checksum": "ab12...", "peers": ["10.0.0.5", "10.0.0.7"]}}
 * </pre>
 * Written by the listener whenever the peer directory changes, read by downloads.
 * Writes go to a temp file that is renamed over the old one, so a reader
 * never sees a partial file.
 *
 * @since 0.9.0
 */
public class ContentDirectoryFile implements DirectoryListener {

    private static final Type MAP_TYPE = new TypeToken<Map<String, ContentEntry>>() {}.getType();

    private final Log _log;
    private final File _file;
    private final Gson _gson = new GsonBuilder().setPrettyPrinting().create();
    /** highest version written, so a slow writer cannot replace newer content */
    private long _written = -1;

    public ContentDirectoryFile(I2PAppContext ctx, File file) {
        _log = ctx.logManager().getLog(ContentDirectoryFile.class);
        _file = file;
    }

    public File getFile() {return _file;}

    /**
     * @return empty if the file does not exist
     * @throws IOException if unreadable or not a content directory
     */
    public ContentDirectory load() throws IOException {
        if (!_file.exists()) {
            return ContentDirectory.empty();
        }
        Map<String, ContentEntry> entries;
        try (Reader in = Files.newBufferedReader(_file.toPath(), StandardCharsets.UTF_8)) {
            entries = _gson.fromJson(in, MAP_TYPE);
        } catch (JsonParseException jpe) {
            throw new IOException("Corrupt content directory " + _file, jpe);
        }
        if (entries == null) {
            return ContentDirectory.empty();
        }
        for (Map.Entry<String, ContentEntry> e : entries.entrySet()) {
            if (e.getValue() == null || e.getValue().getChecksum() == null) {
                throw new IOException("Entry without checksum in " + _file + ": " + e.getKey());
            }
        }
        return new ContentDirectory(entries, 0);
    }

    /**
     * Write unless a newer version has already been written.
     *
     * @return true if written
     */
    public synchronized boolean store(ContentDirectory content) throws IOException {
        if (content.getVersion() != 0 && content.getVersion() <= _written) {
            return false;
        }
        File dir = _file.getAbsoluteFile().getParentFile();
        if (dir != null && !dir.isDirectory() && !dir.mkdirs()) {
            throw new IOException("Cannot create directory " + dir);
        }
        File tmp = new File(_file.getPath() + ".tmp");
        try (Writer out = Files.newBufferedWriter(tmp.toPath(), StandardCharsets.UTF_8)) {
            _gson.toJson(content.getEntries(), MAP_TYPE, out);
        }
        try {
            Files.move(tmp.toPath(), _file.toPath(), StandardCopyOption.REPLACE_EXISTING,
                       StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException amnse) {
            Files.move(tmp.toPath(), _file.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
        _written = Math.max(_written, content.getVersion());
        return true;
    }

    /**
     * Persist on every change. Failures are logged, the listener keeps running.
     */
    public void directoryChanged(ContentDirectory content) {
        try {
            if (store(content) && _log.shouldDebug()) {
                _log.debug("Saved content directory v" + content.getVersion() + " with " +
                           content.size() + " chunks to " + _file);
            }
        } catch (IOException ioe) {
            _log.error("Error saving content directory to " + _file, ioe);
        }
    }
}
