/* ChunkStore - Local chunk files: listing, hashing, splitting and stitching.
   This file is part of Chunkcast.
   Licensed under the GPL version 2 or later.
*/

package org.chunkcast;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import net.i2p.I2PAppContext;
import net.i2p.crypto.SHA256Generator;
import net.i2p.data.DataHelper;
import net.i2p.util.Log;

/**
 * The directory of chunk files held by this peer.
 *
 * <p>Chunks are plain files named after {@link ChunkName}. Files starting with a dot
 * are never listed; incoming transfers use such hidden names until verified.
 *
 * <p>Thread safe, the file system is the only state.
 *
 * @since 0.9.0
 */
public class ChunkStore {

    private final Log _log;
    private final File _dir;

    /** read block for hashing and copying */
    private static final int BUFSIZE = 64 * 1024;
    private static final String TEMP_SUFFIX = ".part";

    public ChunkStore(I2PAppContext ctx, File dir) {
        _log = ctx.logManager().getLog(ChunkStore.class);
        _dir = dir;
    }

    public File getDirectory() {return _dir;}

    /**
     * @throws IOException if the directory cannot be created
     */
    public void ensureDirectory() throws IOException {
        ensureDir(_dir);
    }

    private static void ensureDir(File dir) throws IOException {
        if (!dir.isDirectory() && !dir.mkdirs() && !dir.isDirectory()) {
            throw new IOException("Cannot create directory " + dir.getAbsolutePath());
        }
    }

    /**
     * @return sorted names of the regular, non-hidden files, empty if the directory is missing
     */
    public List<String> list() {
        File[] files = _dir.listFiles();
        if (files == null) {
            return Collections.emptyList();
        }
        List<String> rv = new ArrayList<String>(files.length);
        for (File f : files) {
            String name = f.getName();
            if (!f.isFile() || name.startsWith(".")) {
                continue;
            }
            try {
                if (Files.isHidden(f.toPath())) {continue;}
            } catch (IOException ioe) {
                continue;
            }
            rv.add(name);
        }
        Collections.sort(rv);
        return rv;
    }

    /**
     * @return the file for a chunk name received from the network,
     *         or null if the name is unsafe or the chunk is not held
     */
    public File getChunk(String chunkName) {
        if (!ChunkName.isSafe(chunkName)) {
            return null;
        }
        File f = new File(_dir, chunkName);
        return f.isFile() ? f : null;
    }

    /**
     * A fresh hidden file for receiving a chunk. Caller must either
     * {@link #commit(File, String)} or delete it.
     */
    public File createTempFile(String chunkName) throws IOException {
        ensureDirectory();
        return File.createTempFile("." + chunkName + '.', TEMP_SUFFIX, _dir);
    }

    /**
     * Move a verified temp file to its chunk name, replacing any existing copy.
     */
    public File commit(File temp, String chunkName) throws IOException {
        if (!ChunkName.isSafe(chunkName)) {
            throw new IOException("Bad chunk name: " + chunkName);
        }
        File dest = new File(_dir, chunkName);
        move(temp, dest);
        return dest;
    }

    private static void move(File from, File to) throws IOException {
        try {
            Files.move(from.toPath(), to.toPath(), StandardCopyOption.REPLACE_EXISTING,
                       StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException amnse) {
            Files.move(from.toPath(), to.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * @return lowercase hex SHA-256 of the file contents
     */
    public static String checksum(File f) throws IOException {
        MessageDigest sha = SHA256Generator.getDigestInstance();
        byte[] buf = new byte[BUFSIZE];
        InputStream in = null;
        try {
            in = new FileInputStream(f);
            int read;
            while ((read = in.read(buf)) != -1) {
                sha.update(buf, 0, read);
            }
        } finally {
            if (in != null) try {in.close();} catch (IOException ioe) {}
        }
        return toHex(sha.digest());
    }

    /**
     * Like DataHelper.toHexString but keeps leading zero bytes
     */
    public static String toHex(byte[] b) {
        StringBuilder buf = new StringBuilder(b.length * 2);
        for (int i = 0; i < b.length; i++) {
            int bi = b[i] & 0xff;
            if (bi < 16) {
                buf.append('0');
            }
            buf.append(Integer.toHexString(bi));
        }
        return buf.toString();
    }

    /**
     * Cut a file into chunks of chunkSize bytes, the last one possibly shorter.
     *
     * @return the chunk names written, in order
     * @throws IOException on read or write failure; chunks already written are left in place
     */
    public List<String> split(File source, int chunkSize) throws IOException {
        if (!source.isFile()) {
            throw new IOException("Not a file: " + source.getAbsolutePath());
        }
        ensureDirectory();
        ChunkName names = new ChunkName(source.getName());
        if (_log.shouldInfo()) {
            _log.info("Splitting " + source + " (" + DataHelper.formatSize(source.length()) +
                      "B) into " + chunkSize + " byte chunks");
        }
        List<String> rv = new ArrayList<String>();
        byte[] buf = new byte[BUFSIZE];
        InputStream in = null;
        try {
            in = new BufferedInputStream(new FileInputStream(source), BUFSIZE);
            int ordinal = 1;
            boolean eof = false;
            while (!eof) {
                int len = in.read(buf, 0, Math.min(buf.length, chunkSize));
                if (len < 0) {break;}
                String name = names.chunk(ordinal++);
                long written = 0;
                try (OutputStream out = new BufferedOutputStream(new FileOutputStream(new File(_dir, name)), BUFSIZE)) {
                    out.write(buf, 0, len);
                    written = len;
                    while (written < chunkSize) {
                        int read = in.read(buf, 0, (int) Math.min(buf.length, chunkSize - written));
                        if (read < 0) {
                            eof = true;
                            break;
                        }
                        out.write(buf, 0, read);
                        written += read;
                    }
                }
                if (_log.shouldDebug()) {_log.debug("Created chunk " + name + " (" + written + " bytes)");}
                rv.add(name);
            }
        } finally {
            if (in != null) try {in.close();} catch (IOException ioe) {}
        }
        return rv;
    }

    /**
     * Concatenate all chunks of a content present in the store.
     *
     * @param expected chunk count required, or -1 to take whatever is present
     * @see #stitch(ChunkName, List, File)
     */
    public File stitch(ChunkName content, File destDir, int expected) throws IOException {
        List<String> chunks = new ArrayList<String>();
        for (String name : list()) {
            if (content.matches(name)) {
                chunks.add(name);
            }
        }
        if (chunks.isEmpty() || (expected >= 0 && chunks.size() != expected)) {
            throw new IOException("Expected " + expected + " chunks of " + content + ", found " + chunks.size());
        }
        return stitch(content, chunks, destDir);
    }

    /**
     * Concatenate the given chunks in numeric ordinal order into
     * {@code destDir/<content>}, then delete them.
     * The output is written to a hidden file first and renamed when complete.
     *
     * @return the output file
     * @throws IOException if a chunk is missing or on write failure; no output file is left behind
     */
    public File stitch(ChunkName content, List<String> names, File destDir) throws IOException {
        if (names.isEmpty()) {
            throw new IOException("No chunks of " + content);
        }
        List<String> chunks = new ArrayList<String>(names);
        Collections.sort(chunks, content.ordinalOrder());
        ensureDir(destDir);
        File dest = new File(destDir, content.getContent());
        File temp = new File(destDir, "." + content.getContent() + TEMP_SUFFIX);
        byte[] buf = new byte[BUFSIZE];
        OutputStream out = null;
        boolean ok = false;
        List<File> consumed = new ArrayList<File>(chunks.size());
        try {
            out = new BufferedOutputStream(new FileOutputStream(temp), BUFSIZE);
            for (String name : chunks) {
                File f = getChunk(name);
                if (f == null) {
                    throw new IOException("Missing chunk " + name);
                }
                InputStream in = null;
                try {
                    in = new FileInputStream(f);
                    int read;
                    while ((read = in.read(buf)) != -1) {
                        out.write(buf, 0, read);
                    }
                } finally {
                    if (in != null) try {in.close();} catch (IOException ioe) {}
                }
                consumed.add(f);
            }
            out.close();
            out = null;
            move(temp, dest);
            ok = true;
        } finally {
            if (out != null) try {out.close();} catch (IOException ioe) {}
            if (!ok) {
                temp.delete();
            }
        }
        for (File f : consumed) {
            if (!f.delete() && _log.shouldWarn()) {
                _log.warn("Could not delete consumed chunk " + f);
            }
        }
        if (_log.shouldInfo()) {
            _log.info("Reassembled " + dest + " from " + chunks.size() + " chunks: " +
                      Arrays.toString(chunks.toArray()));
        }
        return dest;
    }
}
