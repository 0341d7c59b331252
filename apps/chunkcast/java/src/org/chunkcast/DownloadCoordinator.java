/* DownloadCoordinator - Fetches all chunks of a content in parallel and reassembles it.
   This file is part of Chunkcast.
   Licensed under the GPL version 2 or later.
*/

package org.chunkcast;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.chunkcast.announce.ContentDirectory;
import org.chunkcast.announce.ContentEntry;

import net.i2p.I2PAppContext;
import net.i2p.data.DataHelper;
import net.i2p.util.I2PAppThread;
import net.i2p.util.Log;

/**
 * Downloads a content by name.
 *
 * <p>Every chunk the content directory lists for the content is queued with
 * its checksum and candidate peers. A few workers take chunks off the queue and
 * try the peers in the listed order until one delivers a verified copy; a chunk
 * no peer could deliver is given up on, not retried. When every chunk is
 * verified the chunks are reassembled in ordinal order into the download
 * directory. A job that fails or times out leaves no output file.
 *
 * @since 0.9.0
 */
public class DownloadCoordinator {

    /** how long an idle worker waits for more work before exiting */
    static final long POLL_TIME = 500;

    private final I2PAppContext _context;
    private final Log _log;
    private final ChunkStore _store;
    private final ChunkSource _source;
    private final File _downloadDir;
    private final int _maxWorkers;
    private final long _timeout;

    /**
     * @param maxWorkers upper bound on concurrent fetches
     * @param timeout ms the whole job may take
     */
    public DownloadCoordinator(I2PAppContext ctx, ChunkStore store, ChunkSource source,
                               File downloadDir, int maxWorkers, long timeout) {
        _context = ctx;
        _log = ctx.logManager().getLog(DownloadCoordinator.class);
        _store = store;
        _source = source;
        _downloadDir = downloadDir;
        _maxWorkers = maxWorkers;
        _timeout = timeout;
    }

    /**
     * Fetch and reassemble a content. Blocks until done or timed out.
     *
     * @param contentName e.g. "movie.mp4"
     */
    public DownloadResult download(String contentName, ContentDirectory directory) {
        long start = _context.clock().now();
        ChunkName content = new ChunkName(contentName);
        List<DownloadJob.Item> items = new ArrayList<DownloadJob.Item>();
        List<String> present = new ArrayList<String>();
        for (Map.Entry<String, ContentEntry> e : directory.getEntries().entrySet()) {
            String chunk = e.getKey();
            if (!content.matches(chunk)) {continue;}
            String checksum = e.getValue().getChecksum();
            if (haveVerified(chunk, checksum)) {
                present.add(chunk);
            } else {
                items.add(new DownloadJob.Item(chunk, checksum, e.getValue().getPeers()));
            }
        }
        if (items.isEmpty() && present.isEmpty()) {
            _log.error("No chunks available for " + contentName);
            return DownloadResult.failure(contentName, 0, new ArrayList<String>(), "no chunks available",
                                          _context.clock().now() - start);
        }
        List<String> chunks = new ArrayList<String>(present);
        for (DownloadJob.Item item : items) {
            chunks.add(item.chunk);
        }
        Collections.sort(chunks, content.ordinalOrder());
        int total = chunks.size();
        DownloadJob job = new DownloadJob(content, items);
        if (_log.shouldInfo()) {
            _log.info("Downloading " + contentName + ": " + total + " chunks, " +
                      present.size() + " already held");
        }

        if (!items.isEmpty()) {
            int workers = Math.min(_maxWorkers, items.size());
            for (int i = 0; i < workers; i++) {
                Thread t = new I2PAppThread(new Worker(job), "Chunkcast download " + (i + 1) + '/' + workers, true);
                t.start();
            }
            boolean signalled;
            try {
                signalled = job.await(_timeout);
            } catch (InterruptedException ie) {
                job.abandon();
                Thread.currentThread().interrupt();
                return fail(contentName, total, job, "interrupted", start);
            }
            if (!signalled) {
                job.abandon();
                return fail(contentName, total, job,
                            "timed out after " + DataHelper.formatDuration(_timeout), start);
            }
            if (!job.isComplete()) {
                return fail(contentName, total, job, "no peer could supply " + job.getFailed(), start);
            }
        }

        try {
            File out = _store.stitch(content, chunks, _downloadDir);
            long elapsed = _context.clock().now() - start;
            if (_log.shouldInfo()) {
                _log.info("Downloaded " + contentName + " (" + DataHelper.formatSize(out.length()) + "B) in " +
                          DataHelper.formatDuration(elapsed));
            }
            return DownloadResult.success(contentName, out, total, elapsed);
        } catch (IOException ioe) {
            _log.error("Reassembly of " + contentName + " failed", ioe);
            return DownloadResult.failure(contentName, total, new ArrayList<String>(),
                                          "reassembly failed: " + ioe.getMessage(),
                                          _context.clock().now() - start);
        }
    }

    private DownloadResult fail(String contentName, int total, DownloadJob job, String reason, long start) {
        List<String> missing = job.getMissing();
        _log.error("Download of " + contentName + " failed: " + reason + ", missing " + missing);
        return DownloadResult.failure(contentName, total, missing, reason, _context.clock().now() - start);
    }

    /**
     * A local copy with the listed checksum needs no transfer.
     */
    private boolean haveVerified(String chunk, String checksum) {
        File f = _store.getChunk(chunk);
        if (f == null) {return false;}
        try {
            return ChunkStore.checksum(f).equalsIgnoreCase(checksum);
        } catch (IOException ioe) {
            if (_log.shouldWarn()) {_log.warn("Cannot checksum local " + f, ioe);}
            return false;
        }
    }

    /**
     * Takes chunks off the queue until it runs dry or the job is over.
     */
    private class Worker implements Runnable {
        private final DownloadJob _job;

        public Worker(DownloadJob job) {_job = job;}

        public void run() {
            while (true) {
                DownloadJob.Item item;
                try {
                    item = _job.poll(POLL_TIME);
                } catch (InterruptedException ie) {
                    break;
                }
                if (item == null) {break;}
                try {
                    if (fetch(item)) {
                        _job.verified(item.chunk);
                    } else {
                        _log.error("Failed to download " + item.chunk + " from any of " + item.peers);
                        _job.failed(item.chunk);
                    }
                } catch (OutOfMemoryError oom) {
                    _job.failed(item.chunk);
                    throw oom;
                } catch (RuntimeException re) {
                    _log.error("Error downloading " + item.chunk, re);
                    _job.failed(item.chunk);
                }
            }
            if (_log.shouldDebug()) {_log.debug(Thread.currentThread().getName() + " exiting");}
        }

        /**
         * Each candidate once, in order.
         */
        private boolean fetch(DownloadJob.Item item) {
            for (String peer : item.peers) {
                if (_job.isDone()) {return false;}
                FetchResult rv = _source.fetch(peer, item.chunk, item.checksum);
                if (rv == FetchResult.OK) {
                    return true;
                }
                if (_log.shouldInfo()) {_log.info(item.chunk + " from " + peer + ": " + rv + ", trying next peer");}
            }
            return false;
        }
    }
}
