package org.chunkcast;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a download job.
 *
 * @since 0.9.0
 */
public class DownloadResult {

    private final String _content;
    private final File _output;
    private final int _chunks;
    private final List<String> _missing;
    private final String _reason;
    private final long _elapsed;

    private DownloadResult(String content, File output, int chunks, List<String> missing, String reason, long elapsed) {
        _content = content;
        _output = output;
        _chunks = chunks;
        _missing = Collections.unmodifiableList(new ArrayList<String>(missing));
        _reason = reason;
        _elapsed = elapsed;
    }

    static DownloadResult success(String content, File output, int chunks, long elapsed) {
        return new DownloadResult(content, output, chunks, Collections.<String>emptyList(), null, elapsed);
    }

    static DownloadResult failure(String content, int chunks, List<String> missing, String reason, long elapsed) {
        return new DownloadResult(content, null, chunks, missing, reason, elapsed);
    }

    public boolean isSuccess() {return _output != null;}

    public String getContent() {return _content;}

    /** @return the reassembled file, null on failure */
    public File getOutput() {return _output;}

    /** @return number of chunks the content consists of, 0 if none were known */
    public int getChunkCount() {return _chunks;}

    /** @return chunk names not obtained, in ordinal order, empty on success */
    public List<String> getMissing() {return _missing;}

    /** @return why the job failed, null on success */
    public String getReason() {return _reason;}

    public long getElapsed() {return _elapsed;}

    @Override
    public String toString() {
        if (isSuccess()) {
            return "Downloaded " + _content + " (" + _chunks + " chunks) to " + _output;
        }
        return "Download of " + _content + " failed: " + _reason +
               (_missing.isEmpty() ? "" : ", missing " + _missing);
    }
}
