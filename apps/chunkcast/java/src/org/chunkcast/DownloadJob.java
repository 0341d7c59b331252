package org.chunkcast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * The shared state of one download: the chunks still to fetch, the ones
 * verified, the ones given up on, and the completion signal.
 *
 * <p>Every chunk ends up either verified or failed, exactly once.
 * The signal fires when all are verified, or as soon as all are accounted
 * for and at least one failed.
 *
 * @since 0.9.0
 */
class DownloadJob {

    private final ChunkName _content;
    private final List<String> _required;
    private final BlockingQueue<Item> _queue = new LinkedBlockingQueue<Item>();
    private final Set<String> _verified = Collections.newSetFromMap(new ConcurrentHashMap<String, Boolean>());
    private final Set<String> _failed = Collections.newSetFromMap(new ConcurrentHashMap<String, Boolean>());
    private final CountDownLatch _done = new CountDownLatch(1);
    private volatile boolean _abandoned;

    DownloadJob(ChunkName content, List<Item> items) {
        _content = content;
        List<String> required = new ArrayList<String>(items.size());
        for (Item item : items) {
            required.add(item.chunk);
        }
        Collections.sort(required, content.ordinalOrder());
        _required = Collections.unmodifiableList(required);
        _queue.addAll(items);
    }

    ChunkName getContent() {return _content;}

    /** all chunk names, ordinal order */
    List<String> getRequired() {return _required;}

    int size() {return _required.size();}

    /**
     * @return the next item, or null if none arrives within the timeout or the job is over
     */
    Item poll(long timeout) throws InterruptedException {
        if (isDone()) {return null;}
        return _queue.poll(timeout, TimeUnit.MILLISECONDS);
    }

    void verified(String chunk) {
        _verified.add(chunk);
        checkCompletion();
    }

    void failed(String chunk) {
        if (!_verified.contains(chunk)) {
            _failed.add(chunk);
        }
        checkCompletion();
    }

    private void checkCompletion() {
        int verified = _verified.size();
        if (verified >= _required.size() || verified + _failed.size() >= _required.size()) {
            _done.countDown();
        }
    }

    /**
     * @return true if signalled before the timeout
     */
    boolean await(long timeout) throws InterruptedException {
        return _done.await(timeout, TimeUnit.MILLISECONDS);
    }

    /** stop handing out work, workers finish their current item */
    void abandon() {
        _abandoned = true;
        _done.countDown();
    }

    boolean isDone() {return _abandoned || _done.getCount() == 0;}

    boolean isComplete() {return _verified.size() >= _required.size();}

    /** @return required chunks not verified, ordinal order */
    List<String> getMissing() {
        List<String> rv = new ArrayList<String>();
        for (String chunk : _required) {
            if (!_verified.contains(chunk)) {
                rv.add(chunk);
            }
        }
        return rv;
    }

    List<String> getFailed() {
        List<String> rv = new ArrayList<String>(_failed);
        Collections.sort(rv, _content.ordinalOrder());
        return rv;
    }

    /**
     * One chunk to fetch, with its candidate peers in the order to try them.
     */
    static class Item {
        final String chunk;
        final String checksum;
        final List<String> peers;

        Item(String chunk, String checksum, List<String> peers) {
            this.chunk = chunk;
            this.checksum = checksum;
            this.peers = Collections.unmodifiableList(new ArrayList<String>(peers));
        }

        @Override
        public String toString() {
            return chunk + " from " + peers;
        }
    }
}
