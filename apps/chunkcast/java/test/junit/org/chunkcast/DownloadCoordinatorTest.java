package org.chunkcast;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import net.i2p.I2PAppContext;
import net.i2p.crypto.SHA256Generator;

import org.chunkcast.announce.ContentDirectory;
import org.chunkcast.announce.ContentEntry;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Whole downloads: retries across peers, reassembly, and failures.
 */
public class DownloadCoordinatorTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private I2PAppContext ctx;
    private ChunkStore remote;
    private ChunkStore local;
    private File downloads;
    private ChunkServer server;
    private ChunkServer server2;
    private ConnectionPool pool;

    @Before
    public void setUp() throws IOException {
        ctx = I2PAppContext.getGlobalContext();
        remote = new ChunkStore(ctx, tmp.newFolder("remote"));
        local = new ChunkStore(ctx, tmp.newFolder("local"));
        downloads = new File(tmp.getRoot(), "downloads");
    }

    @After
    public void tearDown() {
        if (pool != null) {
            pool.closeAll();
        }
        if (server != null) {
            server.halt();
        }
        if (server2 != null) {
            server2.halt();
        }
    }

    /** split a random file into the remote store */
    private byte[] publish(String name, int size, int chunkSize) throws IOException {
        byte[] data = ChunkStoreTest.randomBytes(size, size);
        File src = new File(tmp.newFolder(), name);
        Files.write(src.toPath(), data);
        remote.split(src, chunkSize);
        return data;
    }

    /** content directory listing every remote chunk with the given peers */
    private ContentDirectory directory(String... peers) throws IOException {
        Map<String, ContentEntry> m = new TreeMap<String, ContentEntry>();
        for (String name : remote.list()) {
            m.put(name, new ContentEntry(ChunkStore.checksum(new File(remote.getDirectory(), name)),
                                         Arrays.asList(peers)));
        }
        return new ContentDirectory(m, 1);
    }

    /**
     * Copies chunks from the remote store, failing for the listed peers.
     */
    private class FakeSource implements ChunkSource {
        final List<String> calls = Collections.synchronizedList(new ArrayList<String>());
        final List<String> broken;
        final FetchResult failure;

        FakeSource(FetchResult failure, String... broken) {
            this.failure = failure;
            this.broken = Arrays.asList(broken);
        }

        public FetchResult fetch(String peer, String chunkName, String checksum) {
            calls.add(peer + ' ' + chunkName);
            if (broken.contains(peer)) {
                return failure;
            }
            try {
                File src = remote.getChunk(chunkName);
                if (src == null) {
                    return FetchResult.NOT_FOUND;
                }
                if (!ChunkStore.checksum(src).equals(checksum)) {
                    return FetchResult.INTEGRITY_ERROR;
                }
                File t = local.createTempFile(chunkName);
                Files.copy(src.toPath(), t.toPath(), java.nio.file.StandardCopyOption.REPLACE_EXISTING);
                local.commit(t, chunkName);
                return FetchResult.OK;
            } catch (IOException ioe) {
                return FetchResult.TRANSPORT_ERROR;
            }
        }

        int count(String prefix) {
            int rv = 0;
            synchronized (calls) {
                for (String c : calls) {
                    if (c.startsWith(prefix)) {rv++;}
                }
            }
            return rv;
        }
    }

    private DownloadCoordinator coordinator(ChunkSource source, long timeout) {
        return new DownloadCoordinator(ctx, local, source, downloads, 5, timeout);
    }

    @Test
    public void retryAcrossPeersTest() throws IOException {
        byte[] data = publish("one.bin", 1000, 1000);
        FakeSource src = new FakeSource(FetchResult.TRANSPORT_ERROR, "P1");
        DownloadResult r = coordinator(src, 10000).download("one.bin", directory("P1", "P2"));
        assertTrue(r.toString(), r.isSuccess());
        assertEquals(Arrays.asList("P1 one_1.bin", "P2 one_1.bin"), src.calls);
        assertArrayEquals(data, Files.readAllBytes(r.getOutput().toPath()));
    }

    @Test
    public void everyChunkTriesPeersInOrderTest() throws IOException {
        publish("many.bin", 12 * 100, 100);
        FakeSource src = new FakeSource(FetchResult.NOT_FOUND, "P1");
        DownloadResult r = coordinator(src, 10000).download("many.bin", directory("P1", "P2", "P3"));
        assertTrue(r.toString(), r.isSuccess());
        assertEquals(12, r.getChunkCount());
        assertEquals(12, src.count("P1 "));
        assertEquals(12, src.count("P2 "));
        assertEquals(0, src.count("P3 "));
    }

    @Test
    public void endToEndTest() throws IOException {
        byte[] data = publish("video.mp4", 500 * 1024, 100 * 1024);
        assertEquals(5, remote.list().size());
        server = new ChunkServer(ctx, remote, 0);
        server.startAccepting();
        pool = new ConnectionPool(ctx, 10, 300 * 1000, server.getPort());
        ChunkFetcher fetcher = new ChunkFetcher(ctx, pool, local);
        DownloadResult r = coordinator(fetcher, 30 * 1000).download("video.mp4", directory("127.0.0.1"));
        assertTrue(r.toString(), r.isSuccess());
        assertEquals(new File(downloads, "video.mp4"), r.getOutput());
        assertArrayEquals(data, Files.readAllBytes(r.getOutput().toPath()));
        assertTrue(r.getMissing().isEmpty());
        // chunks consumed by reassembly, no temp files
        assertEquals(0, local.getDirectory().list().length);
        assertEquals(Arrays.asList("video.mp4"), Arrays.asList(downloads.list()));
        // the remote copy is untouched
        assertEquals(5, remote.list().size());
    }

    @Test
    public void workersShareSingleConnectionTest() throws IOException {
        byte[] data = publish("big.bin", 4 * 1024 * 1024, 2 * 1024 * 1024);
        ChunkStore other = new ChunkStore(ctx, tmp.newFolder("remote2"));
        File second = new File(remote.getDirectory(), "big_2.bin");
        String sum1 = ChunkStore.checksum(new File(remote.getDirectory(), "big_1.bin"));
        String sum2 = ChunkStore.checksum(second);
        Files.move(second.toPath(), new File(other.getDirectory(), "big_2.bin").toPath());
        server = new ChunkServer(ctx, remote, 0);
        server.startAccepting();
        server2 = new ChunkServer(ctx, other, 0);
        server2.startAccepting();
        Map<String, ContentEntry> entries = new TreeMap<String, ContentEntry>();
        entries.put("big_1.bin", new ContentEntry(sum1, Arrays.asList("127.0.0.1:" + server.getPort())));
        entries.put("big_2.bin", new ContentEntry(sum2, Arrays.asList("127.0.0.1:" + server2.getPort())));
        // one connection for two workers and two healthy peers
        pool = new ConnectionPool(ctx, 1, 300 * 1000, ChunkcastConfig.DEFAULT_PEER_PORT);
        DownloadCoordinator dc = new DownloadCoordinator(ctx, local, new ChunkFetcher(ctx, pool, local),
                                                         downloads, 2, 60 * 1000);
        DownloadResult r = dc.download("big.bin", new ContentDirectory(entries, 1));
        assertTrue(r.toString(), r.isSuccess());
        assertArrayEquals(data, Files.readAllBytes(r.getOutput().toPath()));
        assertTrue(pool.size() <= 1);
    }

    @Test
    public void badChecksumFailsWithoutOutputTest() throws IOException {
        publish("video.mp4", 500 * 1024, 100 * 1024);
        server = new ChunkServer(ctx, remote, 0);
        server.startAccepting();
        pool = new ConnectionPool(ctx, 10, 300 * 1000, server.getPort());
        ContentDirectory good = directory("127.0.0.1");
        Map<String, ContentEntry> entries = new TreeMap<String, ContentEntry>(good.getEntries());
        byte[] zero = SHA256Generator.getDigestInstance().digest(new byte[1]);
        entries.put("video_3.mp4", new ContentEntry(ChunkStore.toHex(zero), Arrays.asList("127.0.0.1")));
        long timeout = 30 * 1000;
        DownloadResult r = coordinator(new ChunkFetcher(ctx, pool, local), timeout)
                               .download("video.mp4", new ContentDirectory(entries, 2));
        assertFalse(r.isSuccess());
        assertEquals(Arrays.asList("video_3.mp4"), r.getMissing());
        assertNull(r.getOutput());
        assertFalse(new File(downloads, "video.mp4").exists());
        // ended as soon as every chunk was accounted for
        assertTrue(r.getElapsed() < timeout);
        assertNull(local.getChunk("video_3.mp4"));
    }

    @Test
    public void noChunksTest() throws IOException {
        publish("other.bin", 100, 100);
        DownloadResult r = coordinator(new FakeSource(FetchResult.OK), 1000).download("video.mp4", directory("P1"));
        assertFalse(r.isSuccess());
        assertEquals("no chunks available", r.getReason());
        assertEquals(0, r.getChunkCount());
    }

    @Test
    public void allPeersFailTest() throws IOException {
        publish("gone.bin", 300, 100);
        FakeSource src = new FakeSource(FetchResult.TRANSPORT_ERROR, "P1", "P2");
        DownloadResult r = coordinator(src, 10000).download("gone.bin", directory("P1", "P2"));
        assertFalse(r.isSuccess());
        assertEquals(Arrays.asList("gone_1.bin", "gone_2.bin", "gone_3.bin"), r.getMissing());
        // each peer tried once per chunk, nothing re-queued
        assertEquals(6, src.calls.size());
        assertFalse(downloads.exists() && new File(downloads, "gone.bin").exists());
    }

    @Test
    public void timeoutTest() throws IOException {
        publish("slow.bin", 200, 100);
        ChunkSource stuck = new ChunkSource() {
            public FetchResult fetch(String peer, String chunkName, String checksum) {
                try {
                    Thread.sleep(3000);
                } catch (InterruptedException ie) {}
                return FetchResult.TRANSPORT_ERROR;
            }
        };
        DownloadResult r = coordinator(stuck, 300).download("slow.bin", directory("P1"));
        assertFalse(r.isSuccess());
        assertTrue(r.getReason(), r.getReason().startsWith("timed out"));
        assertEquals(2, r.getMissing().size());
        assertTrue(r.getElapsed() < 3000);
    }

    @Test
    public void localChunksNotFetchedTest() throws IOException {
        byte[] data = publish("here.bin", 300, 100);
        for (String name : remote.list()) {
            Files.copy(new File(remote.getDirectory(), name).toPath(), new File(local.getDirectory(), name).toPath());
        }
        FakeSource src = new FakeSource(FetchResult.OK);
        DownloadResult r = coordinator(src, 1000).download("here.bin", directory("P1"));
        assertTrue(r.toString(), r.isSuccess());
        assertTrue(src.calls.isEmpty());
        assertArrayEquals(data, Files.readAllBytes(r.getOutput().toPath()));
    }
}
