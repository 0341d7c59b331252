package org.chunkcast;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Defaults, file loading, peer id offsets and validation.
 */
public class ChunkcastConfigTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void defaultsTest() {
        ChunkcastConfig c = new ChunkcastConfig();
        assertEquals(102400, c.getChunkSize());
        assertEquals(5001, c.getBroadcastPort());
        assertEquals(5000, c.getPeerPort());
        assertEquals(Arrays.asList(5001, 5002), c.getTargetPorts());
        assertEquals(10, c.getMaxConnections());
        assertEquals(300 * 1000L, c.getConnectionTimeout());
        assertEquals(10 * 1000L, c.getAnnounceInterval());
        assertEquals(300 * 1000L, c.getPeerTimeout());
        assertEquals(300 * 1000L, c.getDownloadTimeout());
        assertEquals(5, c.getDownloadWorkers());
        assertEquals(new File("./chunks"), c.getChunkDir());
        assertEquals(new File("./content_dict.json"), c.getContentDirectoryFile());
    }

    @Test
    public void peerIdOffsetsLocalPortsTest() {
        Properties p = new Properties();
        p.setProperty(ChunkcastConfig.PROP_PEER_ID, "2");
        ChunkcastConfig c = new ChunkcastConfig(p);
        assertEquals(2, c.getPeerId());
        assertEquals(5003, c.getBroadcastPort());
        assertEquals(5002, c.getPeerPort());
        assertEquals(Arrays.asList(5001, 5002), c.getTargetPorts());
    }

    @Test
    public void loadWithOverridesTest() throws IOException {
        File f = tmp.newFile("chunkcast.config");
        String conf = "# test\n" +
                      "chunkcast.chunkSize=4096\n" +
                      "chunkcast.targetPorts=6001, 6002 ,6003\n" +
                      "chunkcast.downloadWorkers=2\n";
        Files.write(f.toPath(), conf.getBytes(StandardCharsets.UTF_8));
        Properties overrides = new Properties();
        overrides.setProperty(ChunkcastConfig.PROP_DOWNLOAD_WORKERS, "3");
        ChunkcastConfig c = ChunkcastConfig.load(f, overrides);
        assertEquals(4096, c.getChunkSize());
        assertEquals(Arrays.asList(6001, 6002, 6003), c.getTargetPorts());
        assertEquals(3, c.getDownloadWorkers());
    }

    @Test
    public void missingFileMeansDefaultsTest() throws IOException {
        ChunkcastConfig c = ChunkcastConfig.load(new File(tmp.getRoot(), "nope.config"), null);
        assertEquals(ChunkcastConfig.DEFAULT_CHUNK_SIZE, c.getChunkSize());
    }

    @Test
    public void badNumberTest() {
        Properties p = new Properties();
        p.setProperty(ChunkcastConfig.PROP_MAX_CONNECTIONS, "ten");
        try {
            new ChunkcastConfig(p);
            fail();
        } catch (IllegalArgumentException iae) {
            assertTrue(iae.getMessage().contains(ChunkcastConfig.PROP_MAX_CONNECTIONS));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroChunkSizeTest() {
        Properties p = new Properties();
        p.setProperty(ChunkcastConfig.PROP_CHUNK_SIZE, "0");
        new ChunkcastConfig(p);
    }

    @Test
    public void hugeChunkSizeTest() {
        Properties p = new Properties();
        p.setProperty(ChunkcastConfig.PROP_CHUNK_SIZE, String.valueOf(ChunkcastConfig.MAX_CHUNK_SIZE));
        assertEquals(ChunkcastConfig.MAX_CHUNK_SIZE, new ChunkcastConfig(p).getChunkSize());
        p.setProperty(ChunkcastConfig.PROP_CHUNK_SIZE, String.valueOf(Integer.MAX_VALUE));
        try {
            new ChunkcastConfig(p);
            fail();
        } catch (IllegalArgumentException iae) {
            assertTrue(iae.getMessage().contains(ChunkcastConfig.PROP_CHUNK_SIZE));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void badTargetPortTest() {
        Properties p = new Properties();
        p.setProperty(ChunkcastConfig.PROP_TARGET_PORTS, "5001,70000");
        new ChunkcastConfig(p);
    }
}
