package org.chunkcast;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

/**
 * Chunk naming, numeric ordering and network name checks.
 */
public class ChunkNameTest {

    @Test
    public void chunkNamesTest() {
        ChunkName n = new ChunkName("movie.mp4");
        assertEquals("movie", n.getBase());
        assertEquals(".mp4", n.getExtension());
        assertEquals("movie_1.mp4", n.chunk(1));
        assertEquals("movie_12.mp4", n.chunk(12));
        assertTrue(n.matches("movie_3.mp4"));
        assertFalse(n.matches("movie_3.mkv"));
        assertFalse(n.matches("movie_.mp4"));
        assertFalse(n.matches("movie.mp4"));
        assertFalse(n.matches("other_3.mp4"));
        assertEquals(3, n.ordinal("movie_3.mp4"));
        assertEquals(-1, n.ordinal("other_3.mp4"));
    }

    @Test
    public void multipleDotsTest() {
        ChunkName n = new ChunkName("backup.tar.gz");
        assertEquals("backup.tar_2.gz", n.chunk(2));
        assertTrue(n.matches("backup.tar_2.gz"));
        // the base is taken literally
        assertFalse(n.matches("backupXtar_2.gz"));
    }

    @Test
    public void noExtensionTest() {
        ChunkName n = new ChunkName("README");
        assertEquals("", n.getExtension());
        assertEquals("README_1", n.chunk(1));
        assertTrue(n.matches("README_7"));
        assertFalse(n.matches("README_7.txt"));
    }

    @Test
    public void numericOrderTest() {
        ChunkName n = new ChunkName("f.bin");
        List<String> names = new ArrayList<String>();
        for (int i = 1; i <= 11; i++) {
            names.add(n.chunk(i));
        }
        List<String> shuffled = new ArrayList<String>(names);
        Collections.sort(shuffled);
        // lexical order puts f_10 and f_11 right after f_1
        assertEquals("f_10.bin", shuffled.get(1));
        Collections.shuffle(shuffled);
        Collections.sort(shuffled, n.ordinalOrder());
        assertEquals(names, shuffled);
    }

    @Test
    public void foreignNamesSortLastTest() {
        ChunkName n = new ChunkName("f.bin");
        List<String> names = new ArrayList<String>(Arrays.asList("zz", "f_2.bin", "aa", "f_1.bin"));
        Collections.sort(names, n.ordinalOrder());
        assertEquals(Arrays.asList("f_1.bin", "f_2.bin", "aa", "zz"), names);
    }

    @Test
    public void safeNamesTest() {
        assertTrue(ChunkName.isSafe("movie_1.mp4"));
        assertFalse(ChunkName.isSafe(null));
        assertFalse(ChunkName.isSafe(""));
        assertFalse(ChunkName.isSafe("../etc/passwd"));
        assertFalse(ChunkName.isSafe("a/b"));
        assertFalse(ChunkName.isSafe("a\\b"));
        assertFalse(ChunkName.isSafe(".movie_1.mp4.123.part"));
        assertFalse(ChunkName.isSafe("a\nb"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyContentTest() {
        new ChunkName("");
    }
}
