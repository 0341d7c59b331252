package org.chunkcast;

/**
 * JVM shutdown hook, stops whatever the command line started.
 *
 * @since 0.9.0
 */
class ChunkcastShutdown extends Thread {
    private final Chunkcast _chunkcast;

    public ChunkcastShutdown(Chunkcast chunkcast) {
        super("Chunkcast shutdown");
        _chunkcast = chunkcast;
    }

    @Override
    public void run() {
        _chunkcast.shutdown();
    }
}
