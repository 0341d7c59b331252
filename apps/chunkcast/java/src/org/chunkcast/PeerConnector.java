package org.chunkcast;

import java.io.IOException;
import java.net.Socket;

/**
 * Opens transfer connections for the {@link ConnectionPool}.
 *
 * @since 0.9.0
 */
public interface PeerConnector {

    /**
     * @param peer an address, optionally with ":port"
     * @return a connected socket with its read timeout set
     */
    public Socket connect(String peer) throws IOException;
}
