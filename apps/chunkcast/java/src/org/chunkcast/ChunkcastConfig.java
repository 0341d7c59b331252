package org.chunkcast;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import net.i2p.data.DataHelper;

/**
 * Immutable configuration for a Chunkcast peer.
 *
 * <p>Every recognized option is listed here with its default. Values are read from an
 * I2P-style properties file (see {@link DataHelper#loadProps(Properties, File)}) and
 * validated when loaded, so a running component never sees a bad value.
 *
 * <p>When a peer id is configured, the broadcast and peer ports are offset by it so that
 * several peers can run on one host.
 *
 * @since 0.9.0
 */
public class ChunkcastConfig {

    public static final String PROP_CHUNK_SIZE = "chunkcast.chunkSize";
    public static final String PROP_BROADCAST_PORT = "chunkcast.broadcastPort";
    public static final String PROP_PEER_PORT = "chunkcast.peerPort";
    public static final String PROP_PEER_ID = "chunkcast.peerId";
    public static final String PROP_TARGET_PORTS = "chunkcast.targetPorts";
    public static final String PROP_MAX_CONNECTIONS = "chunkcast.maxConnections";
    public static final String PROP_CONNECTION_TIMEOUT = "chunkcast.connectionTimeout";
    public static final String PROP_ANNOUNCE_INTERVAL = "chunkcast.announceInterval";
    public static final String PROP_PEER_TIMEOUT = "chunkcast.peerTimeout";
    public static final String PROP_DOWNLOAD_TIMEOUT = "chunkcast.downloadTimeout";
    public static final String PROP_DOWNLOAD_WORKERS = "chunkcast.downloadWorkers";
    public static final String PROP_CHUNK_DIR = "chunkcast.chunkDir";
    public static final String PROP_LOG_DIR = "chunkcast.logDir";
    public static final String PROP_DOWNLOAD_DIR = "chunkcast.downloadDir";
    public static final String PROP_CONTENT_DIRECTORY = "chunkcast.contentDirectory";

    public static final int DEFAULT_CHUNK_SIZE = 100 * 1024;
    public static final int MAX_CHUNK_SIZE = 64 * 1024 * 1024;
    public static final int DEFAULT_BROADCAST_PORT = 5001;
    public static final int DEFAULT_PEER_PORT = 5000;
    public static final String DEFAULT_TARGET_PORTS = "5001,5002";
    public static final int DEFAULT_MAX_CONNECTIONS = 10;
    /** seconds */
    public static final int DEFAULT_CONNECTION_TIMEOUT = 300;
    /** seconds */
    public static final int DEFAULT_ANNOUNCE_INTERVAL = 10;
    /** seconds */
    public static final int DEFAULT_PEER_TIMEOUT = 300;
    /** seconds */
    public static final int DEFAULT_DOWNLOAD_TIMEOUT = 300;
    public static final int DEFAULT_DOWNLOAD_WORKERS = 5;
    public static final String DEFAULT_CHUNK_DIR = "./chunks";
    public static final String DEFAULT_LOG_DIR = "./logs";
    public static final String DEFAULT_DOWNLOAD_DIR = "./downloads";
    public static final String DEFAULT_CONTENT_DIRECTORY = "./content_dict.json";

    private final int _chunkSize;
    private final int _broadcastPort;
    private final int _peerPort;
    private final int _peerId;
    private final List<Integer> _targetPorts;
    private final int _maxConnections;
    private final long _connectionTimeout;
    private final long _announceInterval;
    private final long _peerTimeout;
    private final long _downloadTimeout;
    private final int _downloadWorkers;
    private final File _chunkDir;
    private final File _logDir;
    private final File _downloadDir;
    private final File _contentDirectory;

    /**
     * @param props may be empty, never null
     * @throws IllegalArgumentException naming the offending key
     */
    public ChunkcastConfig(Properties props) {
        _peerId = getInt(props, PROP_PEER_ID, 0, 0, 60000);
        _chunkSize = getInt(props, PROP_CHUNK_SIZE, DEFAULT_CHUNK_SIZE, 1, MAX_CHUNK_SIZE);
        _broadcastPort = offsetPort(PROP_BROADCAST_PORT,
                                    getInt(props, PROP_BROADCAST_PORT, DEFAULT_BROADCAST_PORT, 1, 65535));
        _peerPort = offsetPort(PROP_PEER_PORT, getInt(props, PROP_PEER_PORT, DEFAULT_PEER_PORT, 1, 65535));
        _targetPorts = parsePorts(props.getProperty(PROP_TARGET_PORTS, DEFAULT_TARGET_PORTS));
        _maxConnections = getInt(props, PROP_MAX_CONNECTIONS, DEFAULT_MAX_CONNECTIONS, 1, 10000);
        _connectionTimeout = 1000L * getInt(props, PROP_CONNECTION_TIMEOUT, DEFAULT_CONNECTION_TIMEOUT, 1, Integer.MAX_VALUE);
        _announceInterval = 1000L * getInt(props, PROP_ANNOUNCE_INTERVAL, DEFAULT_ANNOUNCE_INTERVAL, 1, Integer.MAX_VALUE);
        _peerTimeout = 1000L * getInt(props, PROP_PEER_TIMEOUT, DEFAULT_PEER_TIMEOUT, 1, Integer.MAX_VALUE);
        _downloadTimeout = 1000L * getInt(props, PROP_DOWNLOAD_TIMEOUT, DEFAULT_DOWNLOAD_TIMEOUT, 1, Integer.MAX_VALUE);
        _downloadWorkers = getInt(props, PROP_DOWNLOAD_WORKERS, DEFAULT_DOWNLOAD_WORKERS, 1, 256);
        _chunkDir = getFile(props, PROP_CHUNK_DIR, DEFAULT_CHUNK_DIR);
        _logDir = getFile(props, PROP_LOG_DIR, DEFAULT_LOG_DIR);
        _downloadDir = getFile(props, PROP_DOWNLOAD_DIR, DEFAULT_DOWNLOAD_DIR);
        _contentDirectory = getFile(props, PROP_CONTENT_DIRECTORY, DEFAULT_CONTENT_DIRECTORY);
    }

    /** All defaults */
    public ChunkcastConfig() {
        this(new Properties());
    }

    /**
     * Load from a file. A missing file means all defaults.
     *
     * @param overrides applied on top of the file contents, may be null
     */
    public static ChunkcastConfig load(File file, Properties overrides) throws IOException {
        Properties props = new Properties();
        if (file != null && file.exists()) {
            DataHelper.loadProps(props, file);
        }
        if (overrides != null) {
            props.putAll(overrides);
        }
        return new ChunkcastConfig(props);
    }

    private int offsetPort(String key, int port) {
        int rv = port + _peerId;
        if (rv > 65535) {
            throw new IllegalArgumentException(key + " with peer id " + _peerId + " is out of range: " + rv);
        }
        return rv;
    }

    private static int getInt(Properties props, String key, int dflt, int min, int max) {
        String val = props.getProperty(key);
        if (val == null || val.trim().length() <= 0) {
            return dflt;
        }
        int rv;
        try {
            rv = Integer.parseInt(val.trim());
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("Not a number for " + key + ": " + val, nfe);
        }
        if (rv < min || rv > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ": " + rv);
        }
        return rv;
    }

    private static File getFile(Properties props, String key, String dflt) {
        String val = props.getProperty(key, dflt).trim();
        if (val.length() <= 0) {
            throw new IllegalArgumentException("Empty path for " + key);
        }
        return new File(val);
    }

    private static List<Integer> parsePorts(String val) {
        List<Integer> rv = new ArrayList<Integer>();
        for (String s : DataHelper.split(val, ",")) {
            s = s.trim();
            if (s.length() <= 0) {
                continue;
            }
            try {
                int port = Integer.parseInt(s);
                if (port < 1 || port > 65535) {
                    throw new IllegalArgumentException(PROP_TARGET_PORTS + " port out of range: " + port);
                }
                rv.add(Integer.valueOf(port));
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("Bad port in " + PROP_TARGET_PORTS + ": " + s, nfe);
            }
        }
        if (rv.isEmpty()) {
            throw new IllegalArgumentException(PROP_TARGET_PORTS + " must name at least one port");
        }
        return Collections.unmodifiableList(rv);
    }

    public int getChunkSize() {return _chunkSize;}

    /** UDP port the listener binds, peer id offset applied */
    public int getBroadcastPort() {return _broadcastPort;}

    /** TCP port of the chunk server and of remote chunk servers, peer id offset applied */
    public int getPeerPort() {return _peerPort;}

    public int getPeerId() {return _peerId;}

    /** UDP ports the announcer sends to */
    public List<Integer> getTargetPorts() {return _targetPorts;}

    public int getMaxConnections() {return _maxConnections;}

    /** ms */
    public long getConnectionTimeout() {return _connectionTimeout;}

    /** ms */
    public long getAnnounceInterval() {return _announceInterval;}

    /** ms */
    public long getPeerTimeout() {return _peerTimeout;}

    /** ms */
    public long getDownloadTimeout() {return _downloadTimeout;}

    public int getDownloadWorkers() {return _downloadWorkers;}

    public File getChunkDir() {return _chunkDir;}

    public File getLogDir() {return _logDir;}

    public File getDownloadDir() {return _downloadDir;}

    public File getContentDirectoryFile() {return _contentDirectory;}

    @Override
    public String toString() {
        return "ChunkcastConfig[chunkSize=" + _chunkSize + " broadcastPort=" + _broadcastPort +
               " peerPort=" + _peerPort + " targetPorts=" + _targetPorts +
               " maxConnections=" + _maxConnections + " chunkDir=" + _chunkDir + ']';
    }
}
