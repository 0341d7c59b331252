/* Chunkcast - Command line entry point.
   This file is part of Chunkcast.
   Licensed under the GPL version 2 or later.
*/

package org.chunkcast;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

import gnu.getopt.Getopt;

import org.chunkcast.announce.AnnouncementListener;
import org.chunkcast.announce.Announcer;
import org.chunkcast.announce.ContentDirectory;
import org.chunkcast.announce.ContentDirectoryFile;
import org.chunkcast.announce.PeerDirectory;

import net.i2p.I2PAppContext;
import net.i2p.data.DataHelper;
import net.i2p.util.Log;

/**
 * Wires the components together for one command line invocation.
 *
 * @since 0.9.0
 */
public class Chunkcast {

    private final I2PAppContext _context;
    private final Log _log;
    private final ChunkcastConfig _config;
    private final ChunkStore _store;
    private final CountDownLatch _stopped = new CountDownLatch(1);
    private Announcer _announcer;
    private PeerDirectory _directory;
    private AnnouncementListener _listener;
    private ChunkServer _server;
    private ConnectionPool _pool;

    public Chunkcast(I2PAppContext ctx, ChunkcastConfig config) {
        _context = ctx;
        _log = ctx.logManager().getLog(Chunkcast.class);
        _config = config;
        _store = new ChunkStore(ctx, config.getChunkDir());
    }

    public ChunkStore getStore() {return _store;}

    /**
     * Cut a file into chunks in the chunk directory.
     *
     * @return the chunk names
     */
    public List<String> split(File file) throws IOException {
        List<String> rv = _store.split(file, _config.getChunkSize());
        if (_log.shouldInfo()) {_log.info("Split " + file + " into " + rv.size() + " chunks");}
        return rv;
    }

    public synchronized void startAnnouncer() throws IOException {
        _store.ensureDirectory();
        _announcer = new Announcer(_context, _store, _config.getTargetPorts(), _config.getAnnounceInterval(), null);
        _announcer.startAnnouncing();
    }

    /**
     * Start the peer directory seeded from the saved content directory,
     * and the listener feeding it.
     */
    public synchronized void startListener() throws IOException {
        ContentDirectoryFile file = new ContentDirectoryFile(_context, _config.getContentDirectoryFile());
        _directory = new PeerDirectory(_context, _config.getPeerTimeout(), file);
        try {
            _directory.seed(file.load(), _context.clock().now());
        } catch (IOException ioe) {
            _log.warn("Ignoring unreadable content directory " + file.getFile(), ioe);
        }
        _directory.start();
        _listener = new AnnouncementListener(_context, _directory, _config.getBroadcastPort());
        _listener.startListening();
    }

    public synchronized void startServer() throws IOException {
        _store.ensureDirectory();
        _server = new ChunkServer(_context, _store, _config.getPeerPort());
        _server.startAccepting();
    }

    /**
     * Fetch a content using the saved content directory.
     */
    public DownloadResult download(String contentName) throws IOException {
        ContentDirectory content = new ContentDirectoryFile(_context, _config.getContentDirectoryFile()).load();
        ConnectionPool pool = new ConnectionPool(_context, _config.getMaxConnections(),
                                                 _config.getConnectionTimeout(), _config.getPeerPort());
        pool.start();
        synchronized (this) {
            _pool = pool;
        }
        try {
            ChunkFetcher fetcher = new ChunkFetcher(_context, pool, _store);
            DownloadCoordinator coordinator = new DownloadCoordinator(_context, _store, fetcher,
                                                                      _config.getDownloadDir(),
                                                                      _config.getDownloadWorkers(),
                                                                      _config.getDownloadTimeout());
            return coordinator.download(contentName, content);
        } finally {
            pool.stop();
            pool.closeAll();
            synchronized (this) {
                if (_pool == pool) {
                    _pool = null;
                }
            }
        }
    }

    /**
     * Stop everything started, newest first. Idempotent.
     */
    public synchronized void shutdown() {
        if (_announcer != null) {
            _announcer.halt();
            _announcer = null;
        }
        if (_listener != null) {
            _listener.halt();
            _listener = null;
        }
        if (_directory != null) {
            _directory.stop();
            _directory = null;
        }
        if (_server != null) {
            _server.halt();
            _server = null;
        }
        if (_pool != null) {
            _pool.stop();
            _pool.closeAll();
            _pool = null;
        }
        _stopped.countDown();
    }

    /**
     * Block until shutdown.
     */
    public void waitForShutdown() throws InterruptedException {
        _stopped.await();
    }

    private static String usage() {
        return "Usage: Chunkcast [-c config] [-i peerId] command\n" +
               "Commands:\n" +
               "  split <file>      cut a file into chunks\n" +
               "  announce          broadcast the chunks held\n" +
               "  listen            collect announcements into the content directory\n" +
               "  serve             serve chunks to other peers\n" +
               "  peer              announce, listen and serve\n" +
               "  download <name>   fetch a content from the peers that have it";
    }

    public static void main(String args[]) {
        String configFile = "chunkcast.config";
        String peerId = null;
        boolean error = false;
        Getopt g = new Getopt("chunkcast", args, "c:i:");
        try {
            int c;
            while ((c = g.getopt()) != -1) {
              switch (c) {
                case 'c':
                    configFile = g.getOptarg();
                    break;

                case 'i':
                    peerId = g.getOptarg();
                    break;

                case '?':
                case ':':
                default:
                    error = true;
                    break;
              }  // switch
            } // while
        } catch (RuntimeException e) {
            e.printStackTrace();
            error = true;
        }

        int remaining = args.length - g.getOptind();
        if (error || remaining < 1) {
            System.out.println(usage());
            System.exit(1);
        }
        String cmd = args[g.getOptind()];
        String arg = remaining > 1 ? args[g.getOptind() + 1] : null;
        boolean needsArg = cmd.equals("split") || cmd.equals("download");
        if (needsArg != (remaining == 2) || remaining > 2) {
            System.out.println(usage());
            System.exit(1);
        }

        ChunkcastConfig config;
        try {
            Properties overrides = new Properties();
            if (peerId != null) {
                overrides.setProperty(ChunkcastConfig.PROP_PEER_ID, peerId);
            }
            config = ChunkcastConfig.load(new File(configFile), overrides);
        } catch (IOException ioe) {
            System.out.println(" • Cannot read configuration " + configFile + ": " + ioe.getMessage());
            System.exit(1);
            return;
        } catch (IllegalArgumentException iae) {
            System.out.println(" • Bad configuration: " + iae.getMessage());
            System.exit(1);
            return;
        }

        Properties ctxProps = new Properties();
        ctxProps.setProperty("i2p.dir.log", config.getLogDir().getAbsolutePath());
        I2PAppContext ctx = new I2PAppContext(ctxProps);
        Chunkcast cc = new Chunkcast(ctx, config);
        System.exit(cc.run(cmd, arg));
    }

    /**
     * @return process exit status
     */
    int run(String cmd, String arg) {
        try {
            if (cmd.equals("split")) {
                List<String> chunks = split(new File(arg));
                System.out.println(" • Split " + arg + " into " + chunks.size() + " chunks in " + _config.getChunkDir());
                return 0;
            }
            if (cmd.equals("download")) {
                Runtime.getRuntime().addShutdownHook(new ChunkcastShutdown(this));
                DownloadResult result = download(arg);
                if (result.isSuccess()) {
                    System.out.println(" • Downloaded " + arg + " (" + DataHelper.formatSize(result.getOutput().length()) +
                                       "B, " + result.getChunkCount() + " chunks) to " + result.getOutput() + " in " +
                                       DataHelper.formatDuration(result.getElapsed()));
                    return 0;
                }
                System.out.println(" • " + result);
                return 1;
            }
            if (cmd.equals("announce")) {
                startAnnouncer();
            } else if (cmd.equals("listen")) {
                startListener();
            } else if (cmd.equals("serve")) {
                startServer();
            } else if (cmd.equals("peer")) {
                startServer();
                startListener();
                startAnnouncer();
            } else {
                System.out.println(usage());
                return 1;
            }
        } catch (IOException ioe) {
            _log.error("Command " + cmd + " failed", ioe);
            System.out.println(" • " + cmd + " failed: " + ioe.getMessage());
            shutdown();
            return 1;
        }
        System.out.println(" • Chunkcast " + cmd + " running, Ctrl-C to stop");
        Runtime.getRuntime().addShutdownHook(new ChunkcastShutdown(this));
        try {
            waitForShutdown();
        } catch (InterruptedException ie) {
            shutdown();
        }
        return 0;
    }
}
