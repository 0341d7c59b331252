package org.chunkcast;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * The chunk transfer wire format.
 *
 * <pre>
 * request:  &lt;decimal length&gt; '\n' {"chunk": "name"}
 * response: &lt;decimal size&gt; '\n' size bytes
 *      or:  ERROR: Chunk not found
 * </pre>
 *
 * The error response has no terminator, so a reader recognizes it by
 * matching the whole token.
 *
 * @since 0.9.0
 */
public final class ChunkProtocol {

    /** largest request body accepted */
    public static final int MAX_REQUEST = 8 * 1024;
    /** transfer block size */
    public static final int BLOCK_SIZE = 4096;
    public static final String NOT_FOUND = "ERROR: Chunk not found";

    private static final byte[] NOT_FOUND_BYTES = NOT_FOUND.getBytes(StandardCharsets.US_ASCII);
    /** digits of a long plus slack */
    private static final int MAX_HEADER = 24;
    private static final Gson GSON = new Gson();

    private ChunkProtocol() {}

    /**
     * Framing or header violation. The stream cannot be resynchronized,
     * the connection must be closed.
     */
    public static class ProtocolException extends IOException {
        public ProtocolException(String msg) {super(msg);}
    }

    public static void writeRequest(OutputStream out, String chunkName) throws IOException {
        JsonObject o = new JsonObject();
        o.addProperty("chunk", chunkName);
        byte[] body = GSON.toJson(o).getBytes(StandardCharsets.UTF_8);
        out.write((body.length + "\n").getBytes(StandardCharsets.US_ASCII));
        out.write(body);
        out.flush();
    }

    /**
     * Read one framed request.
     *
     * @return the request, null at a clean end of stream
     * @throws ProtocolException on a bad length header or a body over {@link #MAX_REQUEST}
     * @throws IOException on read failure or a truncated body
     */
    public static Request readRequest(InputStream in) throws IOException {
        String header = readLine(in, MAX_HEADER);
        if (header == null) {
            return null;
        }
        int len;
        try {
            len = Integer.parseInt(header.trim());
        } catch (NumberFormatException nfe) {
            throw new ProtocolException("Bad request length header");
        }
        if (len < 0 || len > MAX_REQUEST) {
            throw new ProtocolException("Request length " + len + " out of range");
        }
        byte[] body = new byte[len];
        new DataInputStream(in).readFully(body);
        return new Request(body);
    }

    /** Success header, to be followed by exactly size bytes. */
    public static void writeHeader(OutputStream out, long size) throws IOException {
        out.write((size + "\n").getBytes(StandardCharsets.US_ASCII));
    }

    public static void writeNotFound(OutputStream out) throws IOException {
        out.write(NOT_FOUND_BYTES);
        out.flush();
    }

    /**
     * Read a response header.
     *
     * @return the announced size, or -1 for {@link #NOT_FOUND}
     * @throws ProtocolException if the header is neither a size nor the error token
     * @throws EOFException if the stream ends inside the header
     */
    public static long readResponseHeader(InputStream in) throws IOException {
        byte[] buf = new byte[MAX_HEADER];
        int n = 0;
        while (true) {
            int c = in.read();
            if (c < 0) {
                throw new EOFException("Connection closed reading response header after " + n + " bytes");
            }
            if (c == '\n') {
                break;
            }
            if (n >= MAX_HEADER) {
                throw new ProtocolException("Response header too long");
            }
            buf[n++] = (byte) c;
            if (n == NOT_FOUND_BYTES.length && Arrays.equals(Arrays.copyOf(buf, n), NOT_FOUND_BYTES)) {
                return -1;
            }
        }
        String header = new String(buf, 0, n, StandardCharsets.US_ASCII).trim();
        try {
            long rv = Long.parseLong(header);
            if (rv < 0) {
                throw new ProtocolException("Negative size " + rv);
            }
            return rv;
        } catch (NumberFormatException nfe) {
            throw new ProtocolException("Bad response header \"" + header + '"');
        }
    }

    /**
     * @return the line without terminator, null if the stream ends before any byte
     */
    private static String readLine(InputStream in, int max) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(max);
        while (true) {
            int c = in.read();
            if (c < 0) {
                if (buf.size() == 0) {
                    return null;
                }
                throw new EOFException("Connection closed inside request header");
            }
            if (c == '\n') {
                return new String(buf.toByteArray(), StandardCharsets.US_ASCII);
            }
            if (buf.size() >= max) {
                throw new ProtocolException("Request header too long");
            }
            buf.write(c);
        }
    }

    /**
     * A well framed request. The body may still be malformed,
     * in which case {@link #getChunk()} is null.
     */
    public static class Request {
        private final String _chunk;
        private final String _error;

        Request(byte[] body) {
            String chunk = null;
            String error = null;
            try {
                JsonObject o = GSON.fromJson(new String(body, StandardCharsets.UTF_8), JsonObject.class);
                if (o == null || !o.has("chunk") || !o.get("chunk").isJsonPrimitive()) {
                    error = "request without chunk name";
                } else {
                    chunk = o.get("chunk").getAsString();
                }
            } catch (JsonParseException jpe) {
                error = "malformed request: " + jpe.getMessage();
            } catch (ClassCastException cce) {
                error = "request is not a JSON object";
            }
            _chunk = chunk;
            _error = error;
        }

        /** @return the requested chunk name, null if the body was malformed */
        public String getChunk() {return _chunk;}

        /** @return why the body was rejected, null if valid */
        public String getError() {return _error;}
    }
}
