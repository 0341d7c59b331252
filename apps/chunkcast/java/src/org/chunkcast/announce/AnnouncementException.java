package org.chunkcast.announce;

/**
 * A datagram that is not a usable announcement.
 *
 * @since 0.9.0
 */
public class AnnouncementException extends Exception {

    public AnnouncementException(String msg) {
        super(msg);
    }

    public AnnouncementException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
