package org.chunkcast;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming convention for chunks: {@code <base>_<ordinal><ext>}, ordinal starting at 1.
 * A content named {@code movie.mp4} is cut into {@code movie_1.mp4}, {@code movie_2.mp4}, ...
 *
 * @since 0.9.0
 */
public class ChunkName {

    private final String _content;
    private final String _base;
    private final String _ext;
    private final Pattern _pattern;

    /**
     * @param content the content name, base name plus optional extension
     */
    public ChunkName(String content) {
        if (content == null || content.length() <= 0) {
            throw new IllegalArgumentException("empty content name");
        }
        _content = content;
        int dot = content.lastIndexOf('.');
        if (dot > 0) {
            _base = content.substring(0, dot);
            _ext = content.substring(dot);
        } else {
            _base = content;
            _ext = "";
        }
        _pattern = Pattern.compile(Pattern.quote(_base) + "_([0-9]+)" + Pattern.quote(_ext));
    }

    public String getContent() {return _content;}

    public String getBase() {return _base;}

    /** including the leading dot, or empty */
    public String getExtension() {return _ext;}

    /**
     * @param ordinal 1-based
     */
    public String chunk(int ordinal) {
        return _base + '_' + ordinal + _ext;
    }

    /**
     * @return true if the name is one of this content's chunks
     */
    public boolean matches(String chunkName) {
        return _pattern.matcher(chunkName).matches();
    }

    /**
     * @return the ordinal, or -1 if the name is not one of this content's chunks
     */
    public long ordinal(String chunkName) {
        Matcher m = _pattern.matcher(chunkName);
        if (!m.matches()) {
            return -1;
        }
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException nfe) {
            return -1;
        }
    }

    /**
     * Numeric ordinal order, so that {@code _10} sorts after {@code _9}.
     * Names that do not belong to this content sort last, by name.
     */
    public Comparator<String> ordinalOrder() {
        return new Comparator<String>() {
            public int compare(String a, String b) {
                long oa = ordinal(a);
                long ob = ordinal(b);
                if (oa < 0 && ob < 0) {
                    return a.compareTo(b);
                }
                if (oa < 0) {return 1;}
                if (ob < 0) {return -1;}
                return Long.compare(oa, ob);
            }
        };
    }

    /**
     * A chunk name as received from the network must be a plain file name.
     *
     * @return true if safe to resolve inside the chunk directory
     */
    public static boolean isSafe(String chunkName) {
        if (chunkName == null || chunkName.length() <= 0 || chunkName.length() > 255) {
            return false;
        }
        if (chunkName.startsWith(".")) {
            return false;
        }
        for (int i = 0; i < chunkName.length(); i++) {
            char c = chunkName.charAt(i);
            if (c == '/' || c == '\\' || c == ':' || c < 0x20) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return _content;
    }
}
