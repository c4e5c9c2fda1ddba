package io.apicheck.core.schema;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for the {@code #/a/b} fragment pointers used by {@code $ref} and as arena keys.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonPointers {

    /** Pointer of a document root. */
    public static final String ROOT = "#";

    private JsonPointers() {}

    /** {@code true} if the reference stays inside the current document. */
    public static boolean isLocal(String ref) {
        return ref != null && ref.startsWith("#");
    }

    /**
     * Decodes a local reference into its unescaped segments. Percent-encoding is decoded first,
     * then {@code ~1} and {@code ~0} (RFC 6901).
     *
     * @param ref a local reference such as {@code #/$defs/node}
     * @return the segments, empty for the root
     * @throws IllegalArgumentException if the reference is not local or the fragment does not
     *                                  start with {@code /}
     */
    public static List<String> decode(String ref) {
        if (!isLocal(ref)) {
            throw new IllegalArgumentException("Not a local reference: '" + ref + "'");
        }
        String fragment = ref.substring(1);
        if (fragment.isEmpty()) {
            return List.of();
        }
        if (fragment.indexOf('%') >= 0) {
            fragment = URLDecoder.decode(fragment.replace("+", "%2B"), StandardCharsets.UTF_8);
        }
        if (!fragment.startsWith("/")) {
            throw new IllegalArgumentException("Reference fragment must start with '/': '" + ref + "'");
        }
        List<String> segments = new ArrayList<>();
        for (String raw : fragment.substring(1).split("/", -1)) {
            segments.add(raw.replace("~1", "/").replace("~0", "~"));
        }
        return segments;
    }

    /** Builds the canonical pointer for the given unescaped segments. */
    public static String encode(List<String> segments) {
        StringBuilder sb = new StringBuilder(ROOT);
        for (String segment : segments) {
            sb.append('/').append(escape(segment));
        }
        return sb.toString();
    }

    /** Returns the canonical pointer of a child of {@code parent}. */
    public static String child(String parent, String segment) {
        return parent + "/" + escape(segment);
    }

    /** Returns the canonical pointer of an indexed child of {@code parent}. */
    public static String child(String parent, int index) {
        return parent + "/" + index;
    }

    /** Re-encodes a local reference in canonical form (so equivalent spellings share a key). */
    public static String canonical(String ref) {
        return encode(decode(ref));
    }

    private static String escape(String segment) {
        return segment.replace("~", "~0").replace("/", "~1");
    }
}
