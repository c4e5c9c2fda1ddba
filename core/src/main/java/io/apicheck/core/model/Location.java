package io.apicheck.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered path from a document root: each segment is either a {@link String} key or an
 * {@link Integer} index. Used for both instance paths and schema paths.
 *
 * <p>
 * Immutable and thread-safe. {@link #child} returns a new location; the receiver is unchanged.
 */
public final class Location {

    /** The empty path (document root). */
    public static final Location ROOT = new Location(List.of());

    private final List<Object> segments;

    private Location(List<Object> segments) {
        this.segments = segments;
    }

    /**
     * Creates a location from the given segments.
     *
     * @param segments keys ({@link String}) and indices ({@link Integer})
     * @return the location
     * @throws IllegalArgumentException if a segment is neither a String nor an Integer
     */
    public static Location of(Object... segments) {
        Location location = ROOT;
        for (Object segment : segments) {
            if (segment instanceof String key) {
                location = location.child(key);
            } else if (segment instanceof Integer index) {
                location = location.child(index);
            } else {
                throw new IllegalArgumentException("Location segment must be String or Integer, got: " + segment);
            }
        }
        return location;
    }

    /** Returns this location extended by an object key. */
    public Location child(String key) {
        return append(Objects.requireNonNull(key, "key must not be null"));
    }

    /** Returns this location extended by an array index. */
    public Location child(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
        return append(index);
    }

    private Location append(Object segment) {
        List<Object> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new Location(Collections.unmodifiableList(next));
    }

    /** The segments in order from the root. */
    public List<Object> segments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    /**
     * Renders this location as an RFC 6901 JSON pointer ({@code ""} for the root, {@code "/a/0"}
     * otherwise), escaping {@code ~} and {@code /} in keys.
     */
    public String toPointer() {
        StringBuilder sb = new StringBuilder();
        for (Object segment : segments) {
            sb.append('/');
            sb.append(segment.toString().replace("~", "~0").replace("/", "~1"));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location that)) return false;
        return segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return segments.toString();
    }
}
