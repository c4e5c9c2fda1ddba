package io.apicheck.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * SPI for a named {@code format} check (e.g. {@code date}, {@code uuid}).
 *
 * <p>
 * A predicate only judges values of the JSON type it is about and returns {@code true} for any
 * other value, so {@code {"format": "email"}} alone does not reject numbers. Implementations MUST
 * be thread-safe and MUST NOT throw.
 */
public interface FormatPredicate {

    /** The format name as written in schemas, e.g. {@code "date-time"}. */
    String id();

    /** Returns {@code true} if the value conforms to the format (or is not of its type). */
    boolean test(JsonNode value);
}
