package io.apicheck.core.engine;

import io.apicheck.core.engine.format.BuiltinFormat;
import io.apicheck.core.spi.FormatPredicate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named {@code format} predicates. Unknown names are not an error: the {@code format} keyword
 * passes for them.
 *
 * <p>
 * Thread-safe: registration and lookup can happen concurrently.
 */
public final class FormatRegistry {

    private final Map<String, FormatPredicate> predicates = new ConcurrentHashMap<>();

    /** Returns a registry holding every {@link BuiltinFormat}. */
    public static FormatRegistry defaults() {
        FormatRegistry registry = new FormatRegistry();
        for (BuiltinFormat format : BuiltinFormat.values()) {
            registry.register(format);
        }
        return registry;
    }

    /**
     * Registers a predicate under its name, replacing any previous one.
     *
     * @throws NullPointerException     if predicate is null
     * @throws IllegalArgumentException if the name is null or empty
     */
    public void register(FormatPredicate predicate) {
        if (predicate == null) {
            throw new NullPointerException("predicate must not be null");
        }
        String name = predicate.id();
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("format name must not be null or empty");
        }
        predicates.put(name, predicate);
    }

    public Optional<FormatPredicate> lookup(String name) {
        return Optional.ofNullable(predicates.get(name));
    }

    public int size() {
        return predicates.size();
    }
}
