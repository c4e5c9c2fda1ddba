package io.apicheck.core.engine;

import io.apicheck.core.schema.SchemaNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-call reference bookkeeping: the chain of reference targets currently being evaluated and a
 * cache of already resolved targets.
 *
 * <p>
 * Not thread-safe. One instance belongs to one {@link SchemaValidator#validate} call and is
 * discarded afterwards, so concurrent calls never share state.
 */
public final class ResolutionContext {

    private final Deque<String> chain = new ArrayDeque<>();
    private final Map<String, SchemaNode> cache = new HashMap<>();

    /** Pushes a reference target onto the chain before its schema is evaluated. */
    public void enter(String pointer) {
        chain.push(pointer);
    }

    /** Pops the most recently entered target. */
    public void exit() {
        chain.pop();
    }

    /** Number of references being evaluated along the current path. */
    public int depth() {
        return chain.size();
    }

    /** Returns {@code true} if the target is already being evaluated further up the path. */
    public boolean inProgress(String pointer) {
        return chain.contains(pointer);
    }

    SchemaNode cached(String pointer) {
        return cache.get(pointer);
    }

    void cache(String pointer, SchemaNode node) {
        cache.put(pointer, node);
    }
}
