package io.apicheck.core.engine;

import io.apicheck.core.engine.keyword.ArrayShapeEvaluator;
import io.apicheck.core.engine.keyword.CombinatorEvaluator;
import io.apicheck.core.engine.keyword.ConditionalEvaluator;
import io.apicheck.core.engine.keyword.EnumEvaluator;
import io.apicheck.core.engine.keyword.FormatEvaluator;
import io.apicheck.core.engine.keyword.LengthEvaluator;
import io.apicheck.core.engine.keyword.ObjectShapeEvaluator;
import io.apicheck.core.engine.keyword.PatternEvaluator;
import io.apicheck.core.engine.keyword.RangeEvaluator;
import io.apicheck.core.engine.keyword.ReferenceEvaluator;
import io.apicheck.core.engine.keyword.TypeEvaluator;
import io.apicheck.core.spi.ConstraintEvaluator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps schema keywords to the {@link ConstraintEvaluator} that handles them. Keywords with no
 * registered evaluator are ignored during evaluation (annotations, unknown vocabulary).
 *
 * <p>
 * Thread-safe: registration and lookup can happen concurrently.
 */
public final class EvaluatorRegistry {

    private final Map<String, ConstraintEvaluator> byKeyword = new ConcurrentHashMap<>();

    /** Returns a registry with every built-in evaluator registered. */
    public static EvaluatorRegistry defaults() {
        EvaluatorRegistry registry = new EvaluatorRegistry();
        registry.register(new TypeEvaluator());
        registry.register(new EnumEvaluator());
        registry.register(new RangeEvaluator());
        registry.register(new LengthEvaluator());
        registry.register(new PatternEvaluator());
        registry.register(new FormatEvaluator());
        registry.register(new CombinatorEvaluator());
        registry.register(new ConditionalEvaluator());
        registry.register(new ObjectShapeEvaluator());
        registry.register(new ArrayShapeEvaluator());
        registry.register(new ReferenceEvaluator());
        return registry;
    }

    /**
     * Registers an evaluator for each of its keywords. A keyword already registered is taken over
     * by the new evaluator (last-write-wins).
     *
     * @throws NullPointerException     if evaluator is null
     * @throws IllegalArgumentException if the evaluator declares no keywords
     */
    public void register(ConstraintEvaluator evaluator) {
        if (evaluator == null) {
            throw new NullPointerException("evaluator must not be null");
        }
        if (evaluator.keywords() == null || evaluator.keywords().isEmpty()) {
            throw new IllegalArgumentException(
                    "evaluator " + evaluator.getClass().getName() + " declares no keywords");
        }
        for (String keyword : evaluator.keywords()) {
            byKeyword.put(keyword, evaluator);
        }
    }

    /** Looks up the evaluator for a keyword. */
    public Optional<ConstraintEvaluator> lookup(String keyword) {
        return Optional.ofNullable(byKeyword.get(keyword));
    }

    /** Returns {@code true} if the keyword has an evaluator. */
    public boolean handles(String keyword) {
        return byKeyword.containsKey(keyword);
    }

    /** Number of registered keywords. */
    public int size() {
        return byKeyword.size();
    }
}
