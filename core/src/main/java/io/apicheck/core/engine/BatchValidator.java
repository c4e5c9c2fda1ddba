package io.apicheck.core.engine;

import io.apicheck.core.error.LimitExceededException;
import io.apicheck.core.model.Instance;
import io.apicheck.core.model.ValidationResult;
import io.apicheck.core.schema.JsonPointers;
import io.apicheck.core.schema.SchemaDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Validates many instances against one document on a fixed worker pool.
 *
 * <p>
 * Results come back in input order. A {@link LimitExceededException} aborts only the instance
 * that raised it; the other entries are unaffected.
 *
 * <p>
 * Owns its executor: close it when done.
 */
public final class BatchValidator implements AutoCloseable {

    /** MDC key holding the label of the instance being validated. */
    public static final String MDC_DOCUMENT = "document";

    private static final Logger LOG = LoggerFactory.getLogger(BatchValidator.class);

    private final SchemaValidator validator;
    private final ExecutorService executor;

    public BatchValidator(SchemaValidator validator) {
        this(validator, Math.max(1, Runtime.getRuntime().availableProcessors()));
    }

    public BatchValidator(SchemaValidator validator, int threads) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive, got: " + threads);
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "apicheck-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /** Validates every instance against the document root. */
    public List<BatchEntry> validateAll(SchemaDocument document, List<Instance> instances) {
        return validateAll(document, JsonPointers.ROOT, instances);
    }

    /**
     * Validates every instance against the sub-schema at {@code pointer}.
     *
     * @return one entry per instance, in input order
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    public List<BatchEntry> validateAll(SchemaDocument document, String pointer, List<Instance> instances) {
        return validateAll(document, pointer, instances, null);
    }

    /**
     * Validates every instance against the sub-schema at {@code pointer}, with the instance's label
     * (typically its file name) in the {@value #MDC_DOCUMENT} MDC key while it is validated.
     *
     * @param labels one label per instance, or {@code null} for none
     * @return one entry per instance, in input order
     * @throws IllegalArgumentException if {@code labels} and {@code instances} differ in size
     * @throws IllegalStateException    if the calling thread is interrupted while waiting
     */
    public List<BatchEntry> validateAll(
            SchemaDocument document, String pointer, List<Instance> instances, List<String> labels) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(instances, "instances must not be null");
        if (labels != null && labels.size() != instances.size()) {
            throw new IllegalArgumentException(
                    "expected " + instances.size() + " label(s), got: " + labels.size());
        }

        List<Future<ValidationResult>> futures = new ArrayList<>(instances.size());
        for (int i = 0; i < instances.size(); i++) {
            Instance instance = instances.get(i);
            String label = labels == null ? null : labels.get(i);
            futures.add(executor.submit(() -> validateLabelled(document, pointer, instance, label)));
        }

        List<BatchEntry> entries = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            entries.add(await(i, futures.get(i)));
        }
        LOG.debug("Batch of {} instance(s) against '{}' finished", entries.size(), document.source());
        return entries;
    }

    private ValidationResult validateLabelled(
            SchemaDocument document, String pointer, Instance instance, String label) {
        if (label == null) {
            return validator.validate(document, pointer, instance);
        }
        MDC.put(MDC_DOCUMENT, label);
        try {
            return validator.validate(document, pointer, instance);
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    private static BatchEntry await(int index, Future<ValidationResult> future) {
        try {
            return BatchEntry.completed(index, future.get());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof LimitExceededException limit) {
                LOG.warn("Instance #{} aborted: {}", index, limit.getMessage());
                return BatchEntry.limitExceeded(index, limit);
            }
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Validation of instance #" + index + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for instance #" + index, e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
