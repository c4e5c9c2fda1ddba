package io.apicheck.core.engine;

import io.apicheck.core.model.MessageDirection;

/**
 * Limits and message context for one validator.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxDepth  maximum number of references being evaluated at once along one path; deeper
 *                  references produce a {@code DEPTH_EXCEEDED} record (default: 100)
 * @param maxSteps  maximum number of schema node evaluations per call; exceeding it aborts the
 *                  call with {@link io.apicheck.core.error.LimitExceededException} (default:
 *                  1,000,000)
 * @param direction whether the instance is a request or a response body, for OpenAPI
 *                  {@code readOnly}/{@code writeOnly}; {@code null} disables access-mode checks
 */
public record ValidatorOptions(int maxDepth, long maxSteps, MessageDirection direction) {

    /** Default options: depth 100, one million steps, no message direction. */
    public static final ValidatorOptions DEFAULT = new ValidatorOptions(100, 1_000_000L, null);

    public ValidatorOptions {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
    }

    public ValidatorOptions withMaxDepth(int newMaxDepth) {
        return new ValidatorOptions(newMaxDepth, maxSteps, direction);
    }

    public ValidatorOptions withMaxSteps(long newMaxSteps) {
        return new ValidatorOptions(maxDepth, newMaxSteps, direction);
    }

    public ValidatorOptions withDirection(MessageDirection newDirection) {
        return new ValidatorOptions(maxDepth, maxSteps, newDirection);
    }
}
