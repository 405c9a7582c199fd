package com.claimflow.pipeline;

/**
 * Outcome of a pipeline stage that is allowed to stop the run.
 */
sealed interface StageResult<T> {

    /** The stage output; only valid on success. */
    T value();

    record Success<T>(T value) implements StageResult<T> {}

    record Failure<T>(String reason) implements StageResult<T> {

        @Override
        public T value() {
            throw new IllegalStateException("stage failed: " + reason);
        }
    }

    static <T> StageResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> StageResult<T> failure(String reason) {
        return new Failure<>(reason);
    }
}
