package com.inventory.anomaly.engine;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Static descriptor of one node of the pipeline graph.
 *
 * <p>{@code contribution} is applied exactly once, after the work succeeds, to copy
 * the parts of the output that belong in the run result into the accumulator.
 */
@Getter
@Builder
public class Task<T> {

    @NonNull
    private final String id;

    @Singular("dependsOn")
    private final List<String> dependencies;

    @NonNull
    private final TaskWork<T> work;

    @NonNull
    private final RetryPolicy retryPolicy;

    private final boolean required;

    @Builder.Default
    private final BiConsumer<T, RunResultAccumulator> contribution = (output, accumulator) -> { };
}
