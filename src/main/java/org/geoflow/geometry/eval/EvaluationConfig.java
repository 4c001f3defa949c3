package org.geoflow.geometry.eval;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for building a {@link GraphEvaluator}.
 */
@Value
@Builder
public class EvaluationConfig {

    /**
     * Whether independent upstream asks run concurrently.
     */
    @Builder.Default
    boolean parallel = false;

    /**
     * Worker count for parallel evaluation. Ignored when {@code parallel=false}.
     */
    @Builder.Default
    int parallelism = Runtime.getRuntime().availableProcessors();

    /**
     * Returns convenience config for calling-thread evaluation.
     */
    public static EvaluationConfig sequential() {
        return EvaluationConfig.builder().build();
    }

    /**
     * Returns convenience config for parallel evaluation.
     *
     * @param parallelism worker count; must be {@code > 0}.
     */
    public static EvaluationConfig parallel(int parallelism) {
        return EvaluationConfig.builder()
                .parallel(true)
                .parallelism(parallelism)
                .build();
    }
}
