package org.geoflow.geometry.eval;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Builds evaluators from {@link EvaluationConfig}.
 */
@UtilityClass
public final class GraphEvaluators {

    /**
     * Returns the evaluator described by {@code config}.
     *
     * <p>A parallel evaluator owns its pool; close the returned evaluator when the
     * pipeline is discarded, typically with try-with-resources.</p>
     */
    public static GraphEvaluator create(EvaluationConfig config) {
        Objects.requireNonNull(config, "config");
        if (!config.isParallel()) {
            return SequentialGraphEvaluator.instance();
        }
        return ParallelGraphEvaluator.withParallelism(config.getParallelism());
    }

    public static GraphEvaluator sequential() {
        return SequentialGraphEvaluator.instance();
    }
}
