package org.geoflow.geometry.eval;

import org.geoflow.geometry.block.SourceRequest;
import org.geoflow.geometry.request.GeometryResponse;

import java.util.List;

/**
 * Strategy that answers a block's upstream asks.
 *
 * <p>Implementations must return responses in ask order and must let failures raised
 * by a source propagate unchanged. An evaluator holding worker threads releases them
 * on {@link #close()}.</p>
 */
public interface GraphEvaluator extends AutoCloseable {

    /**
     * Evaluates every ask and returns the responses in ask order.
     */
    List<GeometryResponse> evaluate(List<SourceRequest> asks);

    /**
     * Releases resources owned by this evaluator. No-op by default.
     */
    @Override
    default void close() {
    }
}
