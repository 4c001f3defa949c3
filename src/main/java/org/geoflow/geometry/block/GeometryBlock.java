package org.geoflow.geometry.block;

import lombok.extern.slf4j.Slf4j;
import org.geoflow.geometry.eval.GraphEvaluator;
import org.geoflow.geometry.request.GeometryRequest;
import org.geoflow.geometry.request.GeometryResponse;

import java.util.List;
import java.util.Objects;

/**
 * Base for blocks that derive their data from upstream sources.
 *
 * <p>Evaluation is split into a fan-out step ({@link #sourcesAndRequests}) and a pure
 * combination step ({@link #process}). The evaluator decides whether the upstream
 * asks run sequentially or in parallel; combination only starts once every
 * response is available.</p>
 *
 * @param <P> parameter bundle carried from fan-out to combination.
 */
@Slf4j
public abstract class GeometryBlock<P> implements GeometrySource {
    private final GraphEvaluator evaluator;

    protected GeometryBlock(GraphEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    /**
     * Decides what to ask of each upstream source for one request.
     */
    public abstract FanOut<P> sourcesAndRequests(GeometryRequest request);

    /**
     * Combines upstream responses, given in ask order.
     */
    protected abstract GeometryResponse process(List<GeometryResponse> responses, P parameters);

    @Override
    public final GeometryResponse getData(GeometryRequest request) {
        Objects.requireNonNull(request, "request");
        FanOut<P> fanOut = sourcesAndRequests(request);
        log.debug("{} fans out {} asks for mode {}",
                getClass().getSimpleName(), fanOut.asks().size(), request.getMode());
        List<GeometryResponse> responses = evaluator.evaluate(fanOut.asks());
        return process(responses, fanOut.parameters());
    }
}
