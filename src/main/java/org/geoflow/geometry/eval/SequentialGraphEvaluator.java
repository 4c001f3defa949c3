package org.geoflow.geometry.eval;

import org.geoflow.geometry.block.SourceRequest;
import org.geoflow.geometry.request.GeometryResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates asks one after another on the calling thread.
 */
public final class SequentialGraphEvaluator implements GraphEvaluator {
    private static final SequentialGraphEvaluator INSTANCE = new SequentialGraphEvaluator();

    private SequentialGraphEvaluator() {
    }

    public static SequentialGraphEvaluator instance() {
        return INSTANCE;
    }

    @Override
    public List<GeometryResponse> evaluate(List<SourceRequest> asks) {
        Objects.requireNonNull(asks, "asks");
        List<GeometryResponse> responses = new ArrayList<>(asks.size());
        for (SourceRequest ask : asks) {
            responses.add(ask.source().getData(ask.request()));
        }
        return responses;
    }
}
