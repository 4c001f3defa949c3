package org.geoflow.geometry.block;

import java.util.List;
import java.util.Objects;

/**
 * Result of a block's fan-out step.
 *
 * @param asks upstream asks, answered in order.
 * @param parameters side-channel bundle handed to the combination step unevaluated.
 * @param <P> parameter bundle type.
 */
public record FanOut<P>(List<SourceRequest> asks, P parameters) {

    public FanOut {
        asks = List.copyOf(Objects.requireNonNull(asks, "asks"));
        Objects.requireNonNull(parameters, "parameters");
    }
}
