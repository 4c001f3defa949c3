package org.geoflow.geometry.eval;

import lombok.extern.slf4j.Slf4j;
import org.geoflow.geometry.block.SourceRequest;
import org.geoflow.geometry.request.GeometryResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;

/**
 * Evaluates independent asks concurrently and joins on all of them.
 *
 * <p>The last ask runs on the calling thread. Failures raised by a source are
 * rethrown unwrapped. When the evaluator owns its pool, {@link #close()} shuts it
 * down; an injected executor is left to its owner.</p>
 */
@Slf4j
public final class ParallelGraphEvaluator implements GraphEvaluator {
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * Creates an evaluator on a caller-managed executor.
     */
    public ParallelGraphEvaluator(ExecutorService executor) {
        this(Objects.requireNonNull(executor, "executor"), false);
    }

    private ParallelGraphEvaluator(ExecutorService executor, boolean ownsExecutor) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Creates an evaluator owning a fork-join pool of the given parallelism.
     *
     * <p>Fork-join workers compensate while blocked on nested joins, so nested parallel
     * blocks cannot starve the pool.</p>
     */
    public static ParallelGraphEvaluator withParallelism(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        return new ParallelGraphEvaluator(new ForkJoinPool(parallelism), true);
    }

    @Override
    public List<GeometryResponse> evaluate(List<SourceRequest> asks) {
        Objects.requireNonNull(asks, "asks");
        int count = asks.size();
        if (count == 0) {
            return List.of();
        }

        List<CompletableFuture<GeometryResponse>> pending = new ArrayList<>(count - 1);
        for (int i = 0; i < count - 1; i++) {
            SourceRequest ask = asks.get(i);
            pending.add(CompletableFuture.supplyAsync(
                    () -> ask.source().getData(ask.request()),
                    executor
            ));
        }
        log.debug("Dispatched {} asks to executor, evaluating last ask inline", pending.size());

        SourceRequest last = asks.get(count - 1);
        GeometryResponse lastResponse;
        try {
            lastResponse = last.source().getData(last.request());
        } catch (RuntimeException | Error ex) {
            cancelAll(pending);
            throw ex;
        }

        List<GeometryResponse> responses = new ArrayList<>(count);
        for (CompletableFuture<GeometryResponse> future : pending) {
            responses.add(await(future, pending));
        }
        responses.add(lastResponse);
        return responses;
    }

    private static GeometryResponse await(
            CompletableFuture<GeometryResponse> future,
            List<CompletableFuture<GeometryResponse>> pending
    ) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancelAll(pending);
            throw new IllegalStateException("Interrupted while waiting for upstream responses", ex);
        } catch (ExecutionException ex) {
            cancelAll(pending);
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Upstream evaluation failed", cause);
        }
    }

    private static void cancelAll(List<CompletableFuture<GeometryResponse>> pending) {
        for (CompletableFuture<GeometryResponse> future : pending) {
            future.cancel(false);
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
        }
    }
}
