package org.geoflow.geometry.merge;

import lombok.extern.slf4j.Slf4j;
import org.geoflow.core.TypeConstraintException;
import org.geoflow.geometry.block.FanOut;
import org.geoflow.geometry.block.GeometryBlock;
import org.geoflow.geometry.block.GeometrySource;
import org.geoflow.geometry.block.SourceRequest;
import org.geoflow.geometry.eval.GraphEvaluator;
import org.geoflow.geometry.eval.GraphEvaluators;
import org.geoflow.geometry.extent.Extent;
import org.geoflow.geometry.request.ExtentResponse;
import org.geoflow.geometry.request.FeatureResponse;
import org.geoflow.geometry.request.GeometryRequest;
import org.geoflow.geometry.request.GeometryResponse;
import org.geoflow.geometry.request.RequestMode;
import org.geoflow.geometry.table.ColumnSchema;
import org.geoflow.geometry.table.FeatureTable;
import org.geoflow.geometry.table.FeatureTableMerger;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Merges two geometry sources that share a row index into one.
 *
 * <p>Both sources should derive from the same features, so that equal row indexes
 * denote the same feature; the attribute columns each side added are combined.
 * Columns present on both sides are disambiguated with {@link Suffixes}.</p>
 *
 * <p>Per request mode:</p>
 * <ul>
 * <li>{@code INTERSECTS}/{@code CENTROID}: index-aligned table merge using the join kind.</li>
 * <li>{@code EXTENT}: {@code LEFT}/{@code RIGHT} return that side's response as is,
 * {@code INNER} intersects both boxes, {@code OUTER} covers both boxes.</li>
 * </ul>
 * <p>The projection of a combined response is always the left one; both inputs are
 * assumed to be co-projected. The block holds only immutable configuration and is
 * safe to evaluate concurrently.</p>
 */
@Slf4j
public final class MergeGeometryBlocks extends GeometryBlock<MergeParameters> {
    public static final String REASON_SOURCE_REQUIRED = "MERGE_SOURCE_REQUIRED";
    public static final String REASON_RESPONSE_COUNT = "MERGE_RESPONSE_COUNT";
    public static final String REASON_RESPONSE_SHAPE_MISMATCH = "MERGE_RESPONSE_SHAPE_MISMATCH";

    private final GeometrySource left;
    private final GeometrySource right;
    private final MergeSettings settings;

    /**
     * Creates an {@code INNER} merge with default suffixes.
     */
    public MergeGeometryBlocks(GeometrySource left, GeometrySource right) {
        this(left, right, MergeSettings.defaults());
    }

    public MergeGeometryBlocks(GeometrySource left, GeometrySource right, JoinKind joinKind) {
        this(left, right, MergeSettings.of(joinKind));
    }

    public MergeGeometryBlocks(GeometrySource left, GeometrySource right, JoinKind joinKind, Suffixes suffixes) {
        this(left, right, MergeSettings.builder().joinKind(joinKind).suffixes(suffixes).build());
    }

    public MergeGeometryBlocks(GeometrySource left, GeometrySource right, MergeSettings settings) {
        this(left, right, settings, GraphEvaluators.sequential());
    }

    /**
     * Creates a merge block with an explicit evaluator for its upstream asks.
     *
     * @param left left source; its projection wins in combined responses.
     * @param right right source.
     * @param settings join kind and suffixes.
     * @param evaluator strategy evaluating the two upstream asks.
     * @throws TypeConstraintException when a source, the join kind or the suffixes are missing.
     */
    public MergeGeometryBlocks(
            GeometrySource left,
            GeometrySource right,
            MergeSettings settings,
            GraphEvaluator evaluator
    ) {
        super(evaluator);
        this.left = requireSource(left, "left");
        this.right = requireSource(right, "right");
        this.settings = requireSettings(settings);
    }

    public GeometrySource left() {
        return left;
    }

    public GeometrySource right() {
        return right;
    }

    public JoinKind joinKind() {
        return settings.getJoinKind();
    }

    public Suffixes suffixes() {
        return settings.getSuffixes();
    }

    public MergeSettings settings() {
        return settings;
    }

    /**
     * Projects the merged column set from the declared upstream columns.
     *
     * <p>Issues no request and does not depend on the join kind.</p>
     */
    @Override
    public Set<String> columns() {
        return ColumnSchema.project(left.columns(), right.columns(), settings.getSuffixes());
    }

    /**
     * Forwards the unmodified request to both sources and bundles the merge parameters.
     */
    @Override
    public FanOut<MergeParameters> sourcesAndRequests(GeometryRequest request) {
        MergeParameters parameters = new MergeParameters(
                settings.getJoinKind(),
                settings.getSuffixes(),
                request.getMode()
        );
        return new FanOut<>(
                List.of(new SourceRequest(left, request), new SourceRequest(right, request)),
                parameters
        );
    }

    @Override
    protected GeometryResponse process(List<GeometryResponse> responses, MergeParameters parameters) {
        if (responses.size() != 2) {
            throw new TypeConstraintException(
                    REASON_RESPONSE_COUNT,
                    "merge expects exactly 2 upstream responses, got " + responses.size()
            );
        }
        return process(responses.get(0), responses.get(1), parameters);
    }

    /**
     * Combines a left and a right response.
     *
     * <p>Pure: the result depends only on the arguments.</p>
     *
     * @throws TypeConstraintException when a response shape does not match the mode.
     */
    public static GeometryResponse process(
            GeometryResponse leftResponse,
            GeometryResponse rightResponse,
            MergeParameters parameters
    ) {
        RequestMode mode = parameters.mode();
        log.debug("Combining {} responses with join kind {}", mode, parameters.joinKind());
        return switch (mode) {
            case INTERSECTS, CENTROID -> mergeFeatures(
                    requireFeatures(leftResponse, mode, "left"),
                    requireFeatures(rightResponse, mode, "right"),
                    parameters
            );
            case EXTENT -> mergeExtents(
                    requireExtent(leftResponse, mode, "left"),
                    requireExtent(rightResponse, mode, "right"),
                    parameters.joinKind()
            );
        };
    }

    private static FeatureResponse mergeFeatures(
            FeatureResponse leftResponse,
            FeatureResponse rightResponse,
            MergeParameters parameters
    ) {
        FeatureTable merged = FeatureTableMerger.merge(
                leftResponse.getFeatures(),
                rightResponse.getFeatures(),
                parameters.joinKind(),
                parameters.suffixes()
        );
        log.debug("Merged {} left rows and {} right rows into {} rows",
                leftResponse.getFeatures().rowCount(), rightResponse.getFeatures().rowCount(), merged.rowCount());
        return FeatureResponse.of(merged, leftResponse.getProjection());
    }

    private static ExtentResponse mergeExtents(
            ExtentResponse leftResponse,
            ExtentResponse rightResponse,
            JoinKind joinKind
    ) {
        String projection = leftResponse.getProjection();
        return switch (joinKind) {
            case LEFT -> leftResponse;
            case RIGHT -> rightResponse;
            case INNER -> ExtentResponse.of(
                    intersectExtents(leftResponse.getExtent(), rightResponse.getExtent()),
                    projection
            );
            case OUTER -> ExtentResponse.of(
                    coverExtents(leftResponse.getExtent(), rightResponse.getExtent()),
                    projection
            );
        };
    }

    private static Optional<Extent> intersectExtents(Optional<Extent> leftExtent, Optional<Extent> rightExtent) {
        if (leftExtent.isEmpty() || rightExtent.isEmpty()) {
            return Optional.empty();
        }
        return leftExtent.get().intersection(rightExtent.get());
    }

    private static Optional<Extent> coverExtents(Optional<Extent> leftExtent, Optional<Extent> rightExtent) {
        if (leftExtent.isPresent() && rightExtent.isPresent()) {
            return Optional.of(leftExtent.get().union(rightExtent.get()));
        }
        return leftExtent.isPresent() ? leftExtent : rightExtent;
    }

    private static FeatureResponse requireFeatures(GeometryResponse response, RequestMode mode, String side) {
        if (!(response instanceof FeatureResponse)) {
            throw shapeMismatch(response, mode, side);
        }
        return (FeatureResponse) response;
    }

    private static ExtentResponse requireExtent(GeometryResponse response, RequestMode mode, String side) {
        if (!(response instanceof ExtentResponse)) {
            throw shapeMismatch(response, mode, side);
        }
        return (ExtentResponse) response;
    }

    private static TypeConstraintException shapeMismatch(GeometryResponse response, RequestMode mode, String side) {
        return new TypeConstraintException(
                REASON_RESPONSE_SHAPE_MISMATCH,
                side + " response of type '" + TypeConstraintException.describeType(response)
                        + "' does not answer mode " + mode.id()
        );
    }

    private static GeometrySource requireSource(GeometrySource source, String argument) {
        if (source == null) {
            throw new TypeConstraintException(
                    REASON_SOURCE_REQUIRED,
                    argument + ": 'null' object is not allowed, a geometry source is required"
            );
        }
        return source;
    }

    private static MergeSettings requireSettings(MergeSettings settings) {
        if (settings == null) {
            throw new TypeConstraintException(MergeBlockFactory.REASON_SETTINGS_REQUIRED, "settings must be provided");
        }
        if (settings.getJoinKind() == null) {
            throw new TypeConstraintException(MergeBlockFactory.REASON_JOIN_KIND_REQUIRED, "joinKind must be provided");
        }
        if (settings.getSuffixes() == null) {
            throw new TypeConstraintException(MergeBlockFactory.REASON_SUFFIXES_INVALID, "suffixes must be provided");
        }
        return settings;
    }
}
