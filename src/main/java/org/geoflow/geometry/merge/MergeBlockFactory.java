package org.geoflow.geometry.merge;

import lombok.experimental.UtilityClass;
import org.geoflow.core.TypeConstraintException;
import org.geoflow.core.UnsupportedModeException;
import org.geoflow.geometry.block.GeometrySource;
import org.geoflow.geometry.eval.GraphEvaluator;
import org.geoflow.geometry.eval.GraphEvaluators;

import java.util.Arrays;
import java.util.List;

/**
 * Strict construction of merge blocks from untyped pipeline arguments.
 *
 * <p>Pipeline graphs assembled from serialized definitions hand over plain objects.
 * Every argument is checked here, before any request can be issued, so a malformed
 * graph fails while it is being built.</p>
 */
@UtilityClass
public final class MergeBlockFactory {
    public static final String REASON_SOURCE_TYPE = "MERGE_SOURCE_TYPE";
    public static final String REASON_SETTINGS_REQUIRED = "MERGE_SETTINGS_REQUIRED";
    public static final String REASON_JOIN_KIND_REQUIRED = "MERGE_JOIN_KIND_REQUIRED";
    public static final String REASON_SUFFIXES_INVALID = "MERGE_SUFFIXES_INVALID";

    /**
     * Creates an {@code INNER} merge with default suffixes.
     */
    public static MergeGeometryBlocks create(Object left, Object right) {
        return create(left, right, JoinKind.INNER, Suffixes.DEFAULT);
    }

    /**
     * Creates a merge with default suffixes.
     */
    public static MergeGeometryBlocks create(Object left, Object right, Object how) {
        return create(left, right, how, Suffixes.DEFAULT);
    }

    /**
     * Creates a merge block evaluated on the calling thread.
     *
     * @param left left source; must be a {@link GeometrySource}.
     * @param right right source; must be a {@link GeometrySource}.
     * @param how a {@link JoinKind} or one of the ids {@code left, right, inner, outer}.
     * @param suffixes a {@link Suffixes}, or a list/array of exactly two strings.
     * @return validated merge block.
     * @throws TypeConstraintException when a source or the suffixes have the wrong type or shape.
     * @throws UnsupportedModeException when {@code how} is not a known join kind.
     */
    public static MergeGeometryBlocks create(Object left, Object right, Object how, Object suffixes) {
        return create(left, right, how, suffixes, GraphEvaluators.sequential());
    }

    /**
     * Creates a merge block with an explicit evaluator.
     */
    public static MergeGeometryBlocks create(
            Object left,
            Object right,
            Object how,
            Object suffixes,
            GraphEvaluator evaluator
    ) {
        GeometrySource leftSource = toSource(left, "left");
        GeometrySource rightSource = toSource(right, "right");
        MergeSettings settings = MergeSettings.builder()
                .joinKind(toJoinKind(how))
                .suffixes(toSuffixes(suffixes))
                .build();
        return new MergeGeometryBlocks(leftSource, rightSource, settings, evaluator);
    }

    /**
     * Checks the geometry-source capability of one argument.
     */
    static GeometrySource toSource(Object candidate, String argument) {
        if (!(candidate instanceof GeometrySource)) {
            throw new TypeConstraintException(
                    REASON_SOURCE_TYPE,
                    argument + ": '" + TypeConstraintException.describeType(candidate) + "' object is not allowed"
            );
        }
        return (GeometrySource) candidate;
    }

    /**
     * Resolves a join kind from an enum constant or id string.
     */
    static JoinKind toJoinKind(Object how) {
        if (how instanceof JoinKind) {
            return (JoinKind) how;
        }
        if (how instanceof String) {
            return JoinKind.fromId((String) how);
        }
        throw new UnsupportedModeException(JoinKind.REASON_UNKNOWN_JOIN_KIND, how, JoinKind.ids());
    }

    /**
     * Resolves a suffix pair. No coercion: both elements must already be strings.
     */
    static Suffixes toSuffixes(Object suffixes) {
        if (suffixes instanceof Suffixes) {
            return (Suffixes) suffixes;
        }
        List<?> elements;
        if (suffixes instanceof List) {
            elements = (List<?>) suffixes;
        } else if (suffixes instanceof Object[]) {
            elements = Arrays.asList((Object[]) suffixes);
        } else {
            throw invalidSuffixes(suffixes);
        }
        if (elements.size() != 2
                || !(elements.get(0) instanceof String)
                || !(elements.get(1) instanceof String)) {
            throw invalidSuffixes(suffixes);
        }
        return new Suffixes((String) elements.get(0), (String) elements.get(1));
    }

    private static TypeConstraintException invalidSuffixes(Object suffixes) {
        return new TypeConstraintException(
                REASON_SUFFIXES_INVALID,
                "'" + TypeConstraintException.describeType(suffixes)
                        + "' object is not allowed, suffixes must be exactly two strings"
        );
    }
}
