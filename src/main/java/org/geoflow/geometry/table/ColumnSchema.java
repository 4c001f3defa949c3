package org.geoflow.geometry.table;

import lombok.experimental.UtilityClass;
import org.geoflow.core.TypeConstraintException;
import org.geoflow.geometry.merge.Suffixes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Column naming rule shared by schema projection and the index merge.
 *
 * <p>Names present on exactly one side pass through unchanged. Names present on both
 * sides appear twice, once with each suffix.</p>
 */
@UtilityClass
public final class ColumnSchema {
    public static final String REASON_COLUMN_NAME_COLLISION = "MERGE_COLUMN_NAME_COLLISION";

    /**
     * Projects the merged column set from two declared column sets.
     *
     * <p>Pure: reads only the given collections. Independent of the join kind.</p>
     */
    public static Set<String> project(Collection<String> left, Collection<String> right, Suffixes suffixes) {
        return new LinkedHashSet<>(mergedOrder(left, right, suffixes));
    }

    /**
     * Returns output column names in merge order: left columns first, then right.
     *
     * <p>The result may hold duplicates when a suffixed name collides with another
     * column; {@link #requireDistinct(List)} rejects those before data is merged.</p>
     */
    static List<String> mergedOrder(Collection<String> left, Collection<String> right, Suffixes suffixes) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(suffixes, "suffixes");

        Set<String> rightSet = new HashSet<>(right);
        Set<String> leftSet = new HashSet<>(left);
        List<String> names = new ArrayList<>(left.size() + right.size());
        for (String column : left) {
            names.add(rightSet.contains(column) ? suffixes.leftName(column) : column);
        }
        for (String column : right) {
            names.add(leftSet.contains(column) ? suffixes.rightName(column) : column);
        }
        return names;
    }

    /**
     * Fails when two output columns end up with the same name.
     *
     * @throws TypeConstraintException naming the first colliding column.
     */
    static List<String> requireDistinct(List<String> names) {
        Set<String> seen = new HashSet<>(names.size() * 2);
        for (String name : names) {
            if (!seen.add(name)) {
                throw new TypeConstraintException(
                        REASON_COLUMN_NAME_COLLISION,
                        "merged column name '" + name + "' is produced more than once; "
                                + "choose suffixes that keep overlapping columns distinct"
                );
            }
        }
        return names;
    }
}
