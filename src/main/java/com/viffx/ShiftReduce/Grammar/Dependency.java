package com.viffx.ShiftReduce.Grammar;

import java.util.Objects;

/**
 * One outcome of a dependency rule lookup: the arc direction and the relation it is labeled with.
 *
 * @param direction whether the arc reduces leftwards or rightwards
 * @param relation  the grammatical relation, e.g. {@code subj}
 */
public record Dependency(ArcDirection direction, String relation) {
    public Dependency {
        Objects.requireNonNull(direction, "direction cannot be null");
        Objects.requireNonNull(relation, "relation cannot be null");
    }

    @Override
    public String toString() {
        return direction + "(" + relation + ")";
    }
}
