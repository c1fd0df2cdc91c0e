package net.jrector.api;

import java.util.Objects;

/**
 * Identifies a kind of problem in the problems report. See {@link Problems} for the ones reported by the engine.
 */
public record ProblemId(String id, String displayName, ProblemGroup group) {
    public ProblemId {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(group, "group");
    }

    public static ProblemId create(String id, String displayName, ProblemGroup group) {
        return new ProblemId(id, displayName, group);
    }

    @Override
    public String toString() {
        return group + ":" + id;
    }
}
