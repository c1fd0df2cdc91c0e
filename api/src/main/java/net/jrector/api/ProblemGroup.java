package net.jrector.api;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Groups related {@link ProblemId problems}, optionally nested in a parent group.
 */
public record ProblemGroup(String id, String displayName, @Nullable ProblemGroup parent) {
    public ProblemGroup {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
    }

    public static ProblemGroup create(String id, String displayName) {
        return new ProblemGroup(id, displayName, null);
    }

    @Override
    public String toString() {
        return parent != null ? parent + ":" + id : id;
    }
}
