package com.workstream.core.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural difference between two contract specifications, by JSON path.
 * Removed and retyped paths break existing consumers; added paths do not.
 */
public record ContractDiff(
    Set<String> added,
    Set<String> removed,
    Set<String> retyped
) {
    public ContractDiff {
        added = Collections.unmodifiableSet(new TreeSet<>(added));
        removed = Collections.unmodifiableSet(new TreeSet<>(removed));
        retyped = Collections.unmodifiableSet(new TreeSet<>(retyped));
    }

    public static ContractDiff empty() {
        return new ContractDiff(Set.of(), Set.of(), Set.of());
    }

    public boolean isBreaking() {
        return !removed.isEmpty() || !retyped.isEmpty();
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && retyped.isEmpty();
    }

    public String summary() {
        return String.format("added=%s removed=%s retyped=%s", added, removed, retyped);
    }
}
