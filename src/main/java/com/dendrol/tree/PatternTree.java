package com.dendrol.tree;

import java.util.Objects;

/**
 * Root of a normalized STIX pattern.
 */
public record PatternTree(ObservationNode root) {
    public PatternTree {
        Objects.requireNonNull(root, "root");
    }
}
