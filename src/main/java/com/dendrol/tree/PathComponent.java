package com.dendrol.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One step of an object path: a property name, or a subscript into a list.
 */
public sealed interface PathComponent {
    record Property(String name) implements PathComponent {
        public Property {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Subscript shaped like a slice. {@code [1]} has only a stop of 1, and
     * {@code [*]} has the {@link Wildcard} stop, matching any element.
     */
    record Index(@Nullable Integer start, @Nullable Stop stop, @Nullable Integer step) implements PathComponent {
        public static Index at(int position) {
            return new Index(null, new Position(position), null);
        }

        public static Index any() {
            return new Index(null, Wildcard.ANY, null);
        }
    }

    sealed interface Stop {}

    record Position(int value) implements Stop {}

    enum Wildcard implements Stop {
        ANY
    }
}
