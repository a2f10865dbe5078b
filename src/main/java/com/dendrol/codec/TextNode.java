package com.dendrol.codec;

import com.dendrol.tree.Literal;
import org.eclipse.collections.api.list.ImmutableList;
import org.jetbrains.annotations.Nullable;

/**
 * Untyped document read from canonical text, before it is checked against the
 * shape of a pattern tree. Every node remembers the line it started on.
 */
public sealed interface TextNode {
    int line();

    /**
     * @param text  the scalar as written, after unquoting
     * @param value what the scalar resolves to, or {@code null} for a YAML null
     */
    record Scalar(String text, @Nullable Literal value, int line) implements TextNode {
        public boolean isNull() {
            return value == null;
        }
    }

    record Entry(String key, TextNode value, int line) {}

    /**
     * Sets ({@code {a, b}} or {@code ? a} lines) are mappings whose values are
     * all null.
     */
    record Mapping(ImmutableList<Entry> entries, int line) implements TextNode {}

    record Sequence(ImmutableList<TextNode> items, int line) implements TextNode {}
}
