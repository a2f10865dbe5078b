package com.dendrol;

/**
 * Limits applied while building or decoding pattern trees.
 *
 * @param maxDepth deepest nesting of pattern tree nodes accepted, counting the
 *                 root observation node as 1 and a leaf comparison as one more
 *                 than its parent. Pattern text is also rejected when its
 *                 brackets and parentheses nest deeper than this.
 */
public record DendrolConfig(int maxDepth) {
    public static final int DEFAULT_MAX_DEPTH = 64;

    public static final DendrolConfig DEFAULT = new DendrolConfig(DEFAULT_MAX_DEPTH);

    public DendrolConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
    }

    public DendrolConfig withMaxDepth(int maxDepth) {
        return new DendrolConfig(maxDepth);
    }
}
