package com.dendrol.tree;

import com.dendrol.exceptions.StructuralException;

/**
 * Operator joining the children of an expression.
 */
public enum Join {
    AND,
    OR,
    FOLLOWEDBY;

    /**
     * Operators are matched case-insensitively, as the grammar's keywords are
     * normalized to upper case in the tree.
     */
    public static Join fromKeyword(String keyword) {
        for (Join join : values()) {
            if (join.name().equalsIgnoreCase(keyword)) {
                return join;
            }
        }
        throw new StructuralException("Unknown join operator: " + keyword);
    }
}
