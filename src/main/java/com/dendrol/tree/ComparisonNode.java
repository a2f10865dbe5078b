package com.dendrol.tree;

import com.dendrol.exceptions.StructuralException;
import org.eclipse.collections.api.list.ImmutableList;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public sealed interface ComparisonNode {
    /**
     * A single property-to-literal test, such as {@code file:name = 'a.exe'}.
     * <p>
     * {@code negated} is either {@code true} or absent ({@code null}); a
     * {@code false} argument is stored as absent, so a comparison has only
     * one representation of "not negated".
     */
    record Comparison(
        String object,
        ImmutableList<PathComponent> path,
        @Nullable Boolean negated,
        String operator,
        Literal value
    ) implements ComparisonNode {
        public Comparison {
            Objects.requireNonNull(object, "object");
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(value, "value");
            if (object.isEmpty()) {
                throw new StructuralException("Comparison object type must not be empty");
            }
            if (path.isEmpty()) {
                throw new StructuralException("Comparison path must not be empty: " + object);
            }
            if (operator.isEmpty()) {
                throw new StructuralException("Comparison operator must not be empty: " + object);
            }
            if (Boolean.FALSE.equals(negated)) {
                negated = null;
            }
        }

        public boolean isNegated() {
            return negated != null;
        }
    }

    /**
     * Two or more comparisons joined by a single AND or OR.
     * Qualifiers never apply at this level.
     */
    record Expression(Join join, ImmutableList<ComparisonNode> expressions) implements ComparisonNode {
        public Expression {
            Objects.requireNonNull(join, "join");
            Objects.requireNonNull(expressions, "expressions");
            if (join == Join.FOLLOWEDBY) {
                throw new StructuralException("FOLLOWEDBY cannot join comparisons");
            }
            if (expressions.size() < 2) {
                throw new StructuralException(
                    "A comparison expression joined by " + join + " needs at least 2 children, got " + expressions.size());
            }
        }
    }
}
