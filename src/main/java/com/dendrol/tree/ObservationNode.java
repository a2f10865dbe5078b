package com.dendrol.tree;

import com.dendrol.exceptions.StructuralException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.SortedSets;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

public sealed interface ObservationNode {
    /**
     * @return qualifiers in source order; empty when there are none
     */
    ImmutableList<Qualifier> qualifiers();

    /**
     * @return a copy of this node carrying the given qualifiers instead
     */
    ObservationNode withQualifiers(ImmutableList<Qualifier> qualifiers);

    /**
     * One bracketed group of comparisons.
     * <p>
     * {@code objects} is the set of object types named by every comparison
     * beneath this observation. It is redundant with {@code expressions}, and
     * a value that disagrees with them is rejected. Use {@link #of} to have it
     * derived.
     */
    record Observation(
        ImmutableSortedSet<String> objects,
        @Nullable Join join,
        ImmutableList<Qualifier> qualifiers,
        ImmutableList<ComparisonNode> expressions
    ) implements ObservationNode {
        public Observation {
            Objects.requireNonNull(objects, "objects");
            Objects.requireNonNull(expressions, "expressions");
            qualifiers = (qualifiers == null) ? Lists.immutable.empty() : qualifiers;
            if (expressions.isEmpty()) {
                throw new StructuralException("An observation needs at least one comparison");
            }
            if (join == null && expressions.size() > 1) {
                throw new StructuralException(
                    "An observation with " + expressions.size() + " comparisons needs a join");
            }
            if (join != null && expressions.size() < 2) {
                throw new StructuralException(
                    "An observation joined by " + join + " needs at least 2 comparisons, got " + expressions.size());
            }
            if (join == Join.FOLLOWEDBY) {
                throw new StructuralException("FOLLOWEDBY cannot join comparisons");
            }
            ImmutableSortedSet<String> derived = objectTypesOf(expressions);
            if (!objects.equals(derived)) {
                throw new StructuralException(
                    "Observation objects " + objects + " do not match the object types of its comparisons " + derived);
            }
        }

        public static Observation of(@Nullable Join join, ImmutableList<Qualifier> qualifiers, ImmutableList<ComparisonNode> expressions) {
            Objects.requireNonNull(expressions, "expressions");
            return new Observation(objectTypesOf(expressions), join, qualifiers, expressions);
        }

        @Override
        public Observation withQualifiers(ImmutableList<Qualifier> qualifiers) {
            return new Observation(objects, join, qualifiers, expressions);
        }

        /**
         * Collects the {@code object} of every comparison reachable through
         * nested comparison expressions.
         */
        public static ImmutableSortedSet<String> objectTypesOf(Iterable<? extends ComparisonNode> comparisons) {
            MutableSortedSet<String> types = SortedSets.mutable.empty();
            Deque<ComparisonNode> toVisit = new ArrayDeque<>();
            comparisons.forEach(toVisit::push);
            while (!toVisit.isEmpty()) {
                ComparisonNode node = toVisit.pop();
                if (node instanceof ComparisonNode.Comparison comparison) {
                    types.add(comparison.object());
                } else if (node instanceof ComparisonNode.Expression expression) {
                    expression.expressions().forEach(toVisit::push);
                } else {
                    throw new IllegalStateException("Unexpected comparison node: " + node);
                }
            }
            return types.toImmutable();
        }
    }

    /**
     * Two or more observation-level nodes joined by a single operator.
     */
    record Expression(
        Join join,
        ImmutableList<Qualifier> qualifiers,
        ImmutableList<ObservationNode> expressions
    ) implements ObservationNode {
        public Expression {
            Objects.requireNonNull(join, "join");
            Objects.requireNonNull(expressions, "expressions");
            qualifiers = (qualifiers == null) ? Lists.immutable.empty() : qualifiers;
            if (expressions.size() < 2) {
                throw new StructuralException(
                    "An observation expression joined by " + join + " needs at least 2 children, got " + expressions.size());
            }
        }

        @Override
        public Expression withQualifiers(ImmutableList<Qualifier> qualifiers) {
            return new Expression(join, qualifiers, expressions);
        }
    }
}
