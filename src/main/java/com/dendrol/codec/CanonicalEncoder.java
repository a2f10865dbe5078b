package com.dendrol.codec;

import com.dendrol.exceptions.EncodingException;
import com.dendrol.tree.ComparisonNode;
import com.dendrol.tree.Literal;
import com.dendrol.tree.ObservationNode;
import com.dendrol.tree.PathComponent;
import com.dendrol.tree.PatternTree;
import com.dendrol.tree.Qualifier;
import org.eclipse.collections.api.list.ImmutableList;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.Base64;

/**
 * Writes a {@link PatternTree} as canonical block-style text.
 * <p>
 * Every field of every node is written, in a fixed order, whether or not it
 * has a value. Two equal trees always encode to the same text.
 */
public final class CanonicalEncoder {
    private static final Logger LOGGER = LoggerFactory.getLogger(CanonicalEncoder.class);

    private static final int STEP = 2;

    public String encode(PatternTree tree) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("pattern:\n");
        observationNode(tree.root(), STEP, false, sb);
        LOGGER.trace("Encoded pattern tree to {} characters", sb.length());
        return sb.toString();
    }

    private void observationNode(ObservationNode node, int indent, boolean listItem, StringBuilder sb) {
        if (node instanceof ObservationNode.Observation observation) {
            int fields = open("observation", indent, listItem, sb);
            objects(observation, fields, sb);
            field("join", (observation.join() == null) ? null : observation.join().name(), fields, sb);
            qualifiers(observation.qualifiers(), fields, sb);
            line(fields, "expressions:", sb);
            for (ComparisonNode child : observation.expressions()) {
                comparisonNode(child, fields + STEP, sb);
            }
        } else if (node instanceof ObservationNode.Expression expression) {
            int fields = open("expression", indent, listItem, sb);
            field("join", expression.join().name(), fields, sb);
            qualifiers(expression.qualifiers(), fields, sb);
            line(fields, "expressions:", sb);
            for (ObservationNode child : expression.expressions()) {
                observationNode(child, fields + STEP, true, sb);
            }
        } else {
            throw new EncodingException("Unsupported observation node: " + node);
        }
    }

    private void comparisonNode(ComparisonNode node, int indent, StringBuilder sb) {
        if (node instanceof ComparisonNode.Comparison comparison) {
            int fields = open("comparison", indent, true, sb);
            field("object", Scalars.render(comparison.object(), false), fields, sb);
            path(comparison.path(), fields, sb);
            field("negated", comparison.isNegated() ? "true" : null, fields, sb);
            field("operator", Scalars.render(comparison.operator(), false), fields, sb);
            field("value", literal(comparison.value()), fields, sb);
        } else if (node instanceof ComparisonNode.Expression expression) {
            int fields = open("expression", indent, true, sb);
            field("join", expression.join().name(), fields, sb);
            line(fields, "expressions:", sb);
            for (ComparisonNode child : expression.expressions()) {
                comparisonNode(child, fields + STEP, sb);
            }
        } else {
            throw new EncodingException("Unsupported comparison node: " + node);
        }
    }

    private void objects(ObservationNode.Observation observation, int indent, StringBuilder sb) {
        if (observation.objects().size() == 1) {
            field("objects", "{" + Scalars.render(observation.objects().getFirst(), true) + "}", indent, sb);
            return;
        }
        line(indent, "objects:", sb);
        for (String object : observation.objects()) {
            line(indent + STEP, "? " + Scalars.render(object, false), sb);
        }
    }

    private void path(ImmutableList<PathComponent> path, int indent, StringBuilder sb) {
        if (path.size() == 1) {
            field("path", "[" + pathComponent(path.getFirst(), true) + "]", indent, sb);
            return;
        }
        line(indent, "path:", sb);
        for (PathComponent component : path) {
            line(indent + STEP, "- " + pathComponent(component, false), sb);
        }
    }

    private String pathComponent(PathComponent component, boolean flow) {
        if (component instanceof PathComponent.Property property) {
            return Scalars.render(property.name(), flow);
        } else if (component instanceof PathComponent.Index index) {
            return index(index);
        }
        throw new EncodingException("Unsupported path component: " + component);
    }

    /**
     * {@code [3]} and {@code [*]} for single subscripts, otherwise the slice
     * form with empty parts for absent values.
     */
    static String index(PathComponent.Index index) {
        String stop = stop(index.stop());
        if (index.start() == null && index.step() == null) {
            return "[" + stop + "]";
        }
        StringBuilder sb = new StringBuilder("[");
        if (index.start() != null) {
            sb.append(index.start());
        }
        sb.append(':').append(stop);
        if (index.step() != null) {
            sb.append(':').append(index.step());
        }
        return sb.append(']').toString();
    }

    private static String stop(@Nullable PathComponent.Stop stop) {
        if (stop == null) {
            return "";
        } else if (stop instanceof PathComponent.Position position) {
            return Integer.toString(position.value());
        }
        return "*";
    }

    private void qualifiers(ImmutableList<Qualifier> qualifiers, int indent, StringBuilder sb) {
        line(indent, "qualifiers:", sb);
        for (Qualifier qualifier : qualifiers) {
            if (qualifier instanceof Qualifier.Within within) {
                int fields = open("within", indent + STEP, true, sb);
                field("value", Long.toString(within.value()), fields, sb);
                field("unit", within.unit(), fields, sb);
            } else if (qualifier instanceof Qualifier.StartStop startStop) {
                int fields = open("start_stop", indent + STEP, true, sb);
                field("start", DateTimeFormatter.ISO_INSTANT.format(startStop.start()), fields, sb);
                field("stop", DateTimeFormatter.ISO_INSTANT.format(startStop.stop()), fields, sb);
            } else if (qualifier instanceof Qualifier.Repeats repeats) {
                int fields = open("repeats", indent + STEP, true, sb);
                field("value", Long.toString(repeats.value()), fields, sb);
            } else {
                throw new EncodingException("Unsupported qualifier: " + qualifier);
            }
        }
    }

    private String literal(Literal value) {
        if (value instanceof Literal.StringValue string) {
            return Scalars.render(string.value(), false);
        } else if (value instanceof Literal.BooleanValue bool) {
            return Boolean.toString(bool.value());
        } else if (value instanceof Literal.IntegerValue integer) {
            return Long.toString(integer.value());
        } else if (value instanceof Literal.FloatValue number) {
            if (!Double.isFinite(number.value())) {
                throw new EncodingException("Float literal is not finite: " + number.value());
            }
            // YAML 1.1 floats carry a signed exponent
            String text = Double.toString(number.value());
            int exponent = text.indexOf('E');
            return (exponent < 0 || text.charAt(exponent + 1) == '-')
                ? text
                : text.substring(0, exponent + 1) + "+" + text.substring(exponent + 1);
        } else if (value instanceof Literal.TimestampValue timestamp) {
            return DateTimeFormatter.ISO_INSTANT.format(timestamp.value());
        } else if (value instanceof Literal.BinaryValue binary) {
            return ("!!binary " + Base64.getEncoder().encodeToString(binary.toByteArray())).strip();
        }
        throw new EncodingException("Unsupported literal: " + value);
    }

    /**
     * Writes the line naming a node and returns the indent of its fields.
     */
    private static int open(String tag, int indent, boolean listItem, StringBuilder sb) {
        if (listItem) {
            line(indent, "- " + tag + ":", sb);
            return indent + 2 * STEP;
        }
        line(indent, tag + ":", sb);
        return indent + STEP;
    }

    private static void field(String key, @Nullable String value, int indent, StringBuilder sb) {
        line(indent, (value == null) ? key + ":" : key + ": " + value, sb);
    }

    private static void line(int indent, String content, StringBuilder sb) {
        sb.append(" ".repeat(indent)).append(content).append('\n');
    }
}
