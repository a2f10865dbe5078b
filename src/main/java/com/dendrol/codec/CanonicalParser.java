package com.dendrol.codec;

import com.dendrol.DendrolConfig;
import com.dendrol.exceptions.StructuralException;
import com.dendrol.pattern.LiteralDecoder;
import com.dendrol.tree.ComparisonNode;
import com.dendrol.tree.Join;
import com.dendrol.tree.Literal;
import com.dendrol.tree.ObservationNode;
import com.dendrol.tree.PathComponent;
import com.dendrol.tree.PatternTree;
import com.dendrol.tree.Qualifier;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.SortedSets;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.dendrol.exceptions.StructuralException.atLine;

/**
 * Reads canonical text back into a {@link PatternTree}.
 * <p>
 * Accepts everything {@link CanonicalEncoder} writes, and the looser forms a
 * person editing that text by hand is likely to produce: fields in any order,
 * absent optional fields, flow or block collections, quoted or plain scalars.
 * The tree that comes out is checked exactly as one built from a pattern is.
 */
public final class CanonicalParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(CanonicalParser.class);

    private static final Set<String> OBSERVATION_FIELDS = Set.of("objects", "join", "qualifiers", "expressions");
    private static final Set<String> EXPRESSION_FIELDS = Set.of("join", "qualifiers", "expressions");
    private static final Set<String> COMPARISON_EXPRESSION_FIELDS = Set.of("join", "expressions");
    private static final Set<String> COMPARISON_FIELDS = Set.of("object", "path", "negated", "operator", "value");
    private static final Set<String> WITHIN_FIELDS = Set.of("value", "unit");
    private static final Set<String> START_STOP_FIELDS = Set.of("start", "stop");
    private static final Set<String> REPEATS_FIELDS = Set.of("value");

    // Each tree level takes at most this many levels of canonical text
    private static final int NESTING_PER_LEVEL = 4;
    private static final int NESTING_SLACK = 8;

    private final int maxDepth;
    private final CanonicalReader reader;

    public CanonicalParser() {
        this(DendrolConfig.DEFAULT);
    }

    public CanonicalParser(DendrolConfig config) {
        this.maxDepth = config.maxDepth();
        this.reader = new CanonicalReader(NESTING_PER_LEVEL * config.maxDepth() + NESTING_SLACK);
    }

    public PatternTree parse(String text) {
        TextNode document = reader.read(text);
        Tagged pattern = tagged(document, "document", Set.of("pattern"));
        ObservationNode root = observationNode(pattern.body(), 1);
        LOGGER.debug("Parsed canonical text into a tree rooted at {}", root.getClass().getSimpleName());
        return new PatternTree(root);
    }

    /**
     * A mapping with exactly one key naming what its value is.
     */
    private record Tagged(String tag, @Nullable TextNode body, int line) {}

    private ObservationNode observationNode(@Nullable TextNode node, int depth) {
        Tagged tagged = tagged(node, "observation node", Set.of("observation", "expression"));
        checkDepth(depth, tagged.line());
        Map<String, TextNode.Entry> fields = fields(tagged, tagged.tag().equals("observation") ? OBSERVATION_FIELDS : EXPRESSION_FIELDS);
        ImmutableList<Qualifier> qualifiers = qualifiers(fields.get("qualifiers"));
        if (tagged.tag().equals("observation")) {
            Join join = optionalJoin(fields.get("join"));
            ImmutableList<ComparisonNode> expressions = children(tagged, fields, child -> comparisonNode(child, depth + 1));
            TextNode.Entry objects = fields.get("objects");
            if (objects == null || isNull(objects.value())) {
                return construct(tagged.line(), () -> ObservationNode.Observation.of(join, qualifiers, expressions));
            }
            ImmutableSortedSet<String> declared = objectSet(objects);
            return construct(tagged.line(), () -> new ObservationNode.Observation(declared, join, qualifiers, expressions));
        }
        Join join = requiredJoin(tagged, fields.get("join"));
        ImmutableList<ObservationNode> expressions = children(tagged, fields, child -> observationNode(child, depth + 1));
        return construct(tagged.line(), () -> new ObservationNode.Expression(join, qualifiers, expressions));
    }

    private ComparisonNode comparisonNode(@Nullable TextNode node, int depth) {
        Tagged tagged = tagged(node, "comparison node", Set.of("comparison", "expression"));
        checkDepth(depth, tagged.line());
        if (tagged.tag().equals("expression")) {
            if (tagged.body() instanceof TextNode.Mapping mapping
                && mapping.entries().anySatisfy(entry -> entry.key().equals("qualifiers"))) {
                throw atLine(tagged.line(), "Qualifiers are not allowed on a comparison expression");
            }
            Map<String, TextNode.Entry> fields = fields(tagged, COMPARISON_EXPRESSION_FIELDS);
            Join join = requiredJoin(tagged, fields.get("join"));
            ImmutableList<ComparisonNode> expressions = children(tagged, fields, child -> comparisonNode(child, depth + 1));
            return construct(tagged.line(), () -> new ComparisonNode.Expression(join, expressions));
        }
        Map<String, TextNode.Entry> fields = fields(tagged, COMPARISON_FIELDS);
        String object = requiredString(tagged, fields, "object");
        ImmutableList<PathComponent> path = path(required(tagged, fields, "path"));
        Boolean negated = negated(fields.get("negated"));
        String operator = requiredString(tagged, fields, "operator");
        Literal value = literal(required(tagged, fields, "value"));
        return construct(tagged.line(), () -> new ComparisonNode.Comparison(object, path, negated, operator, value));
    }

    private <T> ImmutableList<T> children(Tagged parent, Map<String, TextNode.Entry> fields, Function<TextNode, T> child) {
        TextNode.Entry entry = required(parent, fields, "expressions");
        if (!(entry.value() instanceof TextNode.Sequence sequence)) {
            throw atLine(entry.line(), "'expressions' must be a sequence");
        }
        MutableList<T> children = Lists.mutable.empty();
        for (TextNode item : sequence.items()) {
            children.add(child.apply(item));
        }
        return children.toImmutable();
    }

    private ImmutableList<Qualifier> qualifiers(@Nullable TextNode.Entry entry) {
        if (entry == null || isNull(entry.value())) {
            return Lists.immutable.empty();
        }
        if (!(entry.value() instanceof TextNode.Sequence sequence)) {
            throw atLine(entry.line(), "'qualifiers' must be a sequence");
        }
        MutableList<Qualifier> qualifiers = Lists.mutable.empty();
        for (TextNode item : sequence.items()) {
            qualifiers.add(qualifier(item));
        }
        return qualifiers.toImmutable();
    }

    private Qualifier qualifier(TextNode node) {
        Tagged tagged = tagged(node, "qualifier", Set.of("within", "start_stop", "repeats"));
        switch (tagged.tag()) {
            case "within" -> {
                Map<String, TextNode.Entry> fields = fields(tagged, WITHIN_FIELDS);
                long value = integer(required(tagged, fields, "value"));
                TextNode.Entry unit = fields.get("unit");
                String unitName = (unit == null || isNull(unit.value())) ? Qualifier.Within.SECONDS : string(unit);
                return construct(tagged.line(), () -> new Qualifier.Within(value, unitName));
            }
            case "start_stop" -> {
                Map<String, TextNode.Entry> fields = fields(tagged, START_STOP_FIELDS);
                Instant start = LiteralDecoder.decodeTimestamp(string(required(tagged, fields, "start")));
                Instant stop = LiteralDecoder.decodeTimestamp(string(required(tagged, fields, "stop")));
                return new Qualifier.StartStop(start, stop);
            }
            default -> {
                Map<String, TextNode.Entry> fields = fields(tagged, REPEATS_FIELDS);
                long value = integer(required(tagged, fields, "value"));
                return construct(tagged.line(), () -> new Qualifier.Repeats(value));
            }
        }
    }

    private ImmutableSortedSet<String> objectSet(TextNode.Entry entry) {
        MutableList<TextNode> members = Lists.mutable.empty();
        TextNode value = entry.value();
        if (value instanceof TextNode.Mapping set) {
            for (TextNode.Entry member : set.entries()) {
                if (!isNull(member.value())) {
                    throw atLine(member.line(), "'objects' members have no values");
                }
                members.add(new TextNode.Scalar(member.key(), Literal.of(member.key()), member.line()));
            }
        } else if (value instanceof TextNode.Sequence sequence) {
            members.addAllIterable(sequence.items());
        } else {
            members.add(value);
        }
        MutableSortedSet<String> objects = SortedSets.mutable.empty();
        for (TextNode member : members) {
            String object = scalarText(member, "'objects' member");
            if (!objects.add(object)) {
                throw atLine(member.line(), "Duplicate object type in 'objects': " + object);
            }
        }
        return objects.toImmutable();
    }

    private ImmutableList<PathComponent> path(TextNode.Entry entry) {
        TextNode value = entry.value();
        MutableList<PathComponent> path = Lists.mutable.empty();
        if (value instanceof TextNode.Sequence sequence) {
            for (TextNode item : sequence.items()) {
                path.add(pathComponent(item));
            }
        } else {
            path.add(pathComponent(value));
        }
        if (path.isEmpty()) {
            throw atLine(entry.line(), "'path' must not be empty");
        }
        return path.toImmutable();
    }

    /**
     * A scalar is a property name; a one-element sequence such as
     * {@code [2]} or {@code [1:*]} is a subscript.
     */
    private PathComponent pathComponent(@Nullable TextNode node) {
        if (node instanceof TextNode.Sequence subscript) {
            if (subscript.items().isEmpty()) {
                return new PathComponent.Index(null, null, null);
            }
            if (subscript.items().size() > 1) {
                throw atLine(subscript.line(), "A subscript holds one index or slice, got " + subscript.items().size());
            }
            return LiteralDecoder.decodeIndex(scalarText(subscript.items().getFirst(), "subscript"));
        }
        return new PathComponent.Property(scalarText(node, "path component"));
    }

    private @Nullable Boolean negated(@Nullable TextNode.Entry entry) {
        if (entry == null || isNull(entry.value())) {
            return null;
        }
        if (entry.value() instanceof TextNode.Scalar scalar && scalar.value() instanceof Literal.BooleanValue bool) {
            return bool.value();
        }
        throw atLine(entry.line(), "'negated' must be true, false, or empty");
    }

    private Literal literal(TextNode.Entry entry) {
        if (!(entry.value() instanceof TextNode.Scalar scalar)) {
            throw atLine(entry.line(), "'value' must be a scalar");
        }
        if (scalar.value() == null) {
            throw atLine(entry.line(), "'value' must not be empty");
        }
        return scalar.value();
    }

    private long integer(TextNode.Entry entry) {
        if (entry.value() instanceof TextNode.Scalar scalar && scalar.value() instanceof Literal.IntegerValue number) {
            return number.value();
        }
        throw atLine(entry.line(), "'" + entry.key() + "' must be an integer");
    }

    private @Nullable Join optionalJoin(@Nullable TextNode.Entry entry) {
        if (entry == null || isNull(entry.value())) {
            return null;
        }
        String keyword = string(entry);
        return construct(entry.line(), () -> Join.fromKeyword(keyword));
    }

    private Join requiredJoin(Tagged parent, @Nullable TextNode.Entry entry) {
        if (entry == null || isNull(entry.value())) {
            throw atLine(parent.line(), "'" + parent.tag() + "' needs a join");
        }
        return optionalJoin(entry);
    }

    private String requiredString(Tagged parent, Map<String, TextNode.Entry> fields, String key) {
        return string(required(parent, fields, key));
    }

    private static TextNode.Entry required(Tagged parent, Map<String, TextNode.Entry> fields, String key) {
        TextNode.Entry entry = fields.get(key);
        if (entry == null || isNull(entry.value())) {
            throw atLine(parent.line(), "'" + parent.tag() + "' is missing '" + key + "'");
        }
        return entry;
    }

    private static String string(TextNode.Entry entry) {
        return scalarText(entry.value(), "'" + entry.key() + "'");
    }

    private static String scalarText(@Nullable TextNode node, String what) {
        if (node instanceof TextNode.Scalar scalar && !scalar.isNull() && !(scalar.value() instanceof Literal.BinaryValue)) {
            return scalar.text();
        }
        int line = (node == null) ? 0 : node.line();
        throw atLine(line, what + " must be a non-empty string");
    }

    private static boolean isNull(@Nullable TextNode node) {
        return node == null || (node instanceof TextNode.Scalar scalar && scalar.isNull());
    }

    private static Tagged tagged(@Nullable TextNode node, String what, Set<String> tags) {
        if (!(node instanceof TextNode.Mapping mapping) || mapping.entries().size() != 1) {
            int line = (node == null) ? 0 : node.line();
            throw atLine(line, "Expected " + what + " to be a mapping with one of the keys " + tags);
        }
        TextNode.Entry entry = mapping.entries().getFirst();
        if (!tags.contains(entry.key())) {
            throw atLine(entry.line(), "Expected " + what + " to be one of " + tags + ", got '" + entry.key() + "'");
        }
        return new Tagged(entry.key(), entry.value(), entry.line());
    }

    private static Map<String, TextNode.Entry> fields(Tagged tagged, Set<String> allowed) {
        Map<String, TextNode.Entry> fields = new LinkedHashMap<>();
        if (isNull(tagged.body())) {
            return fields;
        }
        if (!(tagged.body() instanceof TextNode.Mapping mapping)) {
            throw atLine(tagged.line(), "'" + tagged.tag() + "' must be a mapping");
        }
        for (TextNode.Entry entry : mapping.entries()) {
            if (!allowed.contains(entry.key())) {
                throw atLine(entry.line(), "Unknown field '" + entry.key() + "' in '" + tagged.tag() + "'");
            }
            fields.put(entry.key(), entry);
        }
        return fields;
    }

    private void checkDepth(int depth, int line) {
        if (depth > maxDepth) {
            throw atLine(line, "Pattern nests deeper than the maximum depth of " + maxDepth);
        }
    }

    /**
     * Runs a tree constructor, attaching the line to any invariant it reports.
     */
    private static <T> T construct(int line, Supplier<T> constructor) {
        try {
            return constructor.get();
        } catch (StructuralException e) {
            throw atLine(line, e.getMessage(), e);
        }
    }
}
