package com.dendrol.pattern;

import com.dendrol.DendrolConfig;
import com.dendrol.exceptions.LiteralException;
import com.dendrol.exceptions.StructuralException;
import com.dendrol.lang.STIXPatternParser;
import com.dendrol.pattern.LiteralDecoder.TokenKind;
import com.dendrol.tree.ComparisonNode;
import com.dendrol.tree.Join;
import com.dendrol.tree.Literal;
import com.dendrol.tree.ObservationNode;
import com.dendrol.tree.PathComponent;
import com.dendrol.tree.PatternTree;
import com.dendrol.tree.Qualifier;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Converts the syntax tree of a STIX pattern into a {@link PatternTree}.
 * <p>
 * The grammar expresses AND, OR and FOLLOWEDBY chains as left-recursive
 * binary rules. Each run of one operator is flattened into a single n-ary
 * expression; a different operator, or a parenthesized group, starts a nested
 * one. Qualifiers are attached to the observation-level node they follow, in
 * source order.
 * <p>
 * Instances keep no state between calls and may be shared between threads.
 */
public final class TreeBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeBuilder.class);

    private final int maxDepth;

    public TreeBuilder() {
        this(DendrolConfig.DEFAULT);
    }

    public TreeBuilder(DendrolConfig config) {
        this.maxDepth = Objects.requireNonNull(config, "config").maxDepth();
    }

    public PatternTree build(STIXPatternParser.PatternContext context) {
        PatternTree tree = new PatternTree(observation(context.getChild(0), 1));
        LOGGER.debug("Built pattern tree rooted at {}", tree.root().getClass().getSimpleName());
        return tree;
    }

    //
    // Observations
    //

    private ObservationNode observation(ParseTree node, int depth) {
        checkDepth(depth);
        ParseTree current = unwrapObservation(node);

        if (isQualified(current)) {
            // Outermost context holds the last qualifier
            Deque<ParseTree> qualifierContexts = new ArrayDeque<>();
            while (isQualified(current)) {
                qualifierContexts.push(current.getChild(1));
                current = unwrapObservation(current.getChild(0));
            }
            ObservationNode base = observation(current, depth);
            MutableList<Qualifier> qualifiers = Lists.mutable.withAll(base.qualifiers());
            for (ParseTree qualifierContext : qualifierContexts) {
                qualifiers.add(qualifier(qualifierContext));
            }
            return base.withQualifiers(qualifiers.toImmutable());
        }

        if (current instanceof STIXPatternParser.ObservationExpressionSimpleContext simple) {
            return simpleObservation(simple, depth);
        }

        if (isObservationJoin(current)) {
            ParserRuleContext composite = (ParserRuleContext) current;
            Join join = Join.fromKeyword(composite.getChild(1).getText());
            MutableList<ObservationNode> children = Lists.mutable.empty();
            for (ParseTree child : flattenLeft(composite)) {
                children.add(observation(child, depth + 1));
            }
            return new ObservationNode.Expression(join, Lists.immutable.empty(), children.toImmutable());
        }

        throw new StructuralException("Unexpected observation syntax: " + current.getText());
    }

    /**
     * A top-level comparison join becomes the observation's own join rather
     * than a single nested expression.
     */
    private ObservationNode.Observation simpleObservation(STIXPatternParser.ObservationExpressionSimpleContext context, int depth) {
        // '[' comparisonExpression ']'
        ParseTree root = unwrapComparison(context.getChild(1));
        if (isComparisonJoin(root)) {
            ParserRuleContext composite = (ParserRuleContext) root;
            MutableList<ComparisonNode> children = Lists.mutable.empty();
            for (ParseTree child : flattenLeft(composite)) {
                children.add(comparison(child, depth + 1));
            }
            return ObservationNode.Observation.of(
                Join.fromKeyword(composite.getChild(1).getText()), Lists.immutable.empty(), children.toImmutable());
        }
        return ObservationNode.Observation.of(null, Lists.immutable.empty(), Lists.immutable.of(comparison(root, depth + 1)));
    }

    /**
     * Skips parentheses and the single-child rule contexts that the grammar's
     * precedence levels leave behind.
     */
    private static ParseTree unwrapObservation(ParseTree node) {
        ParseTree current = node;
        while (true) {
            if (current instanceof STIXPatternParser.ObservationExpressionCompoundContext compound) {
                current = compound.getChild(1);
            } else if (isObservationJoinRule(current) && current.getChildCount() == 1) {
                current = current.getChild(0);
            } else {
                return current;
            }
        }
    }

    private static boolean isObservationJoinRule(ParseTree node) {
        return node instanceof STIXPatternParser.ObservationExpressionsContext
            || node instanceof STIXPatternParser.ObservationExpressionOrContext
            || node instanceof STIXPatternParser.ObservationExpressionAndContext;
    }

    private static boolean isObservationJoin(ParseTree node) {
        return isObservationJoinRule(node) && node.getChildCount() == 3;
    }

    private static boolean isQualified(ParseTree node) {
        return node instanceof STIXPatternParser.ObservationExpressionStartStopContext
            || node instanceof STIXPatternParser.ObservationExpressionWithinContext
            || node instanceof STIXPatternParser.ObservationExpressionRepeatedContext;
    }

    //
    // Qualifiers
    //

    private static Qualifier qualifier(ParseTree node) {
        if (node instanceof STIXPatternParser.StartStopQualifierContext startStop) {
            // START t'...' STOP t'...'
            return new Qualifier.StartStop(
                LiteralDecoder.decodeTimestampLiteral(startStop.getChild(1).getText()),
                LiteralDecoder.decodeTimestampLiteral(startStop.getChild(3).getText()));
        } else if (node instanceof STIXPatternParser.WithinQualifierContext within) {
            // WITHIN n SECONDS
            return new Qualifier.Within(
                LiteralDecoder.decodeInteger(within.getChild(1).getText()),
                within.getChild(2).getText());
        } else if (node instanceof STIXPatternParser.RepeatedQualifierContext repeated) {
            // REPEATS n TIMES
            return new Qualifier.Repeats(LiteralDecoder.decodeInteger(repeated.getChild(1).getText()));
        }
        throw new StructuralException("Unexpected qualifier syntax: " + node.getText());
    }

    //
    // Comparisons
    //

    private ComparisonNode comparison(ParseTree node, int depth) {
        checkDepth(depth);
        ParseTree current = unwrapComparison(node);

        if (isComparisonJoin(current)) {
            ParserRuleContext composite = (ParserRuleContext) current;
            Join join = Join.fromKeyword(composite.getChild(1).getText());
            MutableList<ComparisonNode> children = Lists.mutable.empty();
            for (ParseTree child : flattenLeft(composite)) {
                children.add(comparison(child, depth + 1));
            }
            return new ComparisonNode.Expression(join, children.toImmutable());
        }

        if (current instanceof STIXPatternParser.PropTestSetContext) {
            throw new LiteralException(LiteralException.Reason.UNSUPPORTED_LITERAL, current.getText());
        }

        if (current instanceof STIXPatternParser.PropTestContext propTest) {
            return simpleComparison(propTest);
        }

        throw new StructuralException("Unexpected comparison syntax: " + current.getText());
    }

    /**
     * Every property test shares the shape {@code <path> NOT? <operator> <literal>}.
     */
    private static ComparisonNode.Comparison simpleComparison(STIXPatternParser.PropTestContext context) {
        STIXPatternParser.ObjectPathContext objectPath = (STIXPatternParser.ObjectPathContext) context.getChild(0);
        int index = 1;
        boolean negated = isToken(context.getChild(index), STIXPatternParser.NOT);
        if (negated) {
            index++;
        }
        String operator = context.getChild(index++).getText();
        Literal value = literal(context.getChild(index));

        return new ComparisonNode.Comparison(
            objectPath.getChild(0).getText(),
            path(objectPath),
            negated ? Boolean.TRUE : null,
            operator,
            value);
    }

    private static ParseTree unwrapComparison(ParseTree node) {
        ParseTree current = node;
        while (true) {
            if (current instanceof STIXPatternParser.PropTestParenContext paren) {
                current = paren.getChild(1);
            } else if (isComparisonJoinRule(current) && current.getChildCount() == 1) {
                current = current.getChild(0);
            } else {
                return current;
            }
        }
    }

    private static boolean isComparisonJoinRule(ParseTree node) {
        return node instanceof STIXPatternParser.ComparisonExpressionContext
            || node instanceof STIXPatternParser.ComparisonExpressionAndContext;
    }

    private static boolean isComparisonJoin(ParseTree node) {
        return isComparisonJoinRule(node) && node.getChildCount() == 3;
    }

    //
    // Object paths
    //

    /**
     * {@code file:extensions.'windows-pebinary-ext'.sections[*]} becomes
     * {@code [extensions, windows-pebinary-ext, sections, [*]]}.
     */
    private static ImmutableList<PathComponent> path(STIXPatternParser.ObjectPathContext objectPath) {
        MutableList<PathComponent> components = Lists.mutable.empty();
        // objectType ':' firstPathComponent objectPathComponent?
        components.add(new PathComponent.Property(propertyName(objectPath.getChild(2).getChild(0))));
        if (objectPath.getChildCount() < 4) {
            return components.toImmutable();
        }

        Deque<ParseTree> toVisit = new ArrayDeque<>();
        toVisit.push(objectPath.getChild(3));
        while (!toVisit.isEmpty()) {
            ParseTree step = toVisit.pop();
            if (step instanceof STIXPatternParser.PathStepContext pathStep) {
                for (int i = pathStep.getChildCount() - 1; i >= 0; i--) {
                    toVisit.push(pathStep.getChild(i));
                }
            } else if (step instanceof STIXPatternParser.KeyPathStepContext keyStep) {
                components.add(new PathComponent.Property(propertyName(keyStep.getChild(1))));
            } else if (step instanceof STIXPatternParser.IndexPathStepContext indexStep) {
                components.add(LiteralDecoder.decodeIndex(indexStep.getChild(1).getText()));
            } else {
                throw new StructuralException("Unexpected object path syntax: " + step.getText());
            }
        }
        return components.toImmutable();
    }

    private static String propertyName(ParseTree terminal) {
        if (isToken(terminal, STIXPatternParser.StringLiteral)) {
            return LiteralDecoder.decodeString(terminal.getText());
        }
        return terminal.getText();
    }

    //
    // Literals
    //

    private static Literal literal(ParseTree node) {
        ParseTree current = node;
        while (!(current instanceof TerminalNode) && current.getChildCount() == 1) {
            current = current.getChild(0);
        }
        if (!(current instanceof TerminalNode terminal)) {
            throw new LiteralException(LiteralException.Reason.UNSUPPORTED_LITERAL, node.getText());
        }
        return LiteralDecoder.decode(terminal.getText(), tokenKind(terminal));
    }

    private static TokenKind tokenKind(TerminalNode terminal) {
        return switch (terminal.getSymbol().getType()) {
            case STIXPatternParser.StringLiteral -> TokenKind.STRING;
            case STIXPatternParser.IntPosLiteral, STIXPatternParser.IntNegLiteral -> TokenKind.INTEGER;
            case STIXPatternParser.FloatPosLiteral, STIXPatternParser.FloatNegLiteral -> TokenKind.FLOAT;
            case STIXPatternParser.BoolLiteral -> TokenKind.BOOLEAN;
            case STIXPatternParser.TimestampLiteral -> TokenKind.TIMESTAMP;
            case STIXPatternParser.BinaryLiteral -> TokenKind.BINARY;
            case STIXPatternParser.HexLiteral -> TokenKind.HEX;
            default -> throw new LiteralException(LiteralException.Reason.UNSUPPORTED_LITERAL, terminal.getText());
        };
    }

    //
    // Helpers
    //

    /**
     * Collects the operands of a left-recursive chain of one rule, such as
     * {@code a OR b OR c}, in source order. The grammar nests such a chain as
     * {@code ((a OR b) OR c)}; only the left spine repeats the rule.
     */
    private static Iterable<ParseTree> flattenLeft(ParserRuleContext context) {
        Class<?> rule = context.getClass();
        Deque<ParseTree> operands = new ArrayDeque<>();
        ParseTree current = context;
        while (rule.isInstance(current) && current.getChildCount() == 3) {
            operands.push(current.getChild(2));
            current = current.getChild(0);
        }
        operands.push(current);
        return operands;
    }

    private static boolean isToken(ParseTree node, int tokenType) {
        return node instanceof TerminalNode terminal && terminal.getSymbol().getType() == tokenType;
    }

    private void checkDepth(int depth) {
        if (depth > maxDepth) {
            LOGGER.debug("Rejecting pattern tree deeper than {}", maxDepth);
            throw new StructuralException("Pattern nests deeper than the maximum depth of " + maxDepth);
        }
    }
}
