package com.dendrol.tree;

import com.dendrol.exceptions.StructuralException;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.SortedSets;
import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ObservationNodeTest {
    private static final ComparisonNode IPV4 = comparison("ipv4-addr", "1.2.3.4");
    private static final ComparisonNode IPV6 = comparison("ipv6-addr", "::1");

    @Test
    public void testObjectsAreDerived() {
        ObservationNode.Observation observation = ObservationNode.Observation.of(
            Join.OR, Lists.immutable.empty(), Lists.immutable.of(IPV6, IPV4, comparison("ipv4-addr", "5.6.7.8")));

        assertEquals(SortedSets.immutable.of("ipv4-addr", "ipv6-addr"), observation.objects());
        assertEquals("ipv4-addr", observation.objects().getFirst());
    }

    @Test
    public void testDeclaredObjectsMustMatch() {
        assertThrows(StructuralException.class, () -> new ObservationNode.Observation(
            SortedSets.immutable.of("ipv4-addr"), Join.OR, Lists.immutable.empty(), Lists.immutable.of(IPV4, IPV6)));
        assertThrows(StructuralException.class, () -> new ObservationNode.Observation(
            SortedSets.immutable.of("ipv4-addr", "file"), null, Lists.immutable.empty(), Lists.immutable.of(IPV4)));
    }

    @Test
    public void testJoinArity() {
        ImmutableList<ComparisonNode> two = Lists.immutable.of(IPV4, IPV6);
        assertThrows(StructuralException.class,
            () -> ObservationNode.Observation.of(null, Lists.immutable.empty(), two));
        assertThrows(StructuralException.class,
            () -> ObservationNode.Observation.of(Join.AND, Lists.immutable.empty(), Lists.immutable.of(IPV4)));
        assertThrows(StructuralException.class,
            () -> ObservationNode.Observation.of(null, Lists.immutable.empty(), Lists.immutable.empty()));
        assertThrows(StructuralException.class,
            () -> ObservationNode.Observation.of(Join.FOLLOWEDBY, Lists.immutable.empty(), two));
    }

    @Test
    public void testExpressionsNeedTwoChildren() {
        ObservationNode single = ObservationNode.Observation.of(null, Lists.immutable.empty(), Lists.immutable.of(IPV4));
        assertThrows(StructuralException.class,
            () -> new ObservationNode.Expression(Join.AND, Lists.immutable.empty(), Lists.immutable.of(single)));
        assertThrows(StructuralException.class,
            () -> new ComparisonNode.Expression(Join.OR, Lists.immutable.of(IPV4)));
        assertThrows(StructuralException.class,
            () -> new ComparisonNode.Expression(Join.FOLLOWEDBY, Lists.immutable.of(IPV4, IPV6)));
    }

    @Test
    public void testNullQualifiersMeanNone() {
        ObservationNode.Observation observation = ObservationNode.Observation.of(null, null, Lists.immutable.of(IPV4));
        assertTrue(observation.qualifiers().isEmpty());
    }

    @Test
    public void testFalseNegationIsAbsent() {
        ComparisonNode.Comparison negatedFalse = new ComparisonNode.Comparison(
            "file", Lists.immutable.of(new PathComponent.Property("name")), false, "=", Literal.of("x"));
        ComparisonNode.Comparison plain = new ComparisonNode.Comparison(
            "file", Lists.immutable.of(new PathComponent.Property("name")), null, "=", Literal.of("x"));

        assertNull(negatedFalse.negated());
        assertEquals(plain, negatedFalse);
    }

    @Test
    public void testComparisonRejectsEmptyPath() {
        assertThrows(StructuralException.class,
            () -> new ComparisonNode.Comparison("file", Lists.immutable.empty(), null, "=", Literal.of("x")));
    }

    @Test
    public void testQualifierBounds() {
        assertThrows(StructuralException.class, () -> Qualifier.Within.seconds(-1));
        assertThrows(StructuralException.class, () -> new Qualifier.Within(5, "MINUTES"));
        assertThrows(StructuralException.class, () -> new Qualifier.Repeats(0));
        assertEquals(0, Qualifier.Within.seconds(0).value());
    }

    @Test
    public void testJoinKeywords() {
        assertEquals(Join.FOLLOWEDBY, Join.fromKeyword("followedby"));
        assertThrows(StructuralException.class, () -> Join.fromKeyword("XOR"));
    }

    private static ComparisonNode comparison(String object, String value) {
        return new ComparisonNode.Comparison(
            object, Lists.immutable.of(new PathComponent.Property("value")), null, "=", Literal.of(value));
    }
}
