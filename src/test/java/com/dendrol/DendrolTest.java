package com.dendrol;

import com.dendrol.exceptions.StructuralException;
import com.dendrol.tree.PatternTree;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DendrolTest {
    private static final String NESTED = "[a:b = 1 AND (a:c = 2 OR a:d = 3)]";

    @Test
    public void testStaticMethodsUseDefaultConfig() {
        PatternTree tree = Dendrol.parsePattern(NESTED);
        assertEquals(tree, Dendrol.decode(Dendrol.encode(tree)));
    }

    @Test
    public void testInstanceKeepsItsConfig() {
        DendrolConfig config = DendrolConfig.DEFAULT.withMaxDepth(2);
        Dendrol dendrol = Dendrol.withConfig(config);

        assertSame(config, dendrol.config());
        assertThrows(StructuralException.class, () -> dendrol.parse(NESTED));

        String text = Dendrol.encode(Dendrol.parsePattern(NESTED));
        StructuralException e = assertThrows(StructuralException.class, () -> dendrol.fromText(text));
        assertTrue(e.getMessage().contains("maximum depth of 2"), e.getMessage());
    }

    @Test
    public void testNullArgumentsAreRejected() {
        assertThrows(NullPointerException.class, () -> Dendrol.withConfig(null));
        assertThrows(NullPointerException.class, () -> Dendrol.withConfig(DendrolConfig.DEFAULT).toText(null));
        assertThrows(NullPointerException.class, () -> Dendrol.withConfig(DendrolConfig.DEFAULT).fromText(null));
    }
}
