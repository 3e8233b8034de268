package com.p6tree.factory;

import com.p6tree.FactoryException;
import com.p6tree.TestMatches;
import com.p6tree.ast.Bareword;
import com.p6tree.ast.Block;
import com.p6tree.ast.Element;
import com.p6tree.ast.Leaf;
import com.p6tree.match.Match;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static com.p6tree.TreeAssertions.childTypes;
import static org.junit.jupiter.api.Assertions.*;

public class MatchAdapterTest {

    private static final String SOURCE = "say  foo ,bar; <<x y>>";

    private final TestMatches m = TestMatches.of(SOURCE);
    private final MatchAdapter adapter = new MatchAdapter(SOURCE, false);

    @Test
    void testFromMatch() {
        Bareword foo = adapter.fromMatch(Bareword::new, m.node("foo").build());
        assertEquals(5, foo.from());
        assertEquals(8, foo.to());
        assertEquals("foo", foo.content());
    }

    @Test
    void testFromMatchTrimmed() {
        Match padded = m.node(3, 9).build();
        Bareword foo = adapter.fromMatchTrimmed(Bareword::new, padded);
        assertEquals(5, foo.from());
        assertEquals(8, foo.to());
        assertEquals("foo", foo.content());

        Bareword blank = adapter.fromMatchTrimmed(Bareword::new, m.node(3, 5).build());
        assertEquals(blank.from(), blank.to());
        assertEquals("", blank.content());
    }

    @Test
    void testFromInt() {
        Bareword say = adapter.fromInt(Bareword::new, 0, "say");
        assertEquals(0, say.from());
        assertEquals(3, say.to());
    }

    @Test
    void testFind() {
        Bareword comma = adapter.find(Bareword::new, 8, 13, ",");
        assertEquals(9, comma.from());
        assertNull(adapter.find(Bareword::new, 0, 9, ","));
        assertNull(adapter.find(Bareword::new, 0, SOURCE.length() + 1, ","));
        assertNull(adapter.find(Bareword::new, 5, 3, ","));
        assertNull(adapter.find(Bareword::new, 0, 5, ""));

        Bareword bar = adapter.find(Bareword::new, 8, 14, Pattern.compile("\\w+"));
        assertEquals("bar", bar.content());
        assertEquals(10, bar.from());
        assertNull(adapter.find(Bareword::new, 8, 14, Pattern.compile("\\d*")));

        Bareword sampled = adapter.fromSample(Bareword::new, m.node(0, 14).build(), "bar");
        assertEquals(10, sampled.from());
        assertNull(adapter.fromSample(Bareword::new, m.node(0, 8).build(), "bar"));
    }

    @Test
    void testFindSkipsCommentsAndPod() {
        String source = "1 # a, b\n#`(x, y) , 2\n=begin pod\n,\n=end pod\n;";
        MatchAdapter commented = new MatchAdapter(source, false);

        Bareword comma = commented.find(Bareword::new, 1, source.length(), ",");
        assertEquals(source.indexOf(") ,") + 2, comma.from());

        Bareword semicolon = commented.find(Bareword::new, 20, source.length(), Pattern.compile("[,;]"));
        assertEquals(";", semicolon.content());
        assertEquals(source.length() - 1, semicolon.from());

        assertNull(commented.find(Bareword::new, 1, 8, ","));
    }

    @Test
    void testBranchSpansChildren() {
        Bareword foo = adapter.fromMatch(Bareword::new, m.node("foo").build());
        Bareword bar = adapter.fromMatch(Bareword::new, m.node("bar").build());

        Block block = adapter.branch(Block::new, List.of(foo, bar), 0, 22);
        assertEquals(5, block.from());
        assertEquals(13, block.to());

        Block empty = adapter.branch(Block::new, List.of(), 4, 4);
        assertEquals(4, empty.from());
        assertEquals(4, empty.to());
        assertTrue(empty.children().isEmpty());
    }

    @Test
    void testBalanced() {
        Block quoted = adapter.balanced(Block::new, m.node("<<x y>>").build(), "<<", ">>", List.of());
        assertEquals(List.of("Balanced.Enter", "Balanced.Exit"), childTypes(quoted));
        assertEquals("<<", ((Leaf) quoted.child(0)).content());
        assertEquals(15, quoted.child(0).from());
        assertEquals(">>", ((Leaf) quoted.child(1)).content());
        assertEquals(20, quoted.child(1).from());

        Block single = adapter.balanced(Block::new, 15, 22, List.of());
        assertEquals("<", ((Leaf) single.child(0)).content());
        assertEquals(">", ((Leaf) single.child(1)).content());
        assertEquals(21, single.child(1).from());
    }

    @Test
    void testBalancedOuter() {
        Match inner = m.node("x y").build();
        Bareword x = adapter.fromInt(Bareword::new, 17, "x");
        Block block = adapter.balancedOuter(Block::new, inner, List.of(x));

        assertEquals(16, block.from());
        assertEquals(21, block.to());
        assertEquals(List.of("Balanced.Enter", "Bareword", "Balanced.Exit"), childTypes(block));

        Match whole = m.node(0, SOURCE.length()).build();
        FactoryException e = assertThrows(FactoryException.class,
            () -> adapter.balancedOuter(Block::new, whole, List.of()));
        assertTrue(e.getMessage().contains("No delimiters"), e.getMessage());
    }

    @Test
    void testOriginIsOffByDefault() {
        assertNull(adapter.fromInt(Bareword::new, 0, "say").origin());
    }

    @Test
    void testOriginNamesTheCallingRule() {
        MatchAdapter recording = new MatchAdapter(SOURCE, true);
        Element say = recording.fromInt(Bareword::new, 0, "say");
        assertTrue(say.origin().startsWith("MatchAdapterTest.testOriginNamesTheCallingRule:"), say.origin());

        Block block = recording.balanced(Block::new, 15, 22, List.of());
        assertTrue(block.origin().startsWith("MatchAdapterTest."), block.origin());
        assertTrue(block.child(0).origin().startsWith("MatchAdapterTest."), block.child(0).origin());
    }
}
