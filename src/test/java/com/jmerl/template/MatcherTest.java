package com.jmerl.template;

import com.jmerl.quote.FragmentParser;
import com.jmerl.syntax.Position;
import com.jmerl.syntax.Tree;
import com.jmerl.syntax.Trees;
import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MatcherTest {
    private final FragmentParser parser = new FragmentParser();

    private Tree quote(String text) {
        return parser.parse(text).getOnly();
    }

    private Optional<Environment> match(String pattern, String tree) {
        return Matcher.match(quote(pattern), quote(tree));
    }

    // ============================================================
    // Successful matches

    @Test
    public void testCallPattern() {
        Environment env = match("_@fn(_@@args)", "foo(1, 2, 3)").orElseThrow();

        assertEquals("foo", Trees.atomName(env.tree("fn")));
        ImmutableList<Tree> args = env.group("args");
        assertEquals(3, args.size());
        assertEquals(BigInteger.valueOf(3), Trees.integerValue(args.getLast()));
    }

    @Test
    public void testEmptyGroup() {
        Environment env = match("foo(_@@Xs)", "foo()").orElseThrow();

        assertTrue(env.group("Xs").isEmpty());
    }

    @Test
    public void testPlaceholderBindsWholeSubtree() {
        Environment env = match("{reply, _@Value}", "{reply, [1, {a, b}]}").orElseThrow();

        assertTrue(Trees.structurallyEqual(quote("[1, {a, b}]"), env.tree("Value")));
    }

    @Test
    public void testLiftedPlaceholderBindsEnclosingNode() {
        Environment env = match("{a, foo(_@_X)}", "{a, bar(1)}").orElseThrow();

        assertTrue(Trees.structurallyEqual(quote("bar(1)"), env.tree("X")));
    }

    @Test
    public void testAnonymousPlaceholdersBindNothing() {
        Environment env = match("{_@_, _@X, 9090}", "{1, 2, 3}").orElseThrow();

        assertEquals(1, env.size());
        assertFalse(env.contains("_"));
        assertEquals(BigInteger.TWO, Trees.integerValue(env.tree("X")));
    }

    @Test
    public void testIntegerPlaceholders() {
        Environment env = match("{9091, 9092}", "{a, b}").orElseThrow();

        assertEquals("a", Trees.atomName(env.tree("1")));
        assertEquals("b", Trees.atomName(env.tree("2")));
    }

    @Test
    public void testRepeatedNameKeepsLastBinding() {
        Environment env = match("{_@X, _@X}", "{1, 2}").orElseThrow();

        assertEquals(BigInteger.TWO, Trees.integerValue(env.tree("X")));
    }

    @Test
    public void testGroupingParenthesesAreTransparent() {
        Environment env = match("{_@A + _@B}", "{(1 + 2)}").orElseThrow();

        assertEquals(BigInteger.ONE, Trees.integerValue(env.tree("A")));
        assertEquals(BigInteger.TWO, Trees.integerValue(env.tree("B")));
        assertTrue(match("f(_@X)", "f(((y)))").isPresent());
    }

    @Test
    public void testMapPattern() {
        Environment env = match("M#{name := _@N, age => _@A}", "M#{name := \"x\", age => 3}").orElseThrow();

        assertEquals("x", Trees.stringValue(env.tree("N")));
        assertEquals(BigInteger.valueOf(3), Trees.integerValue(env.tree("A")));
        assertTrue(match("#{name := _@N}", "#{name => 1}").isEmpty());
    }

    @Test
    public void testBinaryPattern() {
        Environment env = match("<<_@Size:8, _@Rest/binary>>", "<<N:8, Tail/binary>>").orElseThrow();

        assertEquals("N", Trees.variableName(env.tree("Size")));
        assertEquals("Tail", Trees.variableName(env.tree("Rest")));
    }

    @Test
    public void testPositionsAreIgnored() {
        Tree pattern = parser.parse("{ok, _@X}", Position.of(1)).getOnly();
        Tree tree = parser.parse("\n\n{ok, 5}", new Position(50, 3)).getOnly();

        assertTrue(Matcher.match(pattern, tree).isPresent());
    }

    @Test
    public void testMatchingAClause() {
        Tree pattern = parser.parse("(_@@Args) when _@@Guard -> _@@Body").getOnly();
        Tree clause = parser.parse("(X, Y) when X > Y -> X; (_, Y) -> Y").getFirst();

        Environment env = Matcher.match(pattern, clause).orElseThrow();
        assertEquals(2, env.group("Args").size());
        assertEquals(1, env.group("Body").size());
    }

    // ============================================================
    // Failures

    @Test
    public void testTupleDoesNotMatchList() {
        assertTrue(match("{_@A, _@B}", "[1, 2]").isEmpty());
    }

    @Test
    public void testLiteralMismatch() {
        assertTrue(match("{ok, _@X}", "{error, 1}").isEmpty());
    }

    @Test
    public void testMemberCountMismatch() {
        assertTrue(match("foo(_@A)", "foo(1, 2)").isEmpty());
    }

    @Test
    public void testGuardedPatternDoesNotMatchUnguardedClause() {
        Tree pattern = parser.parse("(_@@Args) when _@@Guard -> _@@Body").getOnly();
        Tree clause = parser.parse("(X) -> X").getOnly();

        assertTrue(Matcher.match(pattern, clause).isEmpty());
    }

    // ============================================================
    // Several patterns

    @Test
    public void testMatchAllMergesInOrder() {
        List<Template> patterns = List.of(TemplateBuilder.build(quote("_@A")), TemplateBuilder.build(quote("{_@A, _@B}")));
        List<Tree> trees = List.of(quote("1"), quote("{2, 3}"));

        Environment env = Matcher.matchAll(patterns, trees).orElseThrow();
        assertEquals(BigInteger.TWO, Trees.integerValue(env.tree("A")));
        assertEquals(BigInteger.valueOf(3), Trees.integerValue(env.tree("B")));
    }

    @Test
    public void testMatchAllBuildsTemplatesFromPatternTrees() {
        List<Tree> patterns = List.of(quote("_@A"), quote("{_@B, x}"));
        List<Tree> trees = List.of(quote("1"), quote("{2, x}"));

        Environment env = Matcher.matchAll(patterns, trees).orElseThrow();
        assertEquals(BigInteger.ONE, Trees.integerValue(env.tree("A")));
        assertEquals(BigInteger.TWO, Trees.integerValue(env.tree("B")));
    }

    @Test
    public void testMatchAllFailsIfAnyPairFails() {
        List<Template> patterns = List.of(TemplateBuilder.build(quote("_@A")), TemplateBuilder.build(quote("{_@B}")));
        List<Tree> trees = List.of(quote("1"), quote("[2]"));

        assertTrue(Matcher.matchAll(patterns, trees).isEmpty());
    }

    @Test
    public void testMatchAllNeedsEqualLengths() {
        List<Template> patterns = List.of(TemplateBuilder.build(quote("_@A")));

        assertThrows(IllegalArgumentException.class, () -> Matcher.matchAll(patterns, List.of()));
    }
}
