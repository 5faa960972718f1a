package com.jmerl;

import com.jmerl.quote.FragmentParser;
import com.jmerl.quote.FragmentShape;
import com.jmerl.syntax.NodeType;
import com.jmerl.syntax.Position;
import com.jmerl.syntax.Tree;
import com.jmerl.syntax.Trees;
import com.jmerl.template.Environment;
import com.jmerl.template.Tag;
import com.jmerl.template.Template;
import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class MerlTest {

    private static Tree quote(String text) {
        return Merl.quote(text).getOnly();
    }

    // ============================================================
    // Substitution and matching laws

    @ParameterizedTest
    @ValueSource(strings = {
        "{ok, [1, 2 | T]}",
        "case X of {a, B} when B > 0 -> B; _ -> 0 end",
        "fun (X) -> X * 2 end",
        "f(X) -> X + 1."
    })
    public void testGroundTreesAreUnchangedBySubstitution(String text) {
        Tree tree = quote(text);
        Environment env = Environment.empty().with("X", Trees.atom("unused"));

        assertTrue(Trees.structurallyEqual(tree, Merl.subst(Merl.template(tree), env)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "foo(_@X, [_@@Ys], 9093)",
        "{a, foo(_@_X)}",
        "{foo(_@_@Xs)}",
        "(_@@Args) when _@@Guard -> _@@Body"
    })
    public void testRevertedTemplatesAreStable(String text) {
        Template template = Merl.template(quote(text));

        Template once = Merl.template(Merl.tree(template));
        Template twice = Merl.template(Merl.tree(once));
        assertEquals(once, twice);
    }

    static Stream<Arguments> patternsAndTrees() {
        return Stream.of(
            Arguments.of("_@fn(_@@args)", "foo(1, 2, 3)"),
            Arguments.of("{reply, _@Value, _@_}", "{reply, [1, 2], state}"),
            Arguments.of("{a, foo(_@_X)}", "{a, bar(1)}"),
            Arguments.of("case _@Expr of _@_@Clauses -> x end", "case f(X) of 1 -> a; _ -> b end"),
            Arguments.of("[_@H | _@T]", "[1 | [2, 3]]")
        );
    }

    @ParameterizedTest
    @MethodSource("patternsAndTrees")
    public void testSubstitutingMatchedBindingsRebuildsTheTree(String pattern, String ground) {
        Tree tree = quote(ground);
        Environment env = Merl.match(quote(pattern), tree).orElseThrow();

        assertTrue(Trees.structurallyEqual(tree, Merl.subst(quote(pattern), env)));
        assertFalse(env.bindings().keysView().anySatisfy(Tag::isAnonymous));
    }

    @Test
    public void testCallExample() {
        Tree pattern = quote("_@fn(_@@args)");
        Tree ground = quote("foo(1, 2, 3)");

        Environment env = Merl.match(pattern, ground).orElseThrow();
        assertEquals("foo", Trees.atomName(env.tree("fn")));
        assertEquals(List.of(BigInteger.ONE, BigInteger.TWO, BigInteger.valueOf(3)),
            env.group("args").collect(Trees::integerValue).castToList());
        assertTrue(Trees.structurallyEqual(ground, Merl.subst(pattern, env)));
    }

    @Test
    public void testTupleNeverMatchesList() {
        assertEquals(Optional.empty(), Merl.match(quote("{_@A, _@B}"), quote("[1, 2]")));
    }

    @Test
    public void testLiftBindsTheWholeNode() {
        Template template = Merl.template(quote("foo(_@_X, 1)"));

        assertEquals(new Template.NodePlaceholder(Tag.of("X")), template);
        Tree ground = quote("bar(2, 3)");
        assertSame(ground, Merl.match(template, ground).orElseThrow().tree("X"));
    }

    // ============================================================
    // Quoting

    @Test
    public void testTerminatorDecidesDeclarationShape() {
        ImmutableList<Tree> declaration = Merl.quote("X = 1 + 2.");
        ImmutableList<Tree> expression = Merl.quote("X = 1 + 2");

        assertEquals(NodeType.EXPR_FORM, declaration.getOnly().type());
        assertEquals(NodeType.MATCH_EXPR, expression.getOnly().type());
        assertTrue(Trees.structurallyEqual(expression.getOnly(), declaration.getOnly().groups().getFirst().getOnly()));
    }

    @Test
    public void testFunctionClauseFallback() {
        assertEquals(FragmentShape.FUNCTION_CLAUSES, new FragmentParser().parseFragment("(X) -> X", Position.of(1)).shape());
        assertEquals(FragmentShape.HANDLER_CLAUSES, new FragmentParser().parseFragment("X -> X", Position.of(1)).shape());
    }

    @Test
    public void testQuoteLines() {
        ImmutableList<Tree> forms = Merl.quote(List.of("-module(m).", "f() -> ok."));

        assertEquals(2, forms.size());
        assertEquals(Position.of(2), forms.getLast().attributes().position());
    }

    @Test
    public void testQuoteStartLine() {
        assertEquals(Position.of(7), Merl.quote(7, "foo").getOnly().attributes().position());
    }

    @Test
    public void testQquote() {
        Environment env = Environment.empty()
            .with("Name", Trees.atom("add"))
            .with("Args", List.of(Trees.variable("A"), Trees.variable("B")));

        Tree form = Merl.qquote("'@Name'(_@@Args) -> ok.", env).getOnly();

        assertEquals(NodeType.FUNCTION, form.type());
        assertEquals("add", Trees.atomName(Trees.single(form, 0)));
        assertEquals(2, form.groups().get(1).getOnly().groups().getFirst().size());
    }

    @Test
    public void testSubstituteSeveralTrees() {
        Environment env = Environment.empty().with("X", Trees.integer(1));

        ImmutableList<Tree> trees = Merl.subst(Merl.quote("_@X, {_@X}"), env);
        assertEquals(NodeType.INTEGER, trees.get(0).type());
        assertEquals(NodeType.TUPLE, trees.get(1).type());
    }

    // ============================================================
    // Primitives

    @Test
    public void testTemplateVars() {
        Template template = Merl.template(quote("{_@A, foo(_@@Bs), 9093, _@_}"));

        assertEquals(List.of(Tag.of("3"), Tag.of("A"), Tag.of("Bs"), Tag.of("_")), Merl.templateVars(template).toList());
    }

    @Test
    public void testTemplatesOfSeveralTrees() {
        ImmutableList<Template> templates = Merl.templates(Merl.quote("_@A, b"));

        assertEquals(2, templates.size());
        assertTrue(templates.getLast() instanceof Template.Literal);
    }

    @Test
    public void testMatchAll() {
        List<Template> patterns = Merl.templates(Merl.quote("_@A, {_@B}")).castToList();
        List<Tree> trees = Merl.quote("1, {2}").castToList();

        Environment env = Merl.matchAll(patterns, trees).orElseThrow();
        assertEquals(2, env.size());
    }

    @Test
    public void testMatchAllWithPatternTrees() {
        Environment env = Merl.matchAll(Merl.quote("_@A, {_@B}"), Merl.quote("1, {2}").castToList()).orElseThrow();

        assertEquals(2, env.size());
    }

    @Test
    public void testParenthesesDoNotChangeTheTree() {
        assertTrue(Trees.structurallyEqual(quote("f((X))"), quote("f(X)")));
        assertTrue(Trees.structurallyEqual(quote("(1 + 2)"), quote("1 + 2")));
        assertTrue(Merl.match(quote("{_@A + _@B}"), quote("{(1 + 2)}")).isPresent());
    }

    @Test
    public void testIsMetavar() {
        assertEquals(Optional.of("x"), Merl.isMetavar(Trees.atom("@x")));
        assertEquals(Optional.of("@Xs"), Merl.isMetavar(Merl.var("_@@Xs")));
        assertEquals(Optional.empty(), Merl.isMetavar(Merl.var("X")));
    }

    @Test
    public void testTerm() {
        assertEquals(BigInteger.valueOf(42), Trees.integerValue(Merl.term(42)));
        assertEquals(BigInteger.TEN.pow(30), Trees.integerValue(Merl.term(BigInteger.TEN.pow(30))));
        assertEquals(1.5, Trees.floatValue(Merl.term(1.5)));
        assertEquals("s", Trees.stringValue(Merl.term("s")));
        assertEquals('c', Trees.charValue(Merl.term('c')));
        assertEquals("true", Trees.atomName(Merl.term(true)));
        assertEquals(NodeType.NIL, Merl.term(List.of()).type());

        Tree list = Merl.term(List.of(1, "a"));
        assertEquals(NodeType.LIST, list.type());
        assertEquals(2, list.groups().getFirst().size());

        Tree tree = Trees.atom("x");
        assertSame(tree, Merl.term(tree));
        assertThrows(IllegalArgumentException.class, () -> Merl.term(new Object()));
    }
}
