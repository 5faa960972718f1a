package com.jmerl.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ErlParserTest {

    // ============================================================
    // Operators

    @Test
    public void testMultiplicationBindsTighter() {
        Tree tree = expr("1 + 2 * 3");

        assertEquals(NodeType.INFIX_EXPR, tree.type());
        assertEquals("+", Trees.operatorName(Trees.single(tree, 1)));
        Tree right = Trees.single(tree, 2);
        assertEquals(NodeType.INFIX_EXPR, right.type());
        assertEquals("*", Trees.operatorName(Trees.single(right, 1)));
    }

    @Test
    public void testAdditionIsLeftAssociative() {
        Tree tree = expr("1 - 2 - 3");

        assertEquals(NodeType.INFIX_EXPR, Trees.single(tree, 0).type());
        assertEquals(BigInteger.valueOf(3), Trees.integerValue(Trees.single(tree, 2)));
    }

    @Test
    public void testListOperatorsAreRightAssociative() {
        Tree tree = expr("A ++ B ++ C");

        assertEquals(NodeType.VARIABLE, Trees.single(tree, 0).type());
        assertEquals(NodeType.INFIX_EXPR, Trees.single(tree, 2).type());
    }

    @Test
    public void testMatchIsRightAssociative() {
        Tree tree = expr("X = Y = 1");

        assertEquals(NodeType.MATCH_EXPR, tree.type());
        assertEquals("X", Trees.variableName(Trees.single(tree, 0)));
        assertEquals(NodeType.MATCH_EXPR, Trees.single(tree, 1).type());
    }

    @Test
    public void testPrefixOperators() {
        Tree tree = expr("not A andalso - B > 0");

        assertEquals(NodeType.INFIX_EXPR, tree.type());
        assertEquals("andalso", Trees.operatorName(Trees.single(tree, 1)));
        assertEquals(NodeType.PREFIX_EXPR, Trees.single(tree, 0).type());
    }

    // ============================================================
    // Calls and data

    @Test
    public void testApplication() {
        Tree tree = expr("foo(1, 2)");

        assertEquals(NodeType.APPLICATION, tree.type());
        assertEquals(2, tree.groups().size());
        assertEquals("foo", Trees.atomName(Trees.single(tree, 0)));
        assertEquals(2, tree.groups().get(1).size());
    }

    @Test
    public void testRemoteCall() {
        Tree tree = expr("lists:map(F, L)");

        assertEquals(NodeType.APPLICATION, tree.type());
        Tree operator = Trees.single(tree, 0);
        assertEquals(NodeType.MODULE_QUALIFIER, operator.type());
        assertEquals("lists", Trees.atomName(Trees.single(operator, 0)));
        assertEquals("map", Trees.atomName(Trees.single(operator, 1)));
    }

    @Test
    public void testListForms() {
        assertEquals(NodeType.NIL, expr("[]").type());

        Tree proper = expr("[1, 2]");
        assertEquals(NodeType.LIST, proper.type());
        assertEquals(1, proper.groups().size());

        Tree improper = expr("[H | T]");
        assertEquals(2, improper.groups().size());
        assertEquals("T", Trees.variableName(Trees.single(improper, 1)));
    }

    @Test
    public void testEmptyTupleHasOneEmptyGroup() {
        Tree tree = expr("{}");

        assertEquals(NodeType.TUPLE, tree.type());
        assertEquals(1, tree.groups().size());
        assertTrue(tree.groups().getFirst().isEmpty());
        assertFalse(tree.isLeaf());
    }

    @Test
    public void testListComprehension() {
        Tree tree = expr("[X * 2 || X <- L, X > 0]");

        assertEquals(NodeType.LIST_COMP, tree.type());
        ImmutableList<Tree> qualifiers = tree.groups().get(1);
        assertEquals(2, qualifiers.size());
        assertEquals(NodeType.GENERATOR, qualifiers.get(0).type());
        assertEquals(NodeType.INFIX_EXPR, qualifiers.get(1).type());
    }

    @Test
    public void testAdjacentStringsAreJoined() {
        assertEquals("abcd", Trees.stringValue(expr("\"ab\" \"cd\"")));
    }

    @Test
    public void testRecords() {
        Tree create = expr("#point{x = 1, y = 2}");
        assertEquals(NodeType.RECORD_EXPR, create.type());
        assertEquals("point", Trees.atomName(Trees.single(create, 0)));
        assertEquals(2, create.groups().get(1).size());

        Tree update = expr("P#point{x = 3}");
        assertEquals(NodeType.RECORD_EXPR, update.type());
        assertEquals(3, update.groups().size());

        Tree access = expr("P#point.x");
        assertEquals(NodeType.RECORD_ACCESS, access.type());
        assertEquals("x", Trees.atomName(Trees.single(access, 2)));
    }

    @Test
    public void testParenthesesLeaveNoNode() {
        Tree tree = expr("(1 + 2) * 3");

        assertEquals("*", Trees.operatorName(Trees.single(tree, 1)));
        Tree left = Trees.single(tree, 0);
        assertEquals(NodeType.INFIX_EXPR, left.type());
        assertEquals("+", Trees.operatorName(Trees.single(left, 1)));
        assertEquals(Position.of(1), left.attributes().position());
    }

    @Test
    public void testMaps() {
        Tree create = expr("#{a => 1, b => 2}");
        assertEquals(NodeType.MAP_EXPR, create.type());
        assertEquals(1, create.groups().size());
        assertEquals(2, create.groups().getFirst().size());
        assertEquals(NodeType.MAP_FIELD_ASSOC, create.groups().getFirst().get(0).type());

        Tree update = expr("M#{a := 1}");
        assertEquals(2, update.groups().size());
        assertEquals("M", Trees.variableName(Trees.single(update, 0)));
        assertEquals(NodeType.MAP_FIELD_EXACT, update.groups().get(1).getOnly().type());

        Tree empty = expr("#{}");
        assertTrue(empty.groups().getFirst().isEmpty());
    }

    @Test
    public void testBinaries() {
        Tree tree = expr("<<1, X:8, Y/binary, Z:16/integer-little>>");

        assertEquals(NodeType.BINARY, tree.type());
        ImmutableList<Tree> fields = tree.groups().getFirst();
        assertEquals(4, fields.size());
        assertEquals(NodeType.SIZE_QUALIFIER, Trees.single(fields.get(1), 0).type());
        assertEquals("binary", Trees.atomName(Trees.single(fields.get(2), 1)));
        ImmutableList<Tree> types = fields.get(3).groups().get(1);
        assertEquals(2, types.size());
        assertEquals("little", Trees.atomName(types.get(1)));

        assertTrue(expr("<<>>").groups().getFirst().isEmpty());
    }

    @Test
    public void testBinaryComprehension() {
        Tree tree = expr("<< <<X>> || <<X>> <= B, X > 0 >>");

        assertEquals(NodeType.BINARY_COMP, tree.type());
        assertEquals(NodeType.BINARY, Trees.single(tree, 0).type());
        assertEquals(NodeType.BINARY_GENERATOR, tree.groups().get(1).get(0).type());
        assertEquals(NodeType.GENERATOR, expr("[X || X <- L]").groups().get(1).getOnly().type());
    }

    // ============================================================
    // Compound expressions

    @Test
    public void testCaseWithGuard() {
        Tree tree = expr("case X of {ok, V} when V > 0 -> V; _ -> 0 end");

        assertEquals(NodeType.CASE_EXPR, tree.type());
        ImmutableList<Tree> clauses = tree.groups().get(1);
        assertEquals(2, clauses.size());

        Tree guarded = clauses.get(0);
        assertEquals(3, guarded.groups().size());
        Tree guard = Trees.single(guarded, 1);
        assertEquals(NodeType.DISJUNCTION, guard.type());
        assertEquals(NodeType.CONJUNCTION, guard.groups().getFirst().getOnly().type());

        assertEquals(2, clauses.get(1).groups().size());
    }

    @Test
    public void testIfClausesHaveNoPatterns() {
        Tree tree = expr("if X > 0 -> pos; true -> other end");

        Tree clause = tree.groups().getFirst().getFirst();
        assertTrue(clause.groups().get(0).isEmpty());
        assertEquals(NodeType.DISJUNCTION, Trees.single(clause, 1).type());
    }

    @Test
    public void testFunExpressions() {
        Tree fun = expr("fun (X) -> X + 1 end");
        assertEquals(NodeType.FUN_EXPR, fun.type());
        assertEquals(1, fun.groups().getFirst().size());

        Tree local = expr("fun foo/1");
        assertEquals(NodeType.IMPLICIT_FUN, local.type());
        assertEquals(NodeType.ARITY_QUALIFIER, Trees.single(local, 0).type());

        Tree remote = expr("fun lists:map/2");
        assertEquals(NodeType.MODULE_QUALIFIER, Trees.single(remote, 0).type());
    }

    @Test
    public void testTryWithClassQualifiedHandler() {
        Tree tree = expr("try f() of ok -> ok catch error:R:S -> {R, S} after done end");

        assertEquals(NodeType.TRY_EXPR, tree.type());
        assertEquals(4, tree.groups().size());
        assertEquals(1, tree.groups().get(1).size());
        Tree handler = tree.groups().get(2).getOnly();
        Tree head = handler.groups().get(0).getOnly();
        assertEquals(NodeType.CLASS_QUALIFIER, head.type());
        assertEquals(3, head.groups().size());
        assertEquals(1, tree.groups().get(3).size());
    }

    @Test
    public void testCaseHeadMayNotBeWhollyParenthesized() {
        ParseException e = assertThrows(ParseException.class,
            () -> ErlParser.parseExprs(Scanner.scan("case X of (Y) -> Y end .", new Position(1, 1))));
        assertEquals("syntax error before: '('", e.reason());
        assertEquals(new Position(1, 11), e.position());

        Tree nested = expr("case X of {(Y), Z} -> Y end");
        Tree head = nested.groups().get(1).getOnly().groups().getFirst().getOnly();
        assertEquals(NodeType.TUPLE, head.type());
        assertEquals("Y", Trees.variableName(head.groups().getFirst().getFirst()));
    }

    @Test
    public void testTryNeedsCatchOrAfter() {
        assertThrows(ParseException.class, () -> expr("try f() end"));
    }

    @Test
    public void testReceiveWithTimeout() {
        Tree tree = expr("receive {msg, M} -> M after 100 -> timeout end");

        assertEquals(NodeType.RECEIVE_EXPR, tree.type());
        assertEquals(3, tree.groups().size());
        assertEquals(BigInteger.valueOf(100), Trees.integerValue(Trees.single(tree, 1)));
    }

    @Test
    public void testBlockAndCatch() {
        assertEquals(NodeType.BLOCK_EXPR, expr("begin a, b end").type());
        assertEquals(NodeType.CATCH_EXPR, expr("catch throw(x)").type());
    }

    // ============================================================
    // Forms

    @Test
    public void testFunctionForm() {
        Tree tree = form("f(0) -> zero; f(N) when N > 0 -> pos.");

        assertEquals(NodeType.FUNCTION, tree.type());
        assertEquals("f", Trees.atomName(Trees.single(tree, 0)));
        assertEquals(2, tree.groups().get(1).size());
    }

    @Test
    public void testHeadMismatch() {
        ParseException e = assertThrows(ParseException.class, () -> form("f(X) -> X; g(Y) -> Y."));

        assertEquals("head mismatch", e.reason());
    }

    @Test
    public void testAttributeForm() {
        Tree tree = form("-module(foo).");

        assertEquals(NodeType.ATTRIBUTE, tree.type());
        assertEquals("module", Trees.atomName(Trees.single(tree, 0)));
        assertEquals("foo", Trees.atomName(Trees.single(tree, 1)));
    }

    @Test
    public void testRecordDeclaration() {
        Tree tree = form("-record(state, {count, name = \"x\"}).");

        Tree fields = tree.groups().get(1).get(1);
        assertEquals(NodeType.TUPLE, fields.type());
        ImmutableList<Tree> declared = fields.groups().getFirst();
        assertEquals(NodeType.RECORD_FIELD, declared.get(0).type());
        assertEquals(1, declared.get(0).groups().size());
        assertEquals(2, declared.get(1).groups().size());
    }

    @Test
    public void testParenthesizedPatternInFunctionHead() {
        Tree tree = form("f((X)) -> X.");

        Tree clause = tree.groups().get(1).getOnly();
        assertEquals("X", Trees.variableName(clause.groups().getFirst().getOnly()));
    }

    @Test
    public void testTypedRecordFields() {
        Tree tree = form("-record(state, {count = 0 :: non_neg_integer(), name :: string()}).");

        ImmutableList<Tree> fields = tree.groups().get(1).get(1).groups().getFirst();
        assertEquals(NodeType.TYPED_RECORD_FIELD, fields.get(0).type());
        assertEquals(2, Trees.single(fields.get(0), 0).groups().size());
        assertEquals(NodeType.TYPE_APPLICATION, Trees.single(fields.get(1), 1).type());
    }

    // ============================================================
    // Types

    @Test
    public void testSpec() {
        Tree tree = form("-spec f(integer(), [atom()]) -> ok | {error, term()}.");

        assertEquals(NodeType.ATTRIBUTE, tree.type());
        Tree spec = Trees.single(tree, 1);
        assertEquals(NodeType.TYPE_SPEC, spec.type());
        Tree signature = spec.groups().get(1).getOnly();
        assertEquals(NodeType.FUNCTION_TYPE, signature.type());
        assertEquals(2, signature.groups().get(0).size());
        assertEquals(NodeType.LIST, signature.groups().get(0).get(1).type());
        Tree result = Trees.single(signature, 1);
        assertEquals(NodeType.TYPE_UNION, result.type());
        assertEquals(2, result.groups().getFirst().size());
    }

    @Test
    public void testSpecWithSeveralClausesAndConstraints() {
        Tree spec = Trees.single(form("-spec m:g(A) -> A when A :: 1..10; (atom()) -> ok."), 1);

        assertEquals(NodeType.MODULE_QUALIFIER, Trees.single(spec, 0).type());
        ImmutableList<Tree> signatures = spec.groups().get(1);
        assertEquals(2, signatures.size());
        Tree constrained = signatures.get(0);
        assertEquals(NodeType.CONSTRAINED_FUNCTION_TYPE, constrained.type());
        Tree constraint = constrained.groups().get(1).getOnly();
        assertEquals(NodeType.ANNOTATED_TYPE, constraint.type());
        assertEquals(NodeType.INTEGER_RANGE_TYPE, Trees.single(constraint, 1).type());
    }

    @Test
    public void testTypeDefinitions() {
        Tree pair = Trees.single(form("-type pair(K, V) :: {K, V}."), 1);
        assertEquals(NodeType.TYPE_DEFINITION, pair.type());
        assertEquals(2, pair.groups().get(1).size());
        assertEquals(NodeType.TUPLE, Trees.single(pair, 2).type());

        Tree opaque = Trees.single(form("-opaque t() :: #{atom() => [integer(), ...]}."), 1);
        Tree map = Trees.single(opaque, 2);
        assertEquals(NodeType.MAP_EXPR, map.type());
        Tree value = Trees.single(map.groups().getFirst().getOnly(), 1);
        assertEquals("nonempty_list", Trees.atomName(Trees.single(value, 0)));
    }

    @Test
    public void testCallbackWithFunType() {
        Tree callback = Trees.single(form("-callback init(Args :: term()) -> {ok, fun((...) -> ok)}."), 1);

        Tree signature = callback.groups().get(1).getOnly();
        assertEquals(NodeType.ANNOTATED_TYPE, signature.groups().get(0).getOnly().type());
        Tree fun = Trees.single(signature, 1).groups().getFirst().get(1);
        assertEquals(NodeType.FUN_TYPE, fun.type());
        assertEquals(1, Trees.single(fun, 0).groups().size());
    }

    @Test
    public void testExpressionForm() {
        Tree tree = form("X = 1 + 2.");

        assertEquals(NodeType.EXPR_FORM, tree.type());
        assertEquals(NodeType.MATCH_EXPR, tree.groups().getFirst().getOnly().type());
    }

    @Test
    public void testCallFollowedByDotIsAnExpressionForm() {
        Tree tree = form("foo(1, 2).");

        assertEquals(NodeType.EXPR_FORM, tree.type());
        assertEquals(NodeType.APPLICATION, tree.groups().getFirst().getOnly().type());
    }

    // ============================================================
    // Errors

    @Test
    public void testSyntaxErrorNamesTheToken() {
        ParseException e = assertThrows(ParseException.class,
            () -> ErlParser.parseExprs(Scanner.scan("foo(.", new Position(1, 1))));

        assertEquals("syntax error before: '.'", e.reason());
        assertEquals(new Position(1, 5), e.position());
    }

    @Test
    public void testPositionsAreRecorded() {
        Tree tree = ErlParser.parseExprs(Scanner.scan("\n\nfoo(X) .", Position.of(5))).getOnly();

        assertEquals(Position.of(7), tree.attributes().position());
    }

    private static ImmutableList<Tree> exprs(String text) {
        return ErlParser.parseExprs(Scanner.scan(text + " .", Position.of(1)));
    }

    private static Tree expr(String text) {
        return exprs(text).getOnly();
    }

    private static Tree form(String text) {
        return ErlParser.parseForm(Scanner.scan(text, Position.of(1)));
    }
}
