package com.jmerl.quote;

import com.jmerl.syntax.ErlParser;
import com.jmerl.syntax.NodeType;
import com.jmerl.syntax.ParseException;
import com.jmerl.syntax.Token;
import com.jmerl.syntax.Tree;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * The ways a fragment can be read. The shapes after {@link #DECLARATIONS} are tried in
 * declaration order on text without terminators; each wraps the tokens in the synthetic
 * tokens of an enclosing construct and extracts what the fragment contributed to it.
 */
public enum FragmentShape {
    /** Dot-terminated functions, attributes or expression forms. */
    DECLARATIONS {
        @Override
        ImmutableList<Tree> parse(ImmutableList<Token> tokens) {
            return Lists.immutable.of(ErlParser.parseForm(tokens));
        }
    },

    /** Comma-separated expressions. */
    EXPRESSIONS {
        @Override
        ImmutableList<Tree> parse(ImmutableList<Token> tokens) {
            return ErlParser.parseExprs(tokens.newWith(Token.dot()));
        }
    },

    /** Handler clauses, as after {@code try ... catch}. */
    HANDLER_CLAUSES {
        @Override
        ImmutableList<Tree> parse(ImmutableList<Token> tokens) {
            ImmutableList<Token> wrapped = Lists.immutable.of(Token.keyword("try"), Token.atom("true"), Token.keyword("catch"))
                    .newWithAll(closed(tokens));
            return group(only(ErlParser.parseExprs(wrapped), NodeType.TRY_EXPR), 2);
        }
    },

    /** Clauses of an anonymous function. */
    FUNCTION_CLAUSES {
        @Override
        ImmutableList<Tree> parse(ImmutableList<Token> tokens) {
            ImmutableList<Token> wrapped = Lists.immutable.of(Token.keyword("fun")).newWithAll(closed(tokens));
            return group(only(ErlParser.parseExprs(wrapped), NodeType.FUN_EXPR), 0);
        }
    },

    /** Clauses of a case expression. */
    CONDITIONAL_CLAUSES {
        @Override
        ImmutableList<Tree> parse(ImmutableList<Token> tokens) {
            ImmutableList<Token> wrapped = Lists.immutable.of(Token.keyword("case"), Token.atom("true"), Token.keyword("of"))
                    .newWithAll(closed(tokens));
            return group(only(ErlParser.parseExprs(wrapped), NodeType.CASE_EXPR), 1);
        }
    };

    abstract ImmutableList<Tree> parse(ImmutableList<Token> tokens);

    private static ImmutableList<Token> closed(ImmutableList<Token> tokens) {
        return tokens.newWith(Token.keyword("end")).newWith(Token.dot());
    }

    private static Tree only(ImmutableList<Tree> exprs, NodeType expected) {
        if (exprs.size() != 1 || exprs.getFirst().type() != expected) {
            throw new ParseException("fragment is not a single " + expected.name().toLowerCase() + " body");
        }
        return exprs.getFirst();
    }

    private static ImmutableList<Tree> group(Tree tree, int group) {
        return tree.groups().get(group);
    }
}
