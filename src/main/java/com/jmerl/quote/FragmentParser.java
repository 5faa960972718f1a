package com.jmerl.quote;

import com.jmerl.syntax.ParseException;
import com.jmerl.syntax.Position;
import com.jmerl.syntax.Scanner;
import com.jmerl.syntax.Token;
import com.jmerl.syntax.TokenKind;
import com.jmerl.syntax.Tree;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reads source fragments into trees.
 *
 * <p>Text containing terminators is read as complete declarations. Anything else is tried as
 * expressions, then handler clauses, then function clauses, then case clauses; the first shape
 * that accepts the text wins.
 */
public class FragmentParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(FragmentParser.class);

    private static final List<FragmentShape> FALLBACKS = List.of(
            FragmentShape.EXPRESSIONS,
            FragmentShape.HANDLER_CLAUSES,
            FragmentShape.FUNCTION_CLAUSES,
            FragmentShape.CONDITIONAL_CLAUSES);

    public ImmutableList<Tree> parse(String text) {
        return parse(text, Position.of(1));
    }

    public ImmutableList<Tree> parse(String text, Position start) {
        return parseFragment(text, start).trees();
    }

    public ImmutableList<Tree> parse(List<String> lines, Position start) {
        return parse(joinLines(lines), start);
    }

    public ParsedFragment parseFragment(String text, Position start) {
        if (start.line() <= 0 || start.column() < 0) {
            throw new IllegalArgumentException("invalid start position: " + start);
        }
        ImmutableList<Token> tokens = Scanner.scan(text, start);
        ImmutableList<ImmutableList<Token>> forms = splitForms(tokens);
        if (forms != null) {
            return new ParsedFragment(FragmentShape.DECLARATIONS, forms.flatCollect(FragmentShape.DECLARATIONS::parse));
        }
        MutableList<ParseException> errors = Lists.mutable.empty();
        for (FragmentShape shape : FALLBACKS) {
            try {
                return new ParsedFragment(shape, shape.parse(tokens));
            } catch (ParseException e) {
                LOGGER.debug("fragment rejected as {}: {}", shape, e.getMessage());
                errors.add(e);
            }
        }
        ParseException best = ParseErrors.select(errors);
        throw new ParseException(best.reason(), best.position());
    }

    /**
     * Splits the tokens after each terminator, or returns null if there are no terminators.
     */
    static ImmutableList<ImmutableList<Token>> splitForms(ImmutableList<Token> tokens) {
        MutableList<ImmutableList<Token>> forms = Lists.mutable.empty();
        MutableList<Token> current = Lists.mutable.empty();
        for (Token token : tokens) {
            current.add(token);
            if (token.kind() == TokenKind.DOT) {
                forms.add(current.toImmutable());
                current = Lists.mutable.empty();
            }
        }
        if (current.isEmpty()) {
            return forms.toImmutable();
        }
        if (forms.isEmpty()) {
            return null;
        }
        Token last = current.getLast();
        throw new ParseException("incomplete form after " + last.describe(), last.position());
    }

    /**
     * Joins lines into one text, each line followed by a newline.
     */
    public static String joinLines(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
