package com.jmerl;

import com.jmerl.quote.FragmentParser;
import com.jmerl.syntax.Attributes;
import com.jmerl.syntax.Position;
import com.jmerl.syntax.Tree;
import com.jmerl.syntax.Trees;
import com.jmerl.template.Environment;
import com.jmerl.template.Matcher;
import com.jmerl.template.Metavariables;
import com.jmerl.template.Substitution;
import com.jmerl.template.Tag;
import com.jmerl.template.Template;
import com.jmerl.template.TemplateBuilder;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.sorted.ImmutableSortedSet;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.SortedSets;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Quoting, substitution and matching of Erlang source fragments.
 *
 * <p>Placeholders are written as atoms {@code '@name'}, variables {@code _@Name} or integers
 * {@code 909N}. A template built from quoted text can be rendered with an {@link Environment}
 * ({@link #subst}) or matched against a tree to recover one ({@link #match}).
 *
 * <pre>{@code
 * Tree pattern = Merl.quote("_@fn(_@@args)").getFirst();
 * Environment env = Merl.match(pattern, Merl.quote("foo(1, 2, 3)").getFirst()).orElseThrow();
 * env.tree("fn");   // foo
 * env.group("args"); // [1, 2, 3]
 * }</pre>
 */
public final class Merl {
    private static final FragmentParser PARSER = new FragmentParser();

    private Merl() {
    }

    // ------------------------------------------------------------
    // Quoting

    public static ImmutableList<Tree> quote(String text) {
        return quote(Position.of(1), text);
    }

    public static ImmutableList<Tree> quote(int startLine, String text) {
        return quote(Position.of(startLine), text);
    }

    public static ImmutableList<Tree> quote(Position start, String text) {
        return PARSER.parse(text, start);
    }

    public static ImmutableList<Tree> quote(List<String> lines) {
        return quote(Position.of(1), FragmentParser.joinLines(lines));
    }

    /**
     * Quotes the text and substitutes the environment into every resulting tree.
     */
    public static ImmutableList<Tree> qquote(String text, Environment env) {
        return qquote(Position.of(1), text, env);
    }

    public static ImmutableList<Tree> qquote(int startLine, String text, Environment env) {
        return qquote(Position.of(startLine), text, env);
    }

    public static ImmutableList<Tree> qquote(Position start, String text, Environment env) {
        return quote(start, text).collect(tree -> Substitution.substitute(tree, env));
    }

    public static ImmutableList<Tree> qquote(List<String> lines, Environment env) {
        return qquote(Position.of(1), FragmentParser.joinLines(lines), env);
    }

    // ------------------------------------------------------------
    // Templates

    public static Template template(Tree tree) {
        return TemplateBuilder.build(tree);
    }

    public static ImmutableList<Template> templates(Iterable<? extends Tree> trees) {
        return TemplateBuilder.buildAll(trees);
    }

    /**
     * Reverts a template to a tree; remaining placeholders become {@code '@'}-prefixed atoms or
     * {@code 909}-prefixed integers.
     */
    public static Tree tree(Template template) {
        return Substitution.revert(template);
    }

    /**
     * The names of all placeholders in a template, anonymous ones included.
     */
    public static ImmutableSortedSet<Tag> templateVars(Template template) {
        MutableSortedSet<Tag> vars = SortedSets.mutable.empty();
        collectVars(template, vars);
        return vars.toImmutable();
    }

    private static void collectVars(Template template, MutableSortedSet<Tag> vars) {
        if (template instanceof Template.NodePlaceholder placeholder) {
            vars.add(placeholder.name());
        } else if (template instanceof Template.Structural structural) {
            for (Template.Slot slot : structural.groups()) {
                if (slot instanceof Template.GroupPlaceholder placeholder) {
                    vars.add(placeholder.name());
                } else {
                    ((Template.Members) slot).members().each(member -> collectVars(member, vars));
                }
            }
        }
    }

    // ------------------------------------------------------------
    // Substitution and matching

    public static Tree subst(Tree tree, Environment env) {
        return Substitution.substitute(tree, env);
    }

    public static Tree subst(Template template, Environment env) {
        return Substitution.substitute(template, env);
    }

    public static ImmutableList<Tree> subst(Iterable<? extends Tree> trees, Environment env) {
        return Lists.immutable.<Tree>ofAll(trees).collect(tree -> Substitution.substitute(tree, env));
    }

    public static Optional<Environment> match(Tree pattern, Tree tree) {
        return Matcher.match(pattern, tree);
    }

    public static Optional<Environment> match(Template pattern, Tree tree) {
        return Matcher.match(pattern, tree);
    }

    public static Optional<Environment> matchAll(List<? extends Template> patterns, List<? extends Tree> trees) {
        return Matcher.matchAll(patterns, trees);
    }

    public static Optional<Environment> matchAll(Iterable<? extends Tree> patterns, List<? extends Tree> trees) {
        return Matcher.matchAll(patterns, trees);
    }

    // ------------------------------------------------------------
    // Primitives

    /**
     * The raw placeholder name, if the tree is a placeholder leaf.
     */
    public static Optional<String> isMetavar(Tree tree) {
        return Metavariables.rawName(tree);
    }

    public static Tree var(String name) {
        return Trees.variable(name);
    }

    /**
     * A literal tree for a constant: numbers, strings, characters, booleans (as atoms), lists of
     * constants, and trees, which are returned unchanged.
     */
    public static Tree term(Object value) {
        if (value instanceof Tree tree) {
            return tree;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return Trees.integer(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return Trees.integer(big, Attributes.NONE);
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return Trees.floatLiteral(((Number) value).doubleValue());
        }
        if (value instanceof String s) {
            return Trees.string(s);
        }
        if (value instanceof Character c) {
            return Trees.charLiteral(c);
        }
        if (value instanceof Boolean b) {
            return Trees.atom(b.toString());
        }
        if (value instanceof List<?> list) {
            return Trees.list(Lists.immutable.<Object>ofAll(list).collect(Merl::term).castToList());
        }
        throw new IllegalArgumentException("not a constant term: " + value);
    }
}
