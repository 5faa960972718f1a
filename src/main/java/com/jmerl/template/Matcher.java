package com.jmerl.template;

import com.jmerl.syntax.Tree;
import com.jmerl.syntax.Trees;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * Matches templates against ground trees.
 *
 * <p>Each named placeholder binds the subtree (or, for group placeholders, the list of sibling
 * subtrees) found at its position; anonymous placeholders bind nothing. Names are not checked
 * for consistency: when a name occurs more than once, the last binding wins.
 */
public final class Matcher {
    private Matcher() {
    }

    public static Optional<Environment> match(Tree pattern, Tree tree) {
        return match(TemplateBuilder.build(pattern), tree);
    }

    public static Optional<Environment> match(Template pattern, Tree tree) {
        try {
            return Optional.of(matchTemplate(pattern, tree, Environment.empty()));
        } catch (NoMatch e) {
            return Optional.empty();
        }
    }

    /**
     * Matches patterns and trees pairwise. Bindings from later pairs replace earlier ones.
     */
    public static Optional<Environment> matchAll(List<? extends Template> patterns, List<? extends Tree> trees) {
        if (patterns.size() != trees.size()) {
            throw new IllegalArgumentException("cannot match " + patterns.size() + " patterns against " + trees.size() + " trees");
        }
        Environment env = Environment.empty();
        for (int i = 0; i < patterns.size(); i++) {
            Optional<Environment> matched = match(patterns.get(i), trees.get(i));
            if (matched.isEmpty()) {
                return Optional.empty();
            }
            env = env.merge(matched.get());
        }
        return Optional.of(env);
    }

    /**
     * Like {@link #matchAll(List, List)}, building a template from each pattern tree first.
     */
    public static Optional<Environment> matchAll(Iterable<? extends Tree> patterns, List<? extends Tree> trees) {
        return matchAll(TemplateBuilder.buildAll(patterns).castToList(), trees);
    }

    private static Environment matchTemplate(Template pattern, Tree tree, Environment env) {
        if (pattern instanceof Template.NodePlaceholder placeholder) {
            return bind(placeholder.name(), new Binding.Single(tree), env);
        }
        if (pattern instanceof Template.Structural structural) {
            if (structural.type() != tree.type()) {
                throw NoMatch.INSTANCE;
            }
            return matchGroups(structural.groups(), tree.groups(), env);
        }
        if (!Trees.structurallyEqual(((Template.Literal) pattern).tree(), tree)) {
            throw NoMatch.INSTANCE;
        }
        return env;
    }

    private static Environment matchGroups(ImmutableList<Template.Slot> slots, ImmutableList<ImmutableList<Tree>> groups, Environment env) {
        if (slots.size() != groups.size()) {
            throw NoMatch.INSTANCE;
        }
        for (int i = 0; i < slots.size(); i++) {
            Template.Slot slot = slots.get(i);
            ImmutableList<Tree> group = groups.get(i);
            if (slot instanceof Template.GroupPlaceholder placeholder) {
                env = bind(placeholder.name(), new Binding.Group(group), env);
            } else {
                env = matchMembers(((Template.Members) slot).members(), group, env);
            }
        }
        return env;
    }

    private static Environment matchMembers(ImmutableList<Template> members, ImmutableList<Tree> group, Environment env) {
        if (members.size() != group.size()) {
            throw NoMatch.INSTANCE;
        }
        for (int i = 0; i < members.size(); i++) {
            env = matchTemplate(members.get(i), group.get(i), env);
        }
        return env;
    }

    private static Environment bind(Tag name, Binding value, Environment env) {
        return name.isAnonymous() ? env : env.with(name, value);
    }

    /** Unwinds a failed match; carries no information. */
    private static final class NoMatch extends RuntimeException {
        static final NoMatch INSTANCE = new NoMatch();

        private NoMatch() {
            super(null, null, false, false);
        }
    }
}
