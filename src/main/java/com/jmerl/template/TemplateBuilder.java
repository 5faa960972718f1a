package com.jmerl.template;

import com.jmerl.syntax.Tree;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Converts trees to {@link Template}s.
 *
 * <p>After its prefix, a placeholder's raw name may start with any number of lift characters
 * ({@code _} or {@code 0}), each of which makes the placeholder stand for the node one level
 * further up, followed by one group character ({@code @} or {@code 9}) making it stand for a
 * whole child slot instead of a single child. Both only apply when something follows them.
 */
public final class TemplateBuilder {
    private TemplateBuilder() {
    }

    public static Template build(Tree tree) {
        Converted converted = convert(tree);
        if (converted instanceof Done done) {
            return done.template();
        }
        throw new TemplateException("bad metavariable: '" + converted.rawName() + "'");
    }

    public static ImmutableList<Template> buildAll(Iterable<? extends Tree> trees) {
        return Lists.immutable.<Tree>ofAll(trees).collect(TemplateBuilder::build);
    }

    /** Intermediate result: a template, or a placeholder still waiting for its enclosing node. */
    private sealed interface Converted {
        default String rawName() {
            return "";
        }
    }

    private record Done(Template template) implements Converted {
    }

    private record Lifted(String rawName) implements Converted {
    }

    private record Grouped(String rawName) implements Converted {
    }

    private static Converted convert(Tree tree) {
        if (tree.isLeaf()) {
            Optional<String> rawName = Metavariables.rawName(tree);
            return rawName.isPresent() ? resolve(rawName.get()) : new Done(new Template.Literal(tree));
        }
        MutableList<Template.Slot> slots = Lists.mutable.empty();
        MutableList<Converted> members = Lists.mutable.empty();
        for (ImmutableList<Tree> group : tree.groups()) {
            ImmutableList<Converted> converted = group.collect(TemplateBuilder::convert);
            if (converted.size() == 1 && converted.getFirst() instanceof Grouped grouped) {
                slots.add(new Template.GroupPlaceholder(Tag.of(grouped.rawName())));
                continue;
            }
            checkGroup(converted);
            members.addAllIterable(converted);
            slots.add(new Template.Members(converted.collectIf(c -> c instanceof Done, c -> ((Done) c).template())));
        }
        Optional<String> lifted = lift(members);
        if (lifted.isPresent()) {
            return resolve(lifted.get());
        }
        return new Done(new Template.Structural(tree.type(), tree.attributes(), slots.toImmutable()));
    }

    /**
     * Strips one modifier from a raw placeholder name.
     */
    private static Converted resolve(String rawName) {
        if (rawName.length() > 1) {
            char first = rawName.charAt(0);
            if (first == '_' || first == '0') {
                return new Lifted(rawName.substring(1));
            }
            if (first == '@' || first == '9') {
                return new Grouped(rawName.substring(1));
            }
        }
        return new Done(new Template.NodePlaceholder(Tag.of(rawName)));
    }

    // a group placeholder must be the only member of its slot; nested slots are checked on their own
    private static void checkGroup(ImmutableList<Converted> members) {
        ImmutableList<String> names = members.selectInstancesOf(Grouped.class).collect(Grouped::rawName);
        if (names.notEmpty()) {
            throw new TemplateException("misplaced group metavariable: " + names.makeString("[", ", ", "]"));
        }
    }

    private static Optional<String> lift(MutableList<Converted> members) {
        MutableSet<String> names = members.selectInstancesOf(Lifted.class).collect(Lifted::rawName).toSet();
        if (names.isEmpty()) {
            return Optional.empty();
        }
        if (names.size() > 1) {
            throw new TemplateException("clashing metavariables: " + names.toSortedList().makeString("[", ", ", "]"));
        }
        return Optional.of(names.getOnly());
    }
}
