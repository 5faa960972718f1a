package com.jmerl.template;

import com.jmerl.syntax.Tree;
import com.jmerl.syntax.Trees;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Optional;

/**
 * Renders templates to concrete trees, replacing bound placeholders with their values.
 * Unbound placeholders are rendered back to their leaf spelling.
 */
public final class Substitution {
    private Substitution() {
    }

    public static Tree substitute(Tree tree, Environment env) {
        return substitute(TemplateBuilder.build(tree), env);
    }

    public static Tree substitute(Template template, Environment env) {
        if (template instanceof Template.NodePlaceholder placeholder) {
            Optional<Binding> value = env.lookup(placeholder.name());
            if (value.isEmpty()) {
                return Metavariables.nodeLeaf(placeholder.name());
            }
            if (value.get() instanceof Binding.Single single) {
                return single.tree();
            }
            throw new EnvironmentTypeException("value of non-group metavariable must not be a list: '" + placeholder.name() + "'");
        }
        if (template instanceof Template.Structural structural) {
            ImmutableList<ImmutableList<Tree>> groups = structural.groups().collect(slot -> substituteSlot(slot, env));
            return Trees.make(structural.type(), structural.attributes(), groups);
        }
        return ((Template.Literal) template).tree();
    }

    /**
     * The concrete tree for a template, with every placeholder in its leaf spelling.
     */
    public static Tree revert(Template template) {
        return substitute(template, Environment.empty());
    }

    private static ImmutableList<Tree> substituteSlot(Template.Slot slot, Environment env) {
        if (slot instanceof Template.GroupPlaceholder placeholder) {
            Optional<Binding> value = env.lookup(placeholder.name());
            if (value.isEmpty()) {
                return Lists.immutable.of(Metavariables.groupLeaf(placeholder.name()));
            }
            if (value.get() instanceof Binding.Group group) {
                return group.trees();
            }
            throw new EnvironmentTypeException("value of group metavariable must be a list: '" + placeholder.name() + "'");
        }
        MutableList<Tree> members = Lists.mutable.empty();
        for (Template member : ((Template.Members) slot).members()) {
            members.add(substitute(member, env));
        }
        return members.toImmutable();
    }
}
