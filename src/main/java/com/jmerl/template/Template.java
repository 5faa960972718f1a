package com.jmerl.template;

import com.jmerl.syntax.Attributes;
import com.jmerl.syntax.NodeType;
import com.jmerl.syntax.Tree;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * A tree with placeholder positions told apart from fixed structure. Built from a tree by
 * {@link TemplateBuilder}; rendered by {@link Substitution}; compared by {@link Matcher}.
 */
public sealed interface Template {

    /** Stands for one subtree. */
    record NodePlaceholder(Tag name) implements Template {
    }

    /** An interior node whose child slots are templates. */
    record Structural(NodeType type, Attributes attributes, ImmutableList<Slot> groups) implements Template {
    }

    /** A leaf that is not a placeholder; matched by structural equality. */
    record Literal(Tree tree) implements Template {
    }

    /**
     * One child slot of a {@link Structural} template.
     */
    sealed interface Slot {
    }

    /** A slot collapsed to a single placeholder standing for all of the slot's members. */
    record GroupPlaceholder(Tag name) implements Slot {
    }

    /** A slot of individual member templates. */
    record Members(ImmutableList<Template> members) implements Slot {
    }
}
