package com.jmerl.template;

import com.jmerl.syntax.Tree;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * The value bound to a placeholder name: one tree for a node-level name, a list of sibling
 * trees for a group-level name.
 */
public sealed interface Binding {
    record Single(Tree tree) implements Binding {
    }

    record Group(ImmutableList<Tree> trees) implements Binding {
    }
}
