package com.jmerl.quote;

import com.jmerl.syntax.Tree;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * The trees read from a fragment and the shape that accepted them.
 */
public record ParsedFragment(FragmentShape shape, ImmutableList<Tree> trees) {
}
