package com.jmerl.template;

import com.jmerl.syntax.Tree;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.sorted.ImmutableSortedMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.SortedMaps;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * An immutable mapping from placeholder names to bound values, kept sorted by name. Used both as
 * the input of substitution and as the bindings produced by a successful match.
 */
public final class Environment {
    private static final Environment EMPTY = new Environment(SortedMaps.immutable.empty());

    private final ImmutableSortedMap<Tag, Binding> bindings;

    private Environment(ImmutableSortedMap<Tag, Binding> bindings) {
        this.bindings = bindings;
    }

    public static Environment empty() {
        return EMPTY;
    }

    public Environment with(Tag name, Binding value) {
        return new Environment(bindings.newWithKeyValue(name, value));
    }

    public Environment with(String name, Tree tree) {
        return with(Tag.of(name), new Binding.Single(tree));
    }

    public Environment with(String name, List<? extends Tree> trees) {
        return with(Tag.of(name), new Binding.Group(Lists.immutable.<Tree>ofAll(trees)));
    }

    /**
     * This environment with every binding of {@code later} added, replacing bindings of the same name.
     */
    public Environment merge(Environment later) {
        ImmutableSortedMap<Tag, Binding> merged = bindings;
        for (Tag name : later.bindings.keysView()) {
            merged = merged.newWithKeyValue(name, later.bindings.get(name));
        }
        return new Environment(merged);
    }

    public Optional<Binding> lookup(Tag name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public boolean contains(String name) {
        return bindings.containsKey(Tag.of(name));
    }

    /**
     * The tree bound to a node-level name.
     */
    public Tree tree(String name) {
        Binding value = require(name);
        if (value instanceof Binding.Single single) {
            return single.tree();
        }
        throw new EnvironmentTypeException("'" + name + "' is bound to a group, not a single tree");
    }

    /**
     * The trees bound to a group-level name.
     */
    public ImmutableList<Tree> group(String name) {
        Binding value = require(name);
        if (value instanceof Binding.Group group) {
            return group.trees();
        }
        throw new EnvironmentTypeException("'" + name + "' is bound to a single tree, not a group");
    }

    private Binding require(String name) {
        Binding value = bindings.get(Tag.of(name));
        if (value == null) {
            throw new NoSuchElementException("unbound name: " + name);
        }
        return value;
    }

    public ImmutableSortedMap<Tag, Binding> bindings() {
        return bindings;
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Environment other && bindings.equals(other.bindings));
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}
