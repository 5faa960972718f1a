package com.jmerl.build;

import com.jmerl.Merl;
import com.jmerl.syntax.NodeType;
import com.jmerl.syntax.Tree;
import com.jmerl.syntax.Trees;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Accumulates the declarations of a module and renders them as forms. Instances are immutable;
 * every {@code with} method returns a new builder.
 *
 * <pre>{@code
 * ImmutableList<Tree> forms = ModuleBuilder.init("adder")
 *         .withFunction(true, "add", Merl.quote("(X, Y) -> X + Y"))
 *         .forms();
 * }</pre>
 */
public final class ModuleBuilder {
    private final String name;
    private final ImmutableList<FunctionEntry> functions;
    private final ImmutableList<Tree> imports;
    private final ImmutableList<Tree> attributes;
    private final ImmutableList<Tree> records;

    private record FunctionEntry(String name, int arity, boolean exported, ImmutableList<Tree> clauses) {
        FunctionEntry withClauses(boolean exportedToo, ImmutableList<Tree> more) {
            return new FunctionEntry(name, arity, exported || exportedToo, clauses.newWithAll(more));
        }
    }

    private ModuleBuilder(String name, ImmutableList<FunctionEntry> functions, ImmutableList<Tree> imports,
                          ImmutableList<Tree> attributes, ImmutableList<Tree> records) {
        this.name = name;
        this.functions = functions;
        this.imports = imports;
        this.attributes = attributes;
        this.records = records;
    }

    public static ModuleBuilder init(String name) {
        return new ModuleBuilder(name, Lists.immutable.empty(), Lists.immutable.empty(), Lists.immutable.empty(), Lists.immutable.empty());
    }

    public String name() {
        return name;
    }

    /**
     * Adds a function. Clauses for a name and arity that was already added are appended to it.
     */
    public ModuleBuilder withFunction(boolean exported, String function, Iterable<? extends Tree> clauses) {
        ImmutableList<Tree> cs = Lists.immutable.ofAll(clauses);
        if (cs.isEmpty()) {
            throw new IllegalArgumentException("function " + function + " needs at least one clause");
        }
        for (Tree clause : cs) {
            if (clause.type() != NodeType.CLAUSE) {
                throw new IllegalArgumentException("not a clause: " + clause.type());
            }
        }
        int arity = cs.getFirst().groups().getFirst().size();
        int existing = functions.detectIndex(f -> f.name().equals(function) && f.arity() == arity);
        ImmutableList<FunctionEntry> updated;
        if (existing < 0) {
            updated = functions.newWith(new FunctionEntry(function, arity, exported, cs));
        } else {
            MutableList<FunctionEntry> copy = functions.toList();
            copy.set(existing, copy.get(existing).withClauses(exported, cs));
            updated = copy.toImmutable();
        }
        return new ModuleBuilder(name, updated, imports, attributes, records);
    }

    /**
     * Adds a record declaration. Each field is an atom naming it or a record field with a default.
     */
    public ModuleBuilder withRecord(String record, Iterable<? extends Tree> fields) {
        MutableList<Tree> declared = Lists.mutable.empty();
        for (Tree field : fields) {
            if (field.type() == NodeType.ATOM) {
                declared.add(Trees.make(NodeType.RECORD_FIELD, List.of(field)));
            } else if (field.type() == NodeType.RECORD_FIELD) {
                declared.add(field);
            } else {
                throw new IllegalArgumentException("not a record field: " + field.type());
            }
        }
        Tree form = Trees.attribute("record", List.of(Trees.atom(record), Trees.tuple(declared)));
        return new ModuleBuilder(name, functions, imports, attributes, records.newWith(form));
    }

    /**
     * Adds an import of the given {@code name/arity} functions.
     */
    public ModuleBuilder withImport(String from, Iterable<String> names) {
        MutableList<Tree> qualifiers = Lists.mutable.empty();
        for (String function : names) {
            qualifiers.add(functionName(function));
        }
        Tree form = Trees.attribute("import", List.of(Trees.atom(from), Trees.list(qualifiers)));
        return new ModuleBuilder(name, functions, imports.newWith(form), attributes, records);
    }

    /**
     * Adds an attribute whose value is converted with {@link Merl#term}.
     */
    public ModuleBuilder withAttribute(String attribute, Object value) {
        Tree form = Trees.attribute(attribute, List.of(Merl.term(value)));
        return new ModuleBuilder(name, functions, imports, attributes.newWith(form), records);
    }

    /**
     * The module's forms: module and export attributes, imports, attributes, records, functions.
     */
    public ImmutableList<Tree> forms() {
        MutableList<Tree> forms = Lists.mutable.empty();
        forms.add(Trees.attribute("module", List.of(Trees.atom(name))));
        MutableList<Tree> exports = functions.select(FunctionEntry::exported)
                .collect(ModuleBuilder::exportName)
                .toList();
        forms.add(Trees.attribute("export", List.of(Trees.list(exports))));
        forms.addAllIterable(imports);
        forms.addAllIterable(attributes);
        forms.addAllIterable(records);
        for (FunctionEntry function : functions) {
            forms.add(Trees.make(NodeType.FUNCTION, List.of(Trees.atom(function.name())), function.clauses().castToList()));
        }
        return forms.toImmutable();
    }

    private static Tree exportName(FunctionEntry function) {
        return Trees.arityQualifier(Trees.atom(function.name()), Trees.integer(function.arity()));
    }

    private static Tree functionName(String spec) {
        int slash = spec.lastIndexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("expected name/arity: " + spec);
        }
        try {
            int arity = Integer.parseInt(spec.substring(slash + 1));
            return Trees.arityQualifier(Trees.atom(spec.substring(0, slash)), Trees.integer(arity));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected name/arity: " + spec, e);
        }
    }
}
