package com.jmerl.output;

import com.jmerl.syntax.NodeType;
import com.jmerl.syntax.Tree;
import com.jmerl.template.Binding;
import com.jmerl.template.Environment;
import com.jmerl.template.Tag;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Map;

/**
 * Renders the structure of trees, and the bindings of environments, for display.
 *
 * <p>A leaf is written as its type followed by its value, {@code atom(foo)}; an interior node as
 * its type followed by its groups, each group a bracketed list. Pretty output puts every member on
 * its own line and shows source positions.
 */
public class TreeFormatter {
    private static final String RESET = "\u001B[0m";
    private static final String TYPE_COLOR = "\u001B[1;34m";
    private static final String VALUE_COLOR = "\u001B[0;32m";
    private static final String POSITION_COLOR = "\u001B[0;90m";

    private final boolean prettyPrint;
    private final boolean colorOutput;
    private final SourcePrinter printer = new SourcePrinter();

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public TreeFormatter(boolean prettyPrint, boolean colorOutput) {
        this.prettyPrint = prettyPrint;
        this.colorOutput = colorOutput;
    }

    public String format(Tree tree) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        if (prettyPrint) {
            formatPretty(tree, 0, sb);
        } else {
            formatCompact(tree, sb);
        }

        return sb.toString();
    }

    /**
     * One line per binding, {@code name = source}; groups are shown as bracketed lists.
     */
    public String format(Environment env) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Tag, Binding> entry : env.bindings().castToSortedMap().entrySet()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(entry.getKey()).append(" = ");
            Binding binding = entry.getValue();
            if (binding instanceof Binding.Single single) {
                sb.append(colored(printer.print(single.tree()), VALUE_COLOR));
            } else {
                ImmutableList<Tree> trees = ((Binding.Group) binding).trees();
                sb.append('[')
                  .append(trees.collect(t -> colored(printer.print(t), VALUE_COLOR)).makeString(", "))
                  .append(']');
            }
        }
        return sb.toString();
    }

    private void formatPretty(Tree tree, int indent, StringBuilder sb) {
        String indentStr = " ".repeat(indent);

        if (tree instanceof Tree.Leaf leaf) {
            leaf(leaf, sb);
            position(tree, sb);
            return;
        }

        sb.append(colored(typeName(tree.type()), TYPE_COLOR));
        position(tree, sb);
        sb.append("(\n");

        boolean firstGroup = true;
        for (ImmutableList<Tree> group : tree.groups()) {
            if (!firstGroup) {
                sb.append(",\n");
            }
            firstGroup = false;

            sb.append(indentStr).append("  ");
            if (group.isEmpty()) {
                sb.append("[]");
                continue;
            }

            sb.append("[\n");
            boolean first = true;
            for (Tree member : group) {
                if (!first) {
                    sb.append(",\n");
                }
                first = false;

                sb.append(indentStr).append("    ");
                formatPretty(member, indent + 4, sb);
            }
            sb.append("\n").append(indentStr).append("  ]");
        }

        sb.append("\n").append(indentStr).append(")");
    }

    private void formatCompact(Tree tree, StringBuilder sb) {
        if (tree instanceof Tree.Leaf leaf) {
            leaf(leaf, sb);
            return;
        }

        sb.append(colored(typeName(tree.type()), TYPE_COLOR)).append("(");

        boolean firstGroup = true;
        for (ImmutableList<Tree> group : tree.groups()) {
            if (!firstGroup) {
                sb.append(", ");
            }
            firstGroup = false;

            sb.append("[");
            boolean first = true;
            for (Tree member : group) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;

                formatCompact(member, sb);
            }
            sb.append("]");
        }

        sb.append(")");
    }

    private void leaf(Tree.Leaf leaf, StringBuilder sb) {
        sb.append(colored(typeName(leaf.type()), TYPE_COLOR));
        if (leaf.type() != NodeType.NIL) {
            sb.append('(').append(colored(printer.print(leaf), VALUE_COLOR)).append(')');
        }
    }

    private void position(Tree tree, StringBuilder sb) {
        if (tree.attributes().position().isConcrete()) {
            sb.append(colored("@" + tree.attributes().position(), POSITION_COLOR));
        }
    }

    private String colored(String text, String color) {
        return colorOutput ? color + text + RESET : text;
    }

    private static String typeName(NodeType type) {
        return type.name().toLowerCase();
    }
}
