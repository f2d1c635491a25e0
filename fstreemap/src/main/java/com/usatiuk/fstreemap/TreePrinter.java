package com.usatiuk.fstreemap;

import org.apache.commons.lang3.StringUtils;

import java.io.PrintStream;

/**
 * Renders a tree one node per line, indented by depth.
 * Directories are shown by name, files as {@code name: value}.
 */
public class TreePrinter {
    private final int _indent;

    public TreePrinter(int indent) {
        if (indent < 0)
            throw new IllegalArgumentException("Negative indent: " + indent);
        _indent = indent;
    }

    public <V> String render(FsTreeMap<V> tree) {
        var sb = new StringBuilder();
        renderImpl(tree.root(), 0, sb);
        return sb.toString();
    }

    public <V> void print(FsTreeMap<V> tree, PrintStream out) {
        out.print(render(tree));
        out.flush();
    }

    private <V> void renderImpl(Node<V> node, int depth, StringBuilder sb) {
        sb.append(StringUtils.repeat(' ', depth * _indent));
        if (node instanceof File<V> file) {
            sb.append(file.name()).append(": ").append(file.value()).append('\n');
            return;
        }
        sb.append(node.name()).append('\n');
        for (var child : ((Directory<V>) node).children())
            renderImpl(child, depth + 1, sb);
    }
}
