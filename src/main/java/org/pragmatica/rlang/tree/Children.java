package org.pragmatica.rlang.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Child list and span assembly shared by the {@link AstNode} factories.
 */
final class Children {
    private Children() {}

    /**
     * Flatten nodes, optional nodes and node lists into one ordered child list.
     */
    static List<AstNode> of(Object... parts) {
        var children = new ArrayList<AstNode>();
        for (var part : parts) {
            add(children, part);
        }
        return List.copyOf(children);
    }

    private static void add(List<AstNode> children, Object part) {
        if (part instanceof AstNode node) {
            children.add(node);
        } else if (part instanceof Optional<?> optional) {
            optional.ifPresent(value -> add(children, value));
        } else if (part instanceof List<?> list) {
            list.forEach(value -> add(children, value));
        } else if (part != null) {
            throw new IllegalArgumentException("Not a syntax node: " + part.getClass().getName());
        }
    }

    /**
     * From the start of the first child to the end of the last one.
     */
    static SourceSpan span(Object... parts) {
        var children = of(parts);
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Composite node requires at least one child");
        }
        return children.get(0).span()
                       .merge(children.get(children.size() - 1).span());
    }
}
