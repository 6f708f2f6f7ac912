package org.pragmatica.rlang.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Root of a parsed unit: the global scope plus a child-to-parent index.
 * The index is a lookup aid only; nodes never reference their parents.
 */
public final class AstRoot {

    private final AstNode.GlobalScope scope;
    private final Map<AstNode, AstNode> parents;

    private AstRoot(AstNode.GlobalScope scope, Map<AstNode, AstNode> parents) {
        this.scope = scope;
        this.parents = parents;
    }

    public static AstRoot of(AstNode.GlobalScope scope) {
        var parents = new IdentityHashMap<AstNode, AstNode>();
        var pending = new ArrayDeque<AstNode>();
        pending.push(scope);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            for (var child : node.children()) {
                parents.put(child, node);
                pending.push(child);
            }
        }
        return new AstRoot(scope, parents);
    }

    public AstNode.GlobalScope scope() {
        return scope;
    }

    public List<AstNode.Statement> statements() {
        return scope.statements();
    }

    /**
     * Non-owning parent lookup. Empty for the global scope and for nodes of other trees.
     */
    public Optional<AstNode> parentOf(AstNode node) {
        return Optional.ofNullable(parents.get(node));
    }

    /**
     * Innermost node of the given kind whose span contains {@code offset}.
     */
    public Optional<AstNode> nodeAt(int offset, NodeKind kind) {
        AstNode found = null;
        AstNode current = scope;
        while (current != null) {
            if (current.kind() == kind) {
                found = current;
            }
            current = childContaining(current, offset);
        }
        return Optional.ofNullable(found);
    }

    /**
     * Typed variant of {@link #nodeAt(int, NodeKind)}.
     */
    public <T extends AstNode> Optional<T> nodeAt(int offset, Class<T> type) {
        T found = null;
        AstNode current = scope;
        while (current != null) {
            if (type.isInstance(current)) {
                found = type.cast(current);
            }
            current = childContaining(current, offset);
        }
        return Optional.ofNullable(found);
    }

    /**
     * Innermost node of any kind whose span contains {@code offset}.
     */
    public AstNode deepestNodeAt(int offset) {
        AstNode result = scope;
        var next = childContaining(scope, offset);
        while (next != null) {
            result = next;
            next = childContaining(next, offset);
        }
        return result;
    }

    /**
     * Pre-order walk of the whole tree, starting with the global scope.
     */
    public Stream<AstNode> stream() {
        var nodes = new ArrayList<AstNode>();
        collect(scope, nodes);
        return nodes.stream();
    }

    /**
     * All nodes of the given kind in source order.
     */
    public List<AstNode> nodesOfKind(NodeKind kind) {
        return stream().filter(node -> node.kind() == kind)
                       .toList();
    }

    private static void collect(AstNode node, List<AstNode> nodes) {
        nodes.add(node);
        for (var child : node.children()) {
            collect(child, nodes);
        }
    }

    private static AstNode childContaining(AstNode node, int offset) {
        for (var child : node.children()) {
            if (child.span().contains(offset)) {
                return child;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return AstWriter.write(scope);
    }
}
