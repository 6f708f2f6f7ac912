package org.pragmatica.rlang.tree;

/**
 * Indented text dump of a tree, one node per line.
 *
 * <pre>
 * GlobalScope [0...18)
 *     Conditional [0...18) lineBreakSensitive
 *         Terminal if [0...2)
 * </pre>
 */
public final class AstWriter {
    private static final String INDENT = "    ";

    private AstWriter() {}

    public static String write(AstNode node) {
        var sb = new StringBuilder();
        write(node, 0, sb);
        return sb.toString();
    }

    private static void write(AstNode node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth))
          .append(node.kind().display());
        if (node instanceof AstNode.Terminal terminal) {
            sb.append(' ').append(terminal.text());
        }
        sb.append(' ').append(node.span());
        if (node instanceof AstNode.Conditional conditional) {
            if (conditional.inline()) {
                sb.append(" inline");
            }
            if (conditional.lineBreakSensitive()) {
                sb.append(" lineBreakSensitive");
            }
        }
        sb.append('\n');
        for (var child : node.children()) {
            write(child, depth + 1, sb);
        }
    }
}
