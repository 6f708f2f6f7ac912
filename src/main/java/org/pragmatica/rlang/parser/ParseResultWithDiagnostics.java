package org.pragmatica.rlang.parser;

import org.pragmatica.rlang.error.Diagnostic;
import org.pragmatica.rlang.error.ErrorKind;
import org.pragmatica.rlang.tree.AstRoot;

import java.util.List;

/**
 * Result of parsing a unit - the tree and the diagnostics accumulated while building it.
 *
 * <p>A tree is always present. When the input is malformed it holds the statements that
 * parsed, partial constructs, and {@code ErrorStatement} nodes for the regions skipped by
 * recovery; {@code diagnostics} lists the errors in source order.
 *
 * @param root        The parsed tree
 * @param diagnostics Accumulated diagnostic messages (empty on full success)
 * @param source      The original source text (for formatting diagnostics)
 */
public record ParseResultWithDiagnostics(
    AstRoot root,
    List<Diagnostic> diagnostics,
    String source
) {
    public static ParseResultWithDiagnostics of(AstRoot root, List<Diagnostic> diagnostics, String source) {
        return new ParseResultWithDiagnostics(root, List.copyOf(diagnostics), source);
    }

    /**
     * Check if parsing succeeded without any errors.
     */
    public boolean isSuccess() {
        return errorCount() == 0;
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    public List<Diagnostic> diagnosticsOfKind(ErrorKind kind) {
        return diagnostics.stream()
            .filter(d -> d.kind() == kind)
            .toList();
    }

    /**
     * Format all diagnostics in Rust style.
     *
     * @param filename Optional filename for display
     * @return Formatted diagnostics string
     */
    public String formatDiagnostics(String filename) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }

    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }

    public int errorCount() {
        return (int) diagnostics.stream()
            .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
            .count();
    }
}
