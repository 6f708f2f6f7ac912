package org.pragmatica.rlang.error;

import org.pragmatica.rlang.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Entry of the diagnostic sink.
 *
 * <p>Rendered by {@link #format(String, String)} as:
 * <pre>
 * error[R002]: ')' expected
 *  --> script.R:1:6
 *   |
 * 1 | f(1, 2
 *   |  - opened here
 *   |      ^ expected ')' after this
 *   |
 * </pre>
 *
 * @param severity Severity level
 * @param kind     Stable message kind
 * @param message  Human-readable message
 * @param span     Range the diagnostic is reported at
 * @param label    Text shown under {@code span}, may be empty
 * @param related  Other ranges that explain the diagnostic, such as an unclosed opening delimiter
 * @param help     Suggestion shown after the snippet
 */
public record Diagnostic(
    Severity severity,
    ErrorKind kind,
    String message,
    SourceSpan span,
    String label,
    List<Related> related,
    Optional<String> help
) {
    /**
     * Parser failures are errors. The remaining levels are for consumers layering
     * non-fatal advisories over the parse.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * Secondary range, underlined with {@code -}.
     */
    public record Related(SourceSpan span, String label) {}

    public Diagnostic {
        related = List.copyOf(related);
    }

    public static Diagnostic error(ErrorKind kind, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, kind, message, span, "", List.of(), Optional.empty());
    }

    public String code() {
        return kind.code();
    }

    public Diagnostic withLabel(String text) {
        return new Diagnostic(severity, kind, message, span, text, related, help);
    }

    public Diagnostic withRelated(SourceSpan relatedSpan, String text) {
        var all = new ArrayList<>(related);
        all.add(new Related(relatedSpan, text));
        return new Diagnostic(severity, kind, message, span, label, all, help);
    }

    public Diagnostic withHelp(String text) {
        return new Diagnostic(severity, kind, message, span, label, related, Optional.of(text));
    }

    // === Rendering ===

    /**
     * Multi-line rendering with the affected source lines and their underlines.
     *
     * @param source   Text the spans refer to
     * @param filename Name shown in the location line, omitted when {@code null}
     */
    public String format(String source, String filename) {
        var sourceLines = source.split("\n", -1);
        var marks = marks();
        int firstLine = marks.get(0).span().start().line();
        int lastLine = marks.stream()
                            .mapToInt(mark -> mark.span().end().line())
                            .max()
                            .orElse(firstLine);
        int width = String.valueOf(lastLine).length();
        var margin = " ".repeat(width);

        var out = new StringBuilder();
        out.append(severity.display()).append('[').append(code()).append("]: ").append(message).append('\n');
        out.append(margin).append("--> ");
        if (filename != null) {
            out.append(filename).append(':');
        }
        out.append(span.start().line()).append(':').append(span.start().column()).append('\n');
        out.append(margin).append(" |\n");

        for (int line = firstLine; line <= Math.min(lastLine, sourceLines.length); line++) {
            var text = stripCarriageReturn(sourceLines[line - 1]);
            out.append(String.format("%" + width + "d", line)).append(" | ").append(text).append('\n');
            for (var mark : marks) {
                if (mark.covers(line)) {
                    out.append(margin).append(" | ").append(mark.underline(line, text)).append('\n');
                }
            }
        }

        out.append(margin).append(" |\n");
        help.ifPresent(text -> out.append(margin).append(" = help: ").append(text).append('\n'));
        return out.toString();
    }

    /**
     * Single-line rendering: {@code file:line:column: severity[code]: message}.
     */
    public String formatSimple(String filename) {
        var start = span.start();
        return String.format("%s:%d:%d: %s[%s]: %s",
                             filename, start.line(), start.column(), severity.display(), code(), message);
    }

    // In source order
    private List<Mark> marks() {
        var marks = new ArrayList<Mark>();
        marks.add(new Mark(span, label, '^'));
        related.forEach(r -> marks.add(new Mark(r.span(), r.label(), '-')));
        marks.sort(Comparator.comparingInt((Mark mark) -> mark.span().start().line())
                             .thenComparingInt(mark -> mark.span().start().column()));
        return marks;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private record Mark(SourceSpan span, String text, char symbol) {
        boolean covers(int line) {
            return span.start().line() <= line && line <= span.end().line();
        }

        String underline(int line, String lineText) {
            int from = span.start().line() == line ? span.start().column() : 1;
            int to = span.end().line() == line ? span.end().column() : lineText.length() + 1;
            var row = " ".repeat(from - 1) + String.valueOf(symbol).repeat(Math.max(1, to - from));
            return text.isEmpty() ? row : row + " " + text;
        }
    }

    @Override
    public String toString() {
        return severity.display() + " " + kind + " " + span + ": " + message;
    }
}
