package org.pragmatica.rlang.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.rlang.RParser;
import org.pragmatica.rlang.token.RTokenizer;
import org.pragmatica.rlang.tree.AstNode.Conditional;
import org.pragmatica.rlang.tree.AstNode.Terminal;
import org.pragmatica.rlang.tree.AstNode.Variable;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for tree queries, parent lookup and span invariants.
 */
class AstRootTest {

    private static final String SOURCE = """
        total <- 0
        for (i in seq_len(n)) {
            if (i %% 2 == 0) total <- total + i else next
        }
        result <- list(total = total, mean = total / n)
        """;

    @Test
    void parentOf_followsOwnership() {
        var root = RParser.parse(SOURCE).root();

        var conditional = root.nodesOfKind(NodeKind.CONDITIONAL).get(0);
        var parent = root.parentOf(conditional).orElseThrow();

        assertThat(parent.kind()).isEqualTo(NodeKind.BLOCK_SCOPE);
        assertThat(root.parentOf(root.scope())).isEmpty();
    }

    @Test
    void nodeAt_returnsInnermostNodeOfKind() {
        var root = RParser.parse(SOURCE).root();
        int offset = SOURCE.indexOf("total + i");

        var conditional = root.nodeAt(offset, Conditional.class);
        assertThat(conditional).isPresent();
        assertThat(conditional.get().elseClause()).isPresent();

        var binary = root.nodeAt(offset, NodeKind.BINARY).orElseThrow();
        assertThat(binary.span().extract(SOURCE)).isEqualTo("total + i");
    }

    @Test
    void nodeAt_outsideAnyNodeOfKind_isEmpty() {
        var root = RParser.parse(SOURCE).root();

        assertThat(root.nodeAt(0, NodeKind.CONDITIONAL)).isEmpty();
        assertThat(root.deepestNodeAt(0)).isInstanceOf(Terminal.class);
    }

    @Test
    void deepestNodeAt_findsToken() {
        var root = RParser.parse(SOURCE).root();
        int offset = SOURCE.indexOf("seq_len") + 2;

        var node = (Terminal) root.deepestNodeAt(offset);
        assertThat(node.text()).isEqualTo("seq_len");
        assertThat(root.parentOf(node).orElseThrow()).isInstanceOf(Variable.class);
    }

    @Test
    void everyChild_liesWithinItsParent_inSourceOrder() {
        var root = RParser.parse(SOURCE).root();

        root.stream().forEach(node -> {
            SourceSpan previous = null;
            for (var child : node.children()) {
                assertThat(node.span().contains(child.span()))
                    .as("%s inside %s", child.kind(), node.kind())
                    .isTrue();
                if (previous != null) {
                    assertThat(previous.endOffset()).isLessThanOrEqualTo(child.span().startOffset());
                }
                previous = child.span();
            }
        });
    }

    @Test
    void validInput_coversEveryTokenExactlyOnce() {
        var root = RParser.parse(SOURCE).root();
        var tokens = RTokenizer.tokenize(SOURCE);

        List<AstNode> terminals = root.nodesOfKind(NodeKind.TERMINAL);
        assertThat(terminals).hasSize(tokens.size() - 1);
        for (int i = 0; i < terminals.size(); i++) {
            assertThat(((Terminal) terminals.get(i)).token()).isEqualTo(tokens.get(i));
        }
    }

    @Test
    void writer_rendersIndentedTree() {
        var root = RParser.parse("if (a) b").root();

        assertThat(root.toString()).isEqualTo("""
            GlobalScope [0...8)
                Conditional [0...8) lineBreakSensitive
                    Terminal if [0...2)
                    Terminal ( [3...4)
                    Variable [4...5)
                        Terminal a [4...5)
                    Terminal ) [5...6)
                    InlineScope [7...8)
                        ExpressionStatement [7...8)
                            Variable [7...8)
                                Terminal b [7...8)
            """);
    }
}
