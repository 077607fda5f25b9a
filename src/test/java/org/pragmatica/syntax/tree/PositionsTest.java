package org.pragmatica.syntax.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.syntax.error.MalformedTreeException;
import org.pragmatica.syntax.error.TreeError;
import org.pragmatica.syntax.sample.BinaryExpression;
import org.pragmatica.syntax.sample.ExpressionStatement;
import org.pragmatica.syntax.sample.NameExpression;
import org.pragmatica.syntax.sample.NumberLiteral;
import org.pragmatica.syntax.sample.ParenthesizedExpression;
import org.pragmatica.syntax.sample.SampleParser;
import org.pragmatica.syntax.sample.SampleSourceFile;
import org.pragmatica.syntax.sample.SampleTokenKind;
import org.pragmatica.syntax.sample.SampleTrees;
import org.pragmatica.syntax.sample.StatementList;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PositionsTest {
    private static final List<String> SOURCES = List.of("a + (b - 1);\n// tail\nc;",
                                                        "  x = 1 ;  \n",
                                                        "((1))",
                                                        "// only a comment\n",
                                                        "",
                                                        "a\n\n  b;c = (d * (e + f)) - 7 // trailing");

    // === Two-token file ===

    @Test
    void twoTokenFile_widthUsesTrimmedFirstAndFullRest() {
        var file = SampleTrees.twoTokenFile();

        assertThat(file.width()).isEqualTo(12);
        assertThat(file.fullWidth()).isEqualTo(14);
        assertThat(file.start()).isEqualTo(2);
        assertThat(file.fullStart()).isZero();
    }

    @Test
    void twoTokenFile_statementListEndsAtEndOfFileToken() {
        var file = SampleTrees.twoTokenFile();
        var statements = (StatementList) file.statementList().get(0);

        assertThat(statements.endPosition()).isEqualTo(14);
        assertThat(file.endPosition()).isEqualTo(14);
    }

    // === Start and width ===

    @Test
    void start_matchesFirstDescendantToken_forEveryNode() {
        for (var node : allNodes()) {
            var first = node.descendantTokens()
                            .first()
                            .get();

            assertThat(node.start()).as("start of %s", node.variantName()).isEqualTo(first.start());
            assertThat(node.fullStart()).as("fullStart of %s", node.variantName()).isEqualTo(first.fullStart());
            assertThat(Positions.firstToken(node)).isEqualTo(first);
        }
    }

    @Test
    void fullWidth_isWidthPlusLeadingTrivia_forEveryNode() {
        for (var node : allNodes()) {
            assertThat(node.fullWidth()).as("fullWidth of %s", node.variantName())
                                        .isEqualTo(node.width() + Positions.firstToken(node).triviaLength());
        }
    }

    @Test
    void fullWidth_coversNodeUpToItsLastToken() {
        for (var node : allNodes()) {
            var last = node.descendantTokens()
                           .last()
                           .get();

            assertThat(node.fullStart() + node.fullWidth()).isEqualTo(last.end());
        }
    }

    @Test
    void width_countsTriviaBetweenChildren() {
        var statement = SampleParser.parse("x  =  1;")
                                    .statementList()
                                    .get(0);

        assertThat(statement.width()).isEqualTo("x  =  1;".length());
    }

    // === End position ===

    @Test
    void endPosition_ofEarlierSibling_isFullStartOfNextSibling() {
        for (var node : allNodes()) {
            var children = node.childNodes().toList();
            for (int i = 0; i + 1 < children.size(); i++) {
                assertThat(children.get(i).endPosition()).isEqualTo(children.get(i + 1).fullStart());
            }
        }
    }

    @Test
    void endPosition_ofLastChild_isEndOfParentRegion() {
        for (var node : allNodes()) {
            var last = node.childNodes()
                           .last();
            if (!last.isPresent()) {
                continue;
            }
            var expected = node instanceof SourceFileNode file
                           ? file.endOfFileToken().fullStart()
                           : node.endPosition();
            assertThat(last.get().endPosition()).as("end of last child of %s", node.variantName())
                                                .isEqualTo(expected);
        }
    }

    @Test
    void endPosition_concreteOffsets() {
        var file = SampleParser.parse("a + (b - 1);\n// tail\nc;");
        var first = (ExpressionStatement) file.statementList().get(0);
        var second = (ExpressionStatement) file.statementList().get(1);
        var sum = (BinaryExpression) first.expression();
        var paren = (ParenthesizedExpression) sum.rightOperand();
        var difference = (BinaryExpression) paren.expression();

        assertThat(first.endPosition()).isEqualTo(12);
        assertThat(second.endPosition()).isEqualTo(23);
        assertThat(sum.leftOperand().endPosition()).isEqualTo(3);
        assertThat(paren.endPosition()).isEqualTo(12);
        assertThat(difference.leftOperand().endPosition()).isEqualTo(8);
        assertThat(file.endPosition()).isEqualTo(23);
    }

    @Test
    void endPosition_ofRoot_includesEndOfFileTrivia() {
        var file = SampleParser.parse("a;   ");

        assertThat(file.endPosition()).isEqualTo(5);
        assertThat(file.statementList().get(0)).isInstanceOfSatisfying(Node.class,
                                                                      node -> assertThat(node.endPosition()).isEqualTo(2));
    }

    // === Malformed trees ===

    @Test
    void endPosition_ofDetachedNode_fails() {
        var name = new NameExpression(Token.of(SampleTokenKind.NAME, 0, 0, 1));

        assertThatThrownBy(name::endPosition)
            .isInstanceOfSatisfying(MalformedTreeException.class,
                                    e -> assertThat(e.error()).isEqualTo(new TreeError.DetachedNode("NameExpression")));
    }

    @Test
    void endPosition_ofSubtreeWithoutSourceFile_fails() {
        var right = new NumberLiteral(Token.of(SampleTokenKind.NUMBER, 3, 4, 2));
        new BinaryExpression(new NameExpression(Token.of(SampleTokenKind.NAME, 0, 0, 1)),
                             Token.of(SampleTokenKind.PLUS, 1, 2, 2),
                             right);

        assertThatThrownBy(right::endPosition).isInstanceOf(MalformedTreeException.class)
                                              .hasMessageContaining("BinaryExpression");
    }

    @Test
    void start_ofNodeWithoutChildren_fails() {
        var empty = new ExpressionStatement(null, null);

        assertThat(empty.width()).isZero();
        assertThat(empty.fullWidth()).isZero();
        assertThatThrownBy(empty::start)
            .isInstanceOfSatisfying(MalformedTreeException.class,
                                    e -> assertThat(e.error()).isInstanceOf(TreeError.EmptyNode.class));
    }

    private static List<Node> allNodes() {
        var nodes = new ArrayList<Node>();
        for (var source : SOURCES) {
            SampleSourceFile file = SampleParser.parse(source);
            nodes.add(file);
            file.descendantNodes()
                .forEach(nodes::add);
        }
        nodes.add(SampleTrees.twoTokenFile());
        return nodes;
    }
}
