package org.rubyshift.transpiler.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.rubyshift.transpiler.annotation.Comment;
import org.rubyshift.transpiler.api.SourceLocation;
import org.rubyshift.transpiler.ast.Atom;
import org.rubyshift.transpiler.ast.Node;

@Tag("unit")
class SexpParserTest {

    private final SexpParser parser = new SexpParser();

    private Node parse(String source) {
        return parser.parse(source, "test.rb").root();
    }

    @Test
    void readsScalarChildren() {
        Node node = parse("(send (lvar :a) :foo (int 1) (float 2.5) (str \"a\\\"b\") nil true)");

        assertThat(node.tag()).isEqualTo("send");
        assertThat(node.childNode(0)).isEqualTo(Node.of("lvar", Atom.of("a")));
        assertThat(node.child(1)).isEqualTo(Atom.of("foo"));
        assertThat(node.childNode(2).child(0)).isEqualTo(1L);
        assertThat(node.childNode(3).child(0)).isEqualTo(2.5);
        assertThat(node.childNode(4).child(0)).isEqualTo("a\"b");
        assertThat(node.child(5)).isNull();
        assertThat(node.child(6)).isEqualTo(Boolean.TRUE);
    }

    @Test
    void readsSignedNumbersAndQuotedAtoms() {
        Node node = parse("(args (int -3) (float 1e3) (sym :\"two words\") (sym :<<))");

        assertThat(node.childNode(0).child(0)).isEqualTo(-3L);
        assertThat(node.childNode(1).child(0)).isEqualTo(1000.0);
        assertThat(node.childNode(2).child(0)).isEqualTo(Atom.of("two words"));
        assertThat(node.childNode(3).child(0)).isEqualTo(Atom.of("<<"));
        assertThat(node.toSexp()).isEqualTo("(args (int -3) (float 1000.0) (sym :\"two words\") (sym :<<))");
    }

    @Test
    void readsListChildren() {
        Node node = parse("(import \"./a.rb\" [(const nil :A), (const nil :B)])");

        assertThat(node.child(1)).isEqualTo(List.of(
                Node.of("const", null, Atom.of("A")),
                Node.of("const", null, Atom.of("B"))));
    }

    @Test
    void locatesNodesAtTheirOpeningParenthesis() {
        Node root = parse("(def :a (args)\n  (send nil :puts))");

        assertThat(root.location()).isEqualTo(new SourceLocation("test.rb", 1, 1));
        assertThat(root.childNode(1).location()).isEqualTo(new SourceLocation("test.rb", 1, 9));
        assertThat(root.childNode(2).location()).isEqualTo(new SourceLocation("test.rb", 2, 3));
    }

    @Test
    void wrapsSeveralStatementsInAnUnlocatedBegin() {
        Node root = parse("(int 1)\n(int 2)");

        assertThat(root.tag()).isEqualTo("begin");
        assertThat(root.hasLocation()).isFalse();
        assertThat(root.childCount()).isEqualTo(2);
    }

    @Test
    void emptySourceHasNoTree() {
        ParseResult result = parser.parse("# only a comment\n", "test.rb");

        assertThat(result.root()).isNull();
        assertThat(result.comments()).hasSize(1);
    }

    @Test
    void collectsCommentsWithTheirPlacement() {
        List<Comment> comments = parser.parse("# above\n(int 1) # trailing\n", "test.rb").comments();

        assertThat(comments).extracting(Comment::text).containsExactly("# above", "# trailing");
        assertThat(comments).extracting(Comment::ownLine).containsExactly(true, false);
        assertThat(comments.get(1).location()).isEqualTo(new SourceLocation("test.rb", 2, 9));
    }

    @Test
    void reportsUnclosedNodeAtItsStart() {
        assertThatThrownBy(() -> parse("\n  (send nil :foo"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("Unclosed '(send'")
                .satisfies(e -> assertThat(((SourceParseException) e).getLocation())
                        .isEqualTo(new SourceLocation("test.rb", 2, 3)));
    }

    @Test
    void rejectsMalformedInput() {
        assertThatThrownBy(() -> parse("(1 2)")).hasMessageContaining("Expected a tag");
        assertThatThrownBy(() -> parse(":a")).hasMessageContaining("Expected a node at top level");
        assertThatThrownBy(() -> parse("(str \"open")).hasMessageContaining("Unterminated string");
        assertThatThrownBy(() -> parse("(int 1))")).hasMessageContaining("Unexpected ')'");
    }
}
