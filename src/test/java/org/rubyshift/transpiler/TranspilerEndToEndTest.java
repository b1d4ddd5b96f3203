package org.rubyshift.transpiler;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rubyshift.transpiler.api.TranspilationResult;

/**
 * Runs whole programs spread over several files through parse, filters and printer.
 */
@Tag("integration")
class TranspilerEndToEndTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("A module reopened across inlined files is merged into one definition")
    void mergesModuleSpreadOverInlinedFiles() throws Exception {
        Path main = write("main.rb", """
                (send nil :require (str "foo_a"))
                (send nil :require (str "foo_b"))
                """);
        write("foo_a.rb", "(module (const nil :Foo) (def :a (args) nil))\n");
        write("foo_b.rb", "(module (const nil :Foo) (begin (cvasgn :@@count (int 0)) (def :b (args) nil)))\n");
        TranspilerOptions options = TranspilerOptions.defaults().withFilters(List.of("require", "combiner", "pragma"));

        TranspilationResult result = new Transpiler(options).transpileFile(main);

        assertThat(result.output()).isEqualTo(
                "(module (const nil :Foo) (begin (cvasgn :@@count (int 0)) (def :a (args) nil) (def :b (args) nil)))\n");
        assertThat(result.timestamps()).hasSize(3);
    }

    @Test
    @DisplayName("Pragmas apply per file and line")
    void pragmasApplyPerFile() throws Exception {
        Path main = write("main.rb", """
                (send (lvar :a) :<< (int 1)) # Pragma: array
                (send nil :require (str "lib"))
                """);
        write("lib.rb", """
                (send (lvar :s) :<< (str "x"))
                (send (lvar :t) :<< (str "y")) # Pragma: string
                """);

        String output = new Transpiler(TranspilerOptions.defaults()).transpileFile(main).output();

        assertThat(output).isEqualTo("""
                (send (lvar :a) :push (int 1))
                (send (lvar :s) :<< (str "x"))
                (op_asgn (lvar :t) :+ (str "y"))
                """);
    }

    @Test
    @DisplayName("Files requiring each other are each emitted once")
    void cyclicRequires() throws Exception {
        Path a = write("a.rb", """
                (send nil :require (str "b"))
                (def :from_a (args) nil)
                """);
        write("b.rb", """
                (send nil :require (str "a"))
                (send nil :require (str "c"))
                (def :from_b (args) nil)
                """);
        write("c.rb", """
                (send nil :require (str "b"))
                (def :from_c (args) nil)
                """);

        String output = new Transpiler(TranspilerOptions.defaults()).transpileFile(a).output();

        assertThat(output).isEqualTo("""
                (def :from_c (args) nil)
                (def :from_b (args) nil)
                (def :from_a (args) nil)
                """);
    }

    @Test
    @DisplayName("Combiner ordering and reopened classes across a nested directory")
    void reopenedClassInNestedDirectory() throws Exception {
        Path main = write("app/main.rb", """
                # the widget
                (class (const nil :Widget) nil (def :render (args) nil))
                (send nil :require (str "ext/widget_ext"))
                """);
        write("app/ext/widget_ext.rb", """
                (send nil :require_relative (str "helpers"))
                (class (const nil :Widget) (const nil :Base) (def :size (args) (send nil :helper)))
                """);
        write("app/ext/helpers.rb", "(def :helper (args) (int 42))\n");
        TranspilerOptions options = TranspilerOptions.defaults()
                .withFilters(List.of("combiner", "require"))
                .withIncludeComments(true);

        String output = new Transpiler(options).transpileFile(main).output();

        assertThat(output).isEqualTo("""
                # the widget
                (class (const nil :Widget) (const nil :Base) (begin (def :render (args) nil) (def :size (args) (send nil :helper))))
                (def :helper (args) (int 42))
                """);
    }
}
