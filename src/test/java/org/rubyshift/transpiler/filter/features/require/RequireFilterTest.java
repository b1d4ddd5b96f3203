package org.rubyshift.transpiler.filter.features.require;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rubyshift.transpiler.Transpiler;
import org.rubyshift.transpiler.TranspilerOptions;
import org.rubyshift.transpiler.TranspilerOptions.Autoexports;
import org.rubyshift.transpiler.api.CompilationException;
import org.rubyshift.transpiler.api.TranspilationResult;
import org.rubyshift.transpiler.parser.SexpParser;

@Tag("unit")
class RequireFilterTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private TranspilationResult transpile(Path file) throws CompilationException {
        return transpile(TranspilerOptions.defaults(), file);
    }

    private TranspilationResult transpile(TranspilerOptions options, Path file) throws CompilationException {
        return new Transpiler(options).transpileFile(file);
    }

    @Test
    void inlinesRequiredFile() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"lib\"))\n(int 2)\n");
        write("lib.rb", "(int 1)\n");

        assertThat(transpile(main).output()).isEqualTo("(int 1)\n(int 2)\n");
    }

    @Test
    void inlinesEachFileOnce() throws Exception {
        Path main = write("main.rb", """
                (send nil :require (str "lib"))
                (send nil :require_relative (str "./lib.rb"))
                (int 2)
                """);
        write("lib.rb", "(int 1)\n");

        assertThat(transpile(main).output()).isEqualTo("(int 1)\n(int 2)\n");
    }

    @Test
    void triesExtensionsInOrder() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"lib\"))\n(send nil :require (str \"view\"))\n");
        write("lib.rb", "(int 1)\n");
        write("lib.js.rb", "(int 9)\n");
        write("view.js.rb", "(int 2)\n");

        assertThat(transpile(main).output()).isEqualTo("(int 1)\n(int 2)\n");
    }

    @Test
    void requireUsedAsValueIsLeftAlone() throws Exception {
        Path main = write("main.rb", """
                (lvasgn :x (send nil :require (str "missing")))
                (send nil :puts (send nil :require (str "missing")))
                """);

        assertThat(transpile(main).output()).isEqualTo(
                "(lvasgn :x (send nil :require (str \"missing\")))\n"
                        + "(send nil :puts (send nil :require (str \"missing\")))\n");
    }

    @Test
    void missingFileFailsWithLocation() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"missing\"))\n");

        assertThatThrownBy(() -> transpile(main))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("main.rb:1:")
                .hasMessageContaining("'missing'")
                .hasCauseInstanceOf(UnresolvedRequireException.class);
    }

    @Test
    void requiresWithoutFileAreNotInlined() throws Exception {
        String output = new Transpiler(TranspilerOptions.defaults())
                .transpile("(send nil :require (str \"lib\"))", "input.rb")
                .output();

        assertThat(output).isEqualTo("(send nil :require (str \"lib\"))\n");
    }

    @Test
    void cyclicRequiresInlineEachFileOnce() throws Exception {
        Path a = write("a.rb", "(send nil :require (str \"b\"))\n(int 1)\n");
        write("b.rb", "(send nil :require_relative (str \"a\"))\n(int 2)\n");

        assertThat(transpile(a).output()).isEqualTo("(int 2)\n(int 1)\n");
    }

    @Test
    void nestedRequiresResolveAgainstTheInlinedFilesDirectory() throws Exception {
        Path main = write("main.rb", """
                (send nil :require (str "sub/a"))
                (send nil :require (str "c"))
                """);
        write("sub/a.rb", """
                (send nil :require_relative (str "b"))
                (send nil :require (str "c"))
                """);
        write("sub/b.rb", "(int 1)\n");
        write("sub/c.rb", "(int 2)\n");
        write("c.rb", "(int 3)\n");

        assertThat(transpile(main).output()).isEqualTo("(int 1)\n(int 2)\n(int 3)\n");
    }

    @Test
    void recordsTimestampsOfAllFiles() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"lib\"))\n");
        Path lib = write("lib.rb", "(int 1)\n");

        TranspilationResult result = transpile(main);

        assertThat(result.timestamps()).hasSize(2);
        assertThat(result.timestamps().get(lib.toRealPath().toString().replace('\\', '/')))
                .isEqualTo(Files.getLastModifiedTime(lib));
    }

    @Test
    void keepsCommentsOfInlinedFiles() throws Exception {
        Path main = write("main.rb", "# leading\n(int 0)\n(send nil :require (str \"lib\"))\n");
        write("lib.rb", "# from lib\n(int 1)\n");

        String output = transpile(TranspilerOptions.defaults().withIncludeComments(true), main).output();

        assertThat(output).isEqualTo("# leading\n(int 0)\n# from lib\n(int 1)\n");
    }

    @Test
    void exportsBecomeImportsWhenModulesAreEnabled() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"lib\"))\n(int 2)\n");
        write("lib.rb", "(send nil :export (class (const nil :Widget) nil nil))\n");

        String output = transpile(TranspilerOptions.defaults().withModules(true), main).output();

        assertThat(output).isEqualTo("(import \"./lib.rb\" [(const nil :Widget)])\n(int 2)\n");
    }

    @Test
    void exportsAreInlinedWithoutModules() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"lib\"))\n(int 2)\n");
        write("lib.rb", "(send nil :export (class (const nil :Widget) nil nil))\n");

        assertThat(transpile(main).output())
                .isEqualTo("(send nil :export (class (const nil :Widget) nil nil))\n(int 2)\n");
    }

    @Test
    void explicitDefaultExport() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"lib\"))\n");
        write("lib.rb", "(send nil :export (send nil :default (module (const nil :Api) nil)))\n");

        String output = transpile(TranspilerOptions.defaults().withModules(true), main).output();

        assertThat(output).isEqualTo("(import \"./lib.rb\" (const nil :Api))\n");
    }

    @Test
    void singleAutoexportBecomesDefault() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"lib\"))\n");
        write("lib.rb", "(class (const nil :Widget) nil nil)\n");

        String output = transpile(TranspilerOptions.defaults()
                .withModules(true)
                .withAutoexports(Autoexports.DEFAULT), main).output();

        assertThat(output).isEqualTo("(import \"./lib.rb\" (const nil :Widget))\n");
    }

    @Test
    void autoexportsNameEveryDeclaration() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"sub/lib\"))\n");
        write("sub/lib.rb", """
                (class (const nil :A) nil nil)
                (casgn nil :LIMIT (int 3))
                (def :helper (args) nil)
                (send nil :puts (str "side effect"))
                """);

        String output = transpile(TranspilerOptions.defaults()
                .withModules(true)
                .withAutoexports(Autoexports.ON), main).output();

        assertThat(output).isEqualTo(
                "(import \"./sub/lib.rb\" [(const nil :A) (const nil :LIMIT) (const nil :helper)])\n");
    }

    @Test
    void disabledAutoimportsDropTheImports() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"lib\"))\n(int 2)\n");
        write("lib.rb", "(send nil :export (class (const nil :Widget) nil nil))\n");

        String output = transpile(TranspilerOptions.defaults()
                .withModules(true)
                .withDisableAutoimports(true), main).output();

        assertThat(output).isEqualTo("(int 2)\n");
    }

    @Test
    void nestedImportsAreOnlyKeptWhenRecursive() throws Exception {
        Path main = write("main.rb", "(send nil :require (str \"lib\"))\n(int 2)\n");
        write("lib.rb", """
                (send nil :require (str "other"))
                (send nil :export (class (const nil :A) nil nil))
                """);
        write("other.rb", "(send nil :export (class (const nil :B) nil nil))\n");
        TranspilerOptions modules = TranspilerOptions.defaults().withModules(true);

        String flat = transpile(modules, main).output();
        String recursive = transpile(modules.withRequireRecursive(true), main).output();

        assertThat(flat).isEqualTo("(import \"./lib.rb\" [(const nil :A)])\n(int 2)\n");
        assertThat(recursive).isEqualTo("(import \"./lib.rb\" [(const nil :A)])\n"
                + "(import \"./other.rb\" [(const nil :B)])\n(int 2)\n");
    }

    @Test
    void repeatedRequireQueuesTheImportAgain() throws Exception {
        Path main = write("main.rb", """
                (send nil :require (str "b"))
                (send nil :require (str "a"))
                (send (const nil :A) :go)
                """);
        write("b.rb", """
                (send nil :require (str "a"))
                (send nil :export (class (const nil :B) nil nil))
                """);
        write("a.rb", "(send nil :export (class (const nil :A) nil nil))\n");

        String output = transpile(TranspilerOptions.defaults().withModules(true), main).output();

        assertThat(output).isEqualTo("(import \"./b.rb\" [(const nil :B)])\n"
                + "(import \"./a.rb\" [(const nil :A)])\n"
                + "(send (const nil :A) :go)\n");
    }

    @Test
    void repeatedRequireWithoutExportsQueuesNothing() throws Exception {
        Path main = write("main.rb", """
                (send nil :require (str "lib"))
                (send nil :require (str "lib"))
                (int 2)
                """);
        write("lib.rb", "(int 1)\n");

        String output = transpile(TranspilerOptions.defaults().withModules(true), main).output();

        assertThat(output).isEqualTo("(int 1)\n(int 2)\n");
    }

    @Test
    void requireStatementRecognition() {
        SexpParser parser = new SexpParser();

        assertThat(RequireFilter.isRequireStatement(parser.parse("(send nil :require (str \"x\"))", null).root())).isTrue();
        assertThat(RequireFilter.isRequireStatement(parser.parse("(send nil :require (lvar :x))", null).root())).isFalse();
        assertThat(RequireFilter.isRequireStatement(parser.parse("(send (self) :require (str \"x\"))", null).root())).isFalse();
    }
}
