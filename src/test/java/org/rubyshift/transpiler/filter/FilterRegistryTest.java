package org.rubyshift.transpiler.filter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.rubyshift.transpiler.diagnostics.Diagnostic;
import org.rubyshift.transpiler.diagnostics.DiagnosticsEngine;

@Tag("unit")
class FilterRegistryTest {

    @Test
    void bundledFiltersAreRegistered() {
        FilterRegistry registry = FilterRegistry.initialize();

        assertThat(registry.registeredIds()).containsExactly("require", "combiner", "pragma");
        assertThat(FilterRegistry.DEFAULT_FILTERS).containsExactly("require", "pragma");
    }

    @Test
    void createsFreshInstancesInConfiguredOrder() {
        FilterRegistry registry = FilterRegistry.initialize();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Filter> first = registry.create(List.of("pragma", "require", "pragma"), diagnostics);
        List<Filter> second = registry.create(List.of("pragma"), diagnostics);

        assertThat(first).extracting(Filter::id).containsExactly("pragma", "require");
        assertThat(first.get(0)).isNotSameAs(second.get(0));
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void unknownFilterIsReportedAndSkipped() {
        FilterRegistry registry = FilterRegistry.initialize();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Filter> filters = registry.create(List.of("functions", "require"), diagnostics);

        assertThat(filters).extracting(Filter::id).containsExactly("require");
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics())
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
                    assertThat(d.message()).contains("functions");
                });
    }

    @Test
    void registerReplacesAFactory() {
        FilterRegistry registry = new FilterRegistry();
        registry.register("esm", () -> new StubFilter("esm"));

        assertThat(registry.get("esm")).isPresent();
        assertThat(registry.get("cjs")).isEmpty();
        assertThat(registry.get("esm").get().get().id()).isEqualTo("esm");
    }
}
