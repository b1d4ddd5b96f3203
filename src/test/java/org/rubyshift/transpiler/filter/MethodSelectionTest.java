package org.rubyshift.transpiler.filter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class MethodSelectionTest {

    @Test
    void includesEverythingByDefault() {
        MethodSelection selection = new MethodSelection();

        assertThat(selection.isExcluded("each")).isFalse();
    }

    @Test
    void excludeAndIncludeEditTheDenyList() {
        MethodSelection selection = new MethodSelection();
        selection.exclude(List.of("each", "map"));
        selection.include(List.of("map"));

        assertThat(selection.isExcluded("each")).isTrue();
        assertThat(selection.isExcluded("map")).isFalse();
    }

    @Test
    void includeOnlySwitchesToAnAllowList() {
        MethodSelection selection = new MethodSelection();
        selection.includeOnly(List.of("each"));
        selection.include(List.of("map"));
        selection.exclude(List.of("each"));

        assertThat(selection.isExcluded("each")).isTrue();
        assertThat(selection.isExcluded("map")).isFalse();
        assertThat(selection.isExcluded("select")).isTrue();
    }

    @Test
    void includeAllResetsBothLists() {
        MethodSelection selection = new MethodSelection();
        selection.includeOnly(List.of("each"));
        selection.includeAll();

        assertThat(selection.isExcluded("select")).isFalse();
    }

    @Test
    void buildsFromOptionsInOrder() {
        MethodSelection selection = MethodSelection.of(false, List.of("a", "b"), List.of("c"), List.of("a"));

        assertThat(selection.isExcluded("a")).isTrue();
        assertThat(selection.isExcluded("b")).isFalse();
        assertThat(selection.isExcluded("c")).isFalse();
        assertThat(selection.isExcluded("d")).isTrue();
    }
}
