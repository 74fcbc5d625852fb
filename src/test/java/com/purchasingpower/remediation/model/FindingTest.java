package com.purchasingpower.remediation.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Finding Tests")
class FindingTest {

    @Test
    @DisplayName("Description-only finding should render as its description")
    void testRender_DescriptionOnly() {
        assertThat(Finding.of("Hardcoded secret").render()).isEqualTo("Hardcoded secret");
    }

    @Test
    @DisplayName("Rule, line and snippet should be included when present")
    void testRender_FullFinding() {
        Finding finding = Finding.builder()
                .ruleName("sql-injection")
                .line(12)
                .snippet("  cursor.execute(q)  ")
                .description("User input reaches query")
                .build();

        assertThat(finding.render())
                .isEqualTo("sql-injection (line 12: cursor.execute(q)) description: User input reaches query");
        assertThat(finding.getSeverity()).isEqualTo("medium");
    }

    @Test
    @DisplayName("Summary should keep scanner order")
    void testSummarize_ShouldJoinInOrder() {
        String summary = Finding.summarize(List.of(Finding.of("A"), Finding.of("B")));

        assertThat(summary).isEqualTo("A; B");
    }

    @Test
    @DisplayName("Location should combine file and line")
    void testLocation() {
        assertThat(Finding.builder().file("app.py").line(3).build().location()).contains("app.py:3");
        assertThat(Finding.builder().line(3).build().location()).contains("line 3");
        assertThat(Finding.of("x").location()).isEmpty();
    }
}
