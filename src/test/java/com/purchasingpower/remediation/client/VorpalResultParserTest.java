package com.purchasingpower.remediation.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.remediation.exception.ScanException;
import com.purchasingpower.remediation.model.Finding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Vorpal Result Parser Tests")
class VorpalResultParserTest {

    private final VorpalResultParser parser = new VorpalResultParser(new ObjectMapper());

    @Test
    @DisplayName("Should read the results wrapper with Vorpal key names")
    void testParse_ResultsWrapper() {
        // Given
        String json = """
                {"results": [{
                  "ruleId": 7,
                  "ruleName": "sql-injection",
                  "severity": "high",
                  "fileName": "remediation.py",
                  "line": 3,
                  "problematicLine": "cursor.execute(q)",
                  "description": "User input reaches query",
                  "remediationAdvise": "Use parameters"
                }]}
                """;

        // When
        List<Finding> findings = parser.parse(json);

        // Then
        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.getRuleId()).isEqualTo(7);
        assertThat(finding.getRuleName()).isEqualTo("sql-injection");
        assertThat(finding.getSeverity()).isEqualTo("high");
        assertThat(finding.getFile()).isEqualTo("remediation.py");
        assertThat(finding.getLine()).isEqualTo(3);
        assertThat(finding.getSnippet()).isEqualTo("cursor.execute(q)");
        assertThat(finding.getDescription()).isEqualTo("User input reaches query");
        assertThat(finding.getRemediationAdvice()).isEqualTo("Use parameters");
    }

    @Test
    @DisplayName("Should accept vulnerabilities wrapper, bare arrays and snake_case keys")
    void testParse_AlternativeShapes() {
        assertThat(parser.parse("{\"vulnerabilities\": [{\"desc\": \"A\"}, {\"description\": \"B\"}]}"))
                .extracting(Finding::getDescription)
                .containsExactly("A", "B");

        List<Finding> bare = parser.parse("[{\"rule_name\": \"xss\", \"line_number\": \"9\", \"description\": \"C\"}]");
        assertThat(bare).hasSize(1);
        assertThat(bare.get(0).getRuleName()).isEqualTo("xss");
        assertThat(bare.get(0).getLine()).isEqualTo(9);
        assertThat(bare.get(0).getSeverity()).isEqualTo("medium");
    }

    @Test
    @DisplayName("Single object should be one finding")
    void testParse_SingleObject() {
        assertThat(parser.parse("{\"description\": \"only one\"}"))
                .extracting(Finding::getDescription)
                .containsExactly("only one");
    }

    @Test
    @DisplayName("Empty reports should mean no findings")
    void testParse_EmptyReports() {
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("   ")).isEmpty();
        assertThat(parser.parse("[]")).isEmpty();
        assertThat(parser.parse("{}")).isEmpty();
        assertThat(parser.parse("{\"results\": []}")).isEmpty();
    }

    @Test
    @DisplayName("Non-object entries should be skipped")
    void testParse_NonObjectEntries() {
        assertThat(parser.parse("[\"noise\", 1, {\"description\": \"real\"}]"))
                .extracting(Finding::getDescription)
                .containsExactly("real");
    }

    @Test
    @DisplayName("Malformed JSON should be a scan failure, not a clean result")
    void testParse_Malformed_ShouldThrow() {
        assertThatThrownBy(() -> parser.parse("{\"results\": ["))
                .isInstanceOf(ScanException.class)
                .extracting(e -> ((ScanException) e).getReason())
                .isEqualTo(ScanException.Reason.UNPARSEABLE);
    }
}
