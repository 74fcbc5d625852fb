package com.purchasingpower.remediation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * A single vulnerability reported by the scanner for a piece of generated code.
 *
 * <p>Only {@code description} is guaranteed; the remaining fields depend on what the
 * scanner emitted.
 *
 * @since 1.0.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Finding {

    @JsonProperty("rule_id")
    Integer ruleId;

    @JsonProperty("rule_name")
    String ruleName;

    /**
     * Scanner-defined severity, e.g. "high" or "medium".
     */
    @Builder.Default
    String severity = "medium";

    String file;

    Integer line;

    /**
     * The offending line as quoted by the scanner.
     */
    String snippet;

    @Builder.Default
    String description = "";

    @JsonProperty("remediation_advice")
    String remediationAdvice;

    public Optional<String> location() {
        if (line == null) {
            return Optional.ofNullable(file);
        }
        return Optional.of(file != null ? file + ":" + line : "line " + line);
    }

    /**
     * Text used in prompts and error messages. Always contains the description verbatim.
     */
    public String render() {
        if (ruleName == null || ruleName.isBlank()) {
            return description;
        }
        StringBuilder sb = new StringBuilder(ruleName);
        if (line != null) {
            sb.append(" (line ").append(line);
            if (snippet != null && !snippet.isBlank()) {
                sb.append(": ").append(snippet.strip());
            }
            sb.append(")");
        }
        sb.append(" description: ").append(description);
        return sb.toString();
    }

    /**
     * All findings rendered and joined with "; ", scanner order kept.
     */
    public static String summarize(List<Finding> findings) {
        return String.join("; ", findings.stream().map(Finding::render).toList());
    }

    public static Finding of(String description) {
        return Finding.builder().description(description).build();
    }
}
