package com.purchasingpower.remediation.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.remediation.exception.ScanException;
import com.purchasingpower.remediation.model.Finding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a Vorpal JSON report into findings.
 *
 * <p>Accepted shapes: {@code {"results": [...]}}, {@code {"vulnerabilities": [...]}},
 * a bare array, or a single finding object. Scanner versions disagree on key names, so
 * every field is looked up under each spelling seen in the wild.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VorpalResultParser {

    private final ObjectMapper objectMapper;

    public List<Finding> parse(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ScanException(ScanException.Reason.UNPARSEABLE,
                    "Failed to parse scan results: " + e.getOriginalMessage(), e);
        }

        List<Finding> findings = new ArrayList<>();
        for (JsonNode entry : entries(root)) {
            if (entry.isObject()) {
                findings.add(toFinding(entry));
            } else {
                log.debug("Skipping non-object scan result entry: {}", entry);
            }
        }
        return findings;
    }

    private static Iterable<JsonNode> entries(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            if (root.has("results")) {
                return arrayOrEmpty(root.get("results"));
            }
            if (root.has("vulnerabilities")) {
                return arrayOrEmpty(root.get("vulnerabilities"));
            }
            return root.isEmpty() ? List.of() : List.of(root);
        }
        return List.of();
    }

    private static Iterable<JsonNode> arrayOrEmpty(JsonNode node) {
        return node != null && node.isArray() ? node : List.of();
    }

    private static Finding toFinding(JsonNode node) {
        return Finding.builder()
                .ruleId(integer(node, "ruleId", "rule_id"))
                .ruleName(text(node, "ruleName", "rule_name", "rule"))
                .severity(textOr(node, "medium", "severity"))
                .file(text(node, "fileName", "filename", "file"))
                .line(integer(node, "line", "lineNumber", "line_number"))
                .snippet(text(node, "problematicLine", "problematic_line", "content", "code"))
                .description(textOr(node, "", "description", "desc"))
                .remediationAdvice(text(node, "remediationAdvise", "remediationAdvice", "remediation_advice", "advice"))
                .build();
    }

    private static String text(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String textOr(JsonNode node, String fallback, String... keys) {
        String value = text(node, keys);
        return value != null ? value : fallback;
    }

    private static Integer integer(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.canConvertToInt()) {
                return value.asInt();
            }
            if (value != null && value.isTextual()) {
                try {
                    return Integer.valueOf(value.asText().trim());
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric {}: {}", key, value.asText());
                }
            }
        }
        return null;
    }
}
