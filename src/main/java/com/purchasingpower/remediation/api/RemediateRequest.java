package com.purchasingpower.remediation.api;

import com.purchasingpower.remediation.core.RemediationRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for {@code POST /api/remediation}.
 *
 * <pre>
 * {
 *   "language": "go",
 *   "ruleName": "Unsafe SQL Query Construction",
 *   "description": "Dynamically constructing SQL queries through string concatenation...",
 *   "remediationAdvice": "Use parameterized queries..."
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemediateRequest {

    private String language;
    private String ruleName;
    private String description;
    private String remediationAdvice;

    /**
     * Names of required fields that are missing or blank, in declaration order.
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (isBlank(language)) {
            missing.add("language");
        }
        if (isBlank(ruleName)) {
            missing.add("ruleName");
        }
        if (isBlank(description)) {
            missing.add("description");
        }
        if (isBlank(remediationAdvice)) {
            missing.add("remediationAdvice");
        }
        return missing;
    }

    public RemediationRequest toDomain() {
        return new RemediationRequest(language, ruleName, description, remediationAdvice);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
