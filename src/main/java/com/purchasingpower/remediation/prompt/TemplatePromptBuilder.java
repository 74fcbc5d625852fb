package com.purchasingpower.remediation.prompt;

import com.purchasingpower.remediation.core.Attempt;
import com.purchasingpower.remediation.core.ConversationHistory;
import com.purchasingpower.remediation.core.PromptBuilder;
import com.purchasingpower.remediation.core.RemediationRequest;
import com.purchasingpower.remediation.model.Finding;
import com.purchasingpower.remediation.model.GenerationPrompt;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds remediation prompts from the {@code remediation} template.
 *
 * <p>Rejected attempts are passed oldest first with their code and rendered findings.
 * Attempt numbers are not exposed to the template.
 */
@Component
@RequiredArgsConstructor
public class TemplatePromptBuilder implements PromptBuilder {

    static final String TEMPLATE = "remediation";

    private final PromptLibraryService promptLibrary;

    @Override
    public GenerationPrompt build(RemediationRequest request, ConversationHistory history) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("language", nullToEmpty(request.language()));
        variables.put("ruleName", nullToEmpty(request.ruleName()));
        variables.put("description", nullToEmpty(request.description()));
        variables.put("remediationAdvice", nullToEmpty(request.remediationAdvice()));
        variables.put("hasRejectedAttempts", !history.isEmpty());
        variables.put("rejectedAttempts", history.attempts().stream()
                .map(TemplatePromptBuilder::toVariables)
                .toList());

        return promptLibrary.render(TEMPLATE, variables);
    }

    private static Map<String, Object> toVariables(Attempt attempt) {
        List<String> findings = attempt.findings().stream().map(Finding::render).toList();
        return Map.of(
                "code", attempt.generatedCode(),
                "findings", findings);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
