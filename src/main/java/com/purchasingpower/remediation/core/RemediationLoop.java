package com.purchasingpower.remediation.core;

import com.purchasingpower.remediation.configuration.AppProperties;
import com.purchasingpower.remediation.configuration.RemediationProperties;
import com.purchasingpower.remediation.exception.GenerationException;
import com.purchasingpower.remediation.exception.ScanException;
import com.purchasingpower.remediation.model.Finding;
import com.purchasingpower.remediation.model.GenerationPrompt;
import com.purchasingpower.remediation.model.Language;
import com.purchasingpower.remediation.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Bounded generate-scan-retry loop.
 *
 * <p>For attempt {@code i} (0-based) the loop builds a prompt from the request and all
 * rejected attempts so far, generates code, and scans it:
 * <ul>
 *   <li>no findings: {@link RemediationResult.Success}</li>
 *   <li>findings and {@code i + 1 < maxRetries}: the attempt joins the history, next attempt</li>
 *   <li>findings on the last attempt: {@link RemediationResult.SecurityRejected}</li>
 *   <li>generator or scanner failure, or blank output: terminal, no retry</li>
 * </ul>
 *
 * <p>The bean is stateless; the history lives on the stack of {@link #remediate} and is
 * dropped when the call returns, so concurrent requests need no coordination.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemediationLoop {

    private final PromptBuilder promptBuilder;
    private final GenerationPort generationPort;
    private final ScanPort scanPort;
    private final AppProperties props;

    public RemediationResult remediate(RemediationRequest request) {
        RemediationProperties settings = props.getRemediation();

        Optional<Language> resolved = settings.resolveLanguage(request.language());
        if (resolved.isEmpty()) {
            log.warn("[{}] Unsupported language '{}' (supported: {})",
                    RemediationState.UNSUPPORTED_LANGUAGE, request.language(), settings.getSupportedLanguages());
            return new RemediationResult.UnsupportedLanguage(
                    request.language(), List.copyOf(settings.getSupportedLanguages()));
        }

        Language language = resolved.get();
        int maxRetries = settings.getMaxRetries();
        log.info("[{}] Remediating '{}' in {} (max {} attempts)",
                RemediationState.INIT, request.ruleName(), language, maxRetries);

        ConversationHistory history = ConversationHistory.empty();
        for (int index = 0; index < maxRetries; index++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Remediation cancelled before attempt {}", index + 1);
                return new RemediationResult.GenerationFailed(
                        new GenerationException(GenerationException.Reason.CANCELLED, "Request cancelled"), index);
            }

            log.debug("[{}] Attempt {}/{} with {} rejected attempts in context",
                    RemediationState.GENERATING, index + 1, maxRetries, history.size());
            GenerationPrompt prompt = promptBuilder.build(request, history);

            String code;
            try {
                code = generationPort.generate(prompt, settings.getTemperature());
            } catch (GenerationException e) {
                log.error("[{}] Attempt {}: {} ({})",
                        RemediationState.GENERATION_FAILED, index + 1, e.getMessage(), e.getReason());
                return new RemediationResult.GenerationFailed(e, index);
            }

            if (code == null || code.isBlank()) {
                log.error("[{}] Attempt {}: generator returned no code",
                        RemediationState.GENERATION_FAILED, index + 1);
                return new RemediationResult.GenerationFailed(
                        new GenerationException(GenerationException.Reason.EMPTY_RESPONSE,
                                "Empty response from code generator"), index);
            }

            log.debug("[{}] Attempt {}: {}", RemediationState.SCANNING, index + 1,
                    ExternalCallLogger.truncate(code, 300));
            List<Finding> findings;
            try {
                findings = scanPort.scan(code, language, language.syntheticFilename());
            } catch (ScanException e) {
                log.error("[{}] Attempt {}: {} ({})",
                        RemediationState.SCAN_FAILED, index + 1, e.getMessage(), e.getReason());
                return new RemediationResult.ScanFailed(e, index);
            }

            if (findings.isEmpty()) {
                log.info("[{}] Secure code produced after {} attempt(s)", RemediationState.CLEAN, index + 1);
                return new RemediationResult.Success(code, index + 1);
            }

            history = history.append(new Attempt(index, prompt, code, findings));
            RemediationState next = index + 1 < maxRetries
                    ? RemediationState.VULNERABLE_RETRY
                    : RemediationState.VULNERABLE_EXHAUSTED;
            log.warn("[{}] Attempt {} had {} finding(s): {}",
                    next, index + 1, findings.size(), Finding.summarize(findings));
        }

        return new RemediationResult.SecurityRejected(history.lastFindings(), maxRetries);
    }
}
