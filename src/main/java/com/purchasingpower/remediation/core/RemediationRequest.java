package com.purchasingpower.remediation.core;

/**
 * Vulnerability to fix, as received from the caller.
 *
 * <p>{@code language} is kept raw; the loop resolves it against the configured languages
 * before any attempt is made.
 */
public record RemediationRequest(
        String language,
        String ruleName,
        String description,
        String remediationAdvice) {
}
