package com.purchasingpower.remediation.core;

import com.purchasingpower.remediation.model.GenerationPrompt;

/**
 * Turns a request and the rejected attempts so far into the next prompt.
 *
 * <p>Implementations must be pure: the same inputs always give the same prompt, and every
 * finding of every attempt in {@code history} must appear in it verbatim.
 */
public interface PromptBuilder {

    GenerationPrompt build(RemediationRequest request, ConversationHistory history);
}
