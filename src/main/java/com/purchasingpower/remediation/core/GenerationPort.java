package com.purchasingpower.remediation.core;

import com.purchasingpower.remediation.exception.GenerationException;
import com.purchasingpower.remediation.model.GenerationPrompt;

/**
 * Code-generation backend.
 *
 * @since 1.0.0
 */
public interface GenerationPort {

    /**
     * Asks the backend for a code snippet. Blocks until an answer or the configured timeout.
     *
     * @param prompt      system instruction and user message
     * @param temperature sampling temperature
     * @return raw generated code, possibly blank
     * @throws GenerationException if the backend is unreachable, times out or answers garbage
     */
    String generate(GenerationPrompt prompt, double temperature);

    /**
     * Cheap reachability probe for diagnostics. Never used by the loop.
     */
    default boolean isAvailable() {
        return true;
    }
}
