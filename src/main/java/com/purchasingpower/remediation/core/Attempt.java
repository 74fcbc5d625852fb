package com.purchasingpower.remediation.core;

import com.purchasingpower.remediation.model.Finding;
import com.purchasingpower.remediation.model.GenerationPrompt;

import java.util.List;

/**
 * One generation+scan round trip that the scanner rejected.
 *
 * @param index         0-based position within the request
 * @param prompt        what the generator was asked
 * @param generatedCode what it answered
 * @param findings      what the scanner reported, in scanner order
 */
public record Attempt(int index, GenerationPrompt prompt, String generatedCode, List<Finding> findings) {

    public Attempt {
        if (index < 0) {
            throw new IllegalArgumentException("Attempt index must be >= 0, got " + index);
        }
        findings = List.copyOf(findings);
    }
}
