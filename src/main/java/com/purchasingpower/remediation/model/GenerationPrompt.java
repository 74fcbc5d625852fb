package com.purchasingpower.remediation.model;

/**
 * Prompt sent to the code generator, split the way chat models expect it.
 *
 * @param systemInstruction role and output rules for the model
 * @param userMessage       vulnerability details plus scanner feedback on earlier attempts
 */
public record GenerationPrompt(String systemInstruction, String userMessage) {

    public String fullText() {
        return systemInstruction + "\n\n" + userMessage;
    }

    public boolean contains(String text) {
        return systemInstruction.contains(text) || userMessage.contains(text);
    }
}
