package com.purchasingpower.remediation.core;

/**
 * States of the remediation loop. VULNERABLE_RETRY leads back to GENERATING; CLEAN,
 * VULNERABLE_EXHAUSTED and the failure states end the request.
 */
public enum RemediationState {
    INIT,
    GENERATING,
    SCANNING,
    CLEAN,
    VULNERABLE_RETRY,
    VULNERABLE_EXHAUSTED,
    GENERATION_FAILED,
    SCAN_FAILED,
    UNSUPPORTED_LANGUAGE;

    public boolean isTerminal() {
        return this != INIT && this != GENERATING && this != SCANNING && this != VULNERABLE_RETRY;
    }
}
