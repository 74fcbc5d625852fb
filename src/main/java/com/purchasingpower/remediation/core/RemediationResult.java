package com.purchasingpower.remediation.core;

import com.purchasingpower.remediation.exception.GenerationException;
import com.purchasingpower.remediation.exception.ScanException;
import com.purchasingpower.remediation.model.Finding;

import java.util.List;

/**
 * Terminal outcome of one remediation request.
 */
public sealed interface RemediationResult {

    RemediationState state();

    /**
     * The scanner accepted the code.
     */
    record Success(String code, int attemptsUsed) implements RemediationResult {
        @Override
        public RemediationState state() {
            return RemediationState.CLEAN;
        }
    }

    /**
     * Every attempt produced code with findings. Content-class failure.
     */
    record SecurityRejected(List<Finding> lastFindings, int attemptsUsed) implements RemediationResult {
        public SecurityRejected {
            lastFindings = List.copyOf(lastFindings);
        }

        @Override
        public RemediationState state() {
            return RemediationState.VULNERABLE_EXHAUSTED;
        }
    }

    /**
     * Rejected before any attempt.
     */
    record UnsupportedLanguage(String language, List<String> supportedLanguages) implements RemediationResult {
        @Override
        public RemediationState state() {
            return RemediationState.UNSUPPORTED_LANGUAGE;
        }
    }

    /**
     * Generator or scanner failed. Infrastructure-class, never retried.
     */
    sealed interface BackendFailure extends RemediationResult {
        RuntimeException cause();

        int attemptIndex();
    }

    record GenerationFailed(GenerationException cause, int attemptIndex) implements BackendFailure {
        @Override
        public RemediationState state() {
            return RemediationState.GENERATION_FAILED;
        }
    }

    record ScanFailed(ScanException cause, int attemptIndex) implements BackendFailure {
        @Override
        public RemediationState state() {
            return RemediationState.SCAN_FAILED;
        }
    }
}
