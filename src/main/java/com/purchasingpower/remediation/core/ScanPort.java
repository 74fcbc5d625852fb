package com.purchasingpower.remediation.core;

import com.purchasingpower.remediation.exception.ScanException;
import com.purchasingpower.remediation.model.Finding;
import com.purchasingpower.remediation.model.Language;

import java.util.List;

/**
 * Vulnerability scanner.
 *
 * @since 1.0.0
 */
public interface ScanPort {

    /**
     * Scans a snippet. An empty list is the only signal that the code is clean.
     *
     * @param code     snippet to scan
     * @param language language of the snippet
     * @param filename synthetic name, lets the scanner choose its rule set
     * @return findings in scanner order
     * @throws ScanException if the scanner could not produce a verdict
     */
    List<Finding> scan(String code, Language language, String filename);

    default boolean isAvailable() {
        return true;
    }
}
