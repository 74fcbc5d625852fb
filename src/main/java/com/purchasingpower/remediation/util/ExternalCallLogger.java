package com.purchasingpower.remediation.util;

import com.purchasingpower.remediation.model.CallContext;
import com.purchasingpower.remediation.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for calls to the generator and the scanner.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (prompts and generated code can be long)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
