package com.purchasingpower.remediation.config;

import com.purchasingpower.remediation.configuration.AppProperties;
import com.purchasingpower.remediation.core.GenerationPort;
import com.purchasingpower.remediation.core.ScanPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs the effective configuration once the application is up and warns if the
 * generator or the scanner cannot be reached. Never fails startup: the service stays
 * live and reports backend outages per request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupReporter {

    private final AppProperties props;
    private final GenerationPort generationPort;
    private final ScanPort scanPort;

    @EventListener(ApplicationReadyEvent.class)
    public void report() {
        log.info("Ollama endpoint: {} (model {})", props.getOllama().getBaseUrl(), props.getOllama().getChatModel());
        log.info("Vorpal path: {}", props.getVorpal().getPath());
        log.info("Max retries: {}", props.getRemediation().getMaxRetries());
        log.info("Supported languages: {}", String.join(", ", props.getRemediation().getSupportedLanguages()));

        if (!generationPort.isAvailable()) {
            log.warn("⚠️ Code generator is not reachable; remediation requests will fail until it is");
        }
        if (!scanPort.isAvailable()) {
            log.warn("⚠️ Vorpal scanner is not available; remediation requests will fail until it is");
        }
    }
}
