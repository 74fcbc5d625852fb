package com.purchasingpower.remediation.client;

import com.purchasingpower.remediation.configuration.AppProperties;
import com.purchasingpower.remediation.configuration.VorpalProperties;
import com.purchasingpower.remediation.core.ScanPort;
import com.purchasingpower.remediation.exception.ScanException;
import com.purchasingpower.remediation.exception.ScanException.Reason;
import com.purchasingpower.remediation.model.CallContext;
import com.purchasingpower.remediation.model.Finding;
import com.purchasingpower.remediation.model.Language;
import com.purchasingpower.remediation.model.ServiceType;
import com.purchasingpower.remediation.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs the Vorpal CLI against a generated snippet.
 *
 * <p>Each scan gets its own temp directory holding the snippet (under the synthetic
 * filename, so Vorpal picks the right rules), the JSON report and the process output.
 * The directory is removed afterwards whatever the outcome.
 *
 * <p>Command: {@code vorpal -s <snippet> -r <report.json>}. A zero exit with no report,
 * or with an empty one, means no findings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VorpalScanner implements ScanPort {

    private static final String REPORT_FILE = "scan_results.json";
    private static final String OUTPUT_FILE = "vorpal.log";

    private final AppProperties props;
    private final VorpalResultParser resultParser;

    @Override
    public List<Finding> scan(String code, Language language, String filename) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.VORPAL, "scan", log);
        call.logRequest(null, "language", language, "filename", filename, "characters", code.length());

        Path binary = resolveBinary();
        Path workDir = createWorkDir();
        try {
            List<Finding> findings = runScan(binary, workDir, code, filename);
            call.logResponse(findings.isEmpty() ? "clean" : Finding.summarize(findings),
                    "findings", findings.size());
            return findings;
        } catch (ScanException e) {
            call.logError(e.getMessage(), e);
            throw e;
        } finally {
            deleteQuietly(workDir);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            resolveBinary();
            return true;
        } catch (ScanException e) {
            log.warn("Vorpal health probe failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Configured path, or the fallback path when the configured one does not exist.
     */
    Path resolveBinary() {
        VorpalProperties vorpal = props.getVorpal();
        Path configured = Path.of(vorpal.getPath());
        Path candidate = configured;
        if (!Files.exists(configured) && vorpal.getFallbackPath() != null && !vorpal.getFallbackPath().isBlank()) {
            Path fallback = Path.of(vorpal.getFallbackPath());
            if (Files.exists(fallback)) {
                log.debug("Vorpal not found at {}, using {}", configured, fallback);
                candidate = fallback;
            }
        }

        if (!Files.isRegularFile(candidate)) {
            throw new ScanException(Reason.UNAVAILABLE, "Vorpal binary not found at " + candidate);
        }
        if (!Files.isExecutable(candidate)) {
            throw new ScanException(Reason.UNAVAILABLE, "Vorpal binary is not executable: " + candidate);
        }
        return candidate.toAbsolutePath();
    }

    private List<Finding> runScan(Path binary, Path workDir, String code, String filename) {
        Path source = workDir.resolve(safeFilename(filename));
        Path report = workDir.resolve(REPORT_FILE);
        Path output = workDir.resolve(OUTPUT_FILE);

        Process process;
        try {
            Files.writeString(source, code, StandardCharsets.UTF_8);
            process = new ProcessBuilder(List.of(
                    binary.toString(), "-s", source.toString(), "-r", report.toString()))
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
        } catch (IOException e) {
            throw new ScanException(Reason.UNAVAILABLE, "Failed to start Vorpal: " + e.getMessage(), e);
        }

        int timeoutSeconds = props.getVorpal().getTimeoutSeconds();
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ScanException(Reason.TIMEOUT, "Vorpal scan timed out after " + timeoutSeconds + "s");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ScanException(Reason.CANCELLED, "Vorpal scan was cancelled", e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new ScanException(Reason.CRASHED,
                    "Vorpal scan failed with code " + exitCode + ": " + ExternalCallLogger.truncate(readOutput(output), 500));
        }

        if (!Files.exists(report)) {
            return List.of();
        }
        try {
            return resultParser.parse(Files.readString(report, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ScanException(Reason.UNPARSEABLE, "Failed to read scan results: " + e.getMessage(), e);
        }
    }

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("vorpal-scan-");
        } catch (IOException e) {
            throw new ScanException(Reason.UNAVAILABLE, "Cannot create scan workspace: " + e.getMessage(), e);
        }
    }

    /**
     * Only the last path element is used; the name must not escape the scan directory.
     */
    private static String safeFilename(String filename) {
        Path name = Path.of(filename).getFileName();
        if (name == null || name.toString().isBlank() || name.toString().equals("..")) {
            throw new IllegalArgumentException("Invalid scan filename: " + filename);
        }
        return name.toString();
    }

    private static String readOutput(Path output) {
        try {
            return Files.exists(output) ? Files.readString(output, StandardCharsets.UTF_8).strip() : "";
        } catch (IOException e) {
            return "(output unavailable: " + e.getMessage() + ")";
        }
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not delete scan file {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up scan directory {}: {}", dir, e.getMessage());
        }
    }
}
