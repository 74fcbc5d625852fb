package com.purchasingpower.remediation.api;

import com.purchasingpower.remediation.api.ErrorResponse.ErrorCode;
import com.purchasingpower.remediation.core.RemediationLoop;
import com.purchasingpower.remediation.core.RemediationResult;
import com.purchasingpower.remediation.model.Finding;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for code remediation.
 *
 * Flow:
 * 1. Caller sends the vulnerability details
 * 2. The remediation loop generates a fix and scans it, retrying with scanner feedback
 * 3. The terminal result is mapped to a status code:
 *    200 fixed, 400 bad request or unsupported language,
 *    422 no secure fix within the attempt budget, 500 generator/scanner failure
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/remediation")
@RequiredArgsConstructor
@Tag(name = "Remediation", description = "Secure code generation with scanner validation")
public class RemediationController {

    private final RemediationLoop remediationLoop;

    /**
     * POST /api/remediation
     */
    @PostMapping
    @Operation(summary = "Remediate a vulnerability",
            description = "Generates a fix and retries with scanner feedback until the code scans clean")
    public ResponseEntity<?> remediate(@RequestBody RemediateRequest request) {
        List<String> missing = request.missingFields();
        if (!missing.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(ErrorResponse.of(ErrorCode.INVALID_REQUEST,
                            "Missing required fields: " + String.join(", ", missing)));
        }

        log.info("Processing remediation request for {} - {}", request.getLanguage(), request.getRuleName());

        try {
            return toResponse(remediationLoop.remediate(request.toDomain()));
        } catch (Exception e) {
            log.error("Remediation failed unexpectedly", e);
            return ResponseEntity.internalServerError()
                    .body(ErrorResponse.of(ErrorCode.INTERNAL_ERROR, "Internal error: " + e.getMessage()));
        }
    }

    /**
     * Unreadable or missing JSON body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Rejected unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(ErrorCode.INVALID_REQUEST, "Malformed request body"));
    }

    private ResponseEntity<?> toResponse(RemediationResult result) {
        if (result instanceof RemediationResult.Success success) {
            return ResponseEntity.ok(new RemediateResponse(success.code()));
        }

        if (result instanceof RemediationResult.UnsupportedLanguage unsupported) {
            return ResponseEntity.badRequest().body(ErrorResponse.builder()
                    .errorCode(ErrorCode.UNSUPPORTED_LANGUAGE)
                    .detail("Unsupported language: " + unsupported.language()
                            + ". Supported languages: " + String.join(", ", unsupported.supportedLanguages()))
                    .supportedLanguages(unsupported.supportedLanguages())
                    .build());
        }

        if (result instanceof RemediationResult.SecurityRejected rejected) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ErrorResponse.builder()
                    .errorCode(ErrorCode.SECURITY_REJECTED)
                    .detail("Unable to generate secure code after " + rejected.attemptsUsed()
                            + " attempts. Last vulnerabilities: " + Finding.summarize(rejected.lastFindings()))
                    .attemptsUsed(rejected.attemptsUsed())
                    .findings(rejected.lastFindings())
                    .build());
        }

        if (result instanceof RemediationResult.GenerationFailed failed) {
            return ResponseEntity.internalServerError().body(ErrorResponse.builder()
                    .errorCode(ErrorCode.GENERATION_FAILED)
                    .detail("Failed to generate remediation: " + failed.cause().getMessage())
                    .cause(failed.cause().getReason().name())
                    .build());
        }

        if (result instanceof RemediationResult.ScanFailed failed) {
            return ResponseEntity.internalServerError().body(ErrorResponse.builder()
                    .errorCode(ErrorCode.SCAN_FAILED)
                    .detail("Security scan failed: " + failed.cause().getMessage())
                    .cause(failed.cause().getReason().name())
                    .build());
        }

        throw new IllegalStateException("Unhandled remediation result: " + result.state());
    }
}
