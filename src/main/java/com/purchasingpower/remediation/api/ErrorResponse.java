package com.purchasingpower.remediation.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.remediation.model.Finding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Error body. {@code error_code} tells callers whether to fix the request, retry later,
 * or accept that no secure fix was found.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    public enum ErrorCode {
        INVALID_REQUEST,
        UNSUPPORTED_LANGUAGE,
        SECURITY_REJECTED,
        GENERATION_FAILED,
        SCAN_FAILED,
        INTERNAL_ERROR
    }

    private String detail;

    @JsonProperty("error_code")
    private ErrorCode errorCode;

    /**
     * Failure reason reported by the generator or scanner adapter.
     */
    private String cause;

    @JsonProperty("attempts_used")
    private Integer attemptsUsed;

    private List<Finding> findings;

    @JsonProperty("supported_languages")
    private List<String> supportedLanguages;

    public static ErrorResponse of(ErrorCode errorCode, String detail) {
        return ErrorResponse.builder()
                .errorCode(errorCode)
                .detail(detail)
                .build();
    }
}
