package com.purchasingpower.remediation.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.remediation.core.GenerationPort;
import com.purchasingpower.remediation.core.ScanPort;
import com.purchasingpower.remediation.exception.GenerationException;
import com.purchasingpower.remediation.exception.ScanException;
import com.purchasingpower.remediation.model.Finding;
import com.purchasingpower.remediation.model.GenerationPrompt;
import com.purchasingpower.remediation.model.Language;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for the remediation endpoint.
 *
 * The generator and the scanner are mocked; everything between them (prompt templates,
 * the retry loop, response mapping) is the real application. The test profile allows
 * 3 attempts.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RemediationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private GenerationPort generationPort;

    @MockBean
    private ScanPort scanPort;

    @Test
    void cleanFirstAttempt_shouldReturnRemediatedCode() throws Exception {
        // Given
        when(generationPort.generate(any(), anyDouble())).thenReturn("db.Query(\"SELECT * FROM t WHERE id = ?\", id)");
        when(scanPort.scan(anyString(), any(), anyString())).thenReturn(List.of());

        // When / Then
        perform(sqlInjection("go"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remediated_code").value("db.Query(\"SELECT * FROM t WHERE id = ?\", id)"));

        verify(scanPort).scan(anyString(), eq(Language.GO), eq("remediation.go"));
    }

    @Test
    void vulnerableThenClean_shouldReturnSecondVersionAndSendFeedback() throws Exception {
        // Given
        when(generationPort.generate(any(), anyDouble())).thenReturn("CODE_A", "CODE_B");
        when(scanPort.scan(anyString(), any(), anyString()))
                .thenReturn(List.of(Finding.of("SQLi")), List.of());

        // When
        perform(sqlInjection("python"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remediated_code").value("CODE_B"));

        // Then
        ArgumentCaptor<GenerationPrompt> prompts = ArgumentCaptor.forClass(GenerationPrompt.class);
        verify(generationPort, times(2)).generate(prompts.capture(), eq(0.1));
        GenerationPrompt retry = prompts.getAllValues().get(1);
        assertThat(retry.userMessage()).contains("CODE_A").contains("SQLi");
        assertThat(prompts.getAllValues().get(0).userMessage()).doesNotContain("CODE_A");
    }

    @Test
    void alwaysVulnerable_shouldReturn422WithLastFindings() throws Exception {
        // Given
        when(generationPort.generate(any(), anyDouble())).thenReturn("CODE");
        when(scanPort.scan(anyString(), any(), anyString()))
                .thenReturn(List.of(Finding.of("SQLi")), List.of(Finding.of("SQLi")), List.of(Finding.of("XSS")));

        // When
        MvcResult result = perform(sqlInjection("python"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_code").value("SECURITY_REJECTED"))
                .andExpect(jsonPath("$.attempts_used").value(3))
                .andExpect(jsonPath("$.findings[0].description").value("XSS"))
                .andExpect(jsonPath("$.findings.length()").value(1))
                .andReturn();

        // Then
        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("after 3 attempts").contains("XSS");
        verify(generationPort, times(3)).generate(any(), anyDouble());
    }

    @Test
    void unsupportedLanguage_shouldReturn400WithoutCallingBackends() throws Exception {
        perform(sqlInjection("cobol"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("UNSUPPORTED_LANGUAGE"))
                .andExpect(jsonPath("$.detail").value(org.hamcrest.Matchers.containsString("cobol")))
                .andExpect(jsonPath("$.supported_languages").isArray());

        verify(generationPort, never()).generate(any(), anyDouble());
        verify(scanPort, never()).scan(anyString(), any(), anyString());
    }

    @Test
    void missingFields_shouldReturn400() throws Exception {
        RemediateRequest request = RemediateRequest.builder()
                .language("python")
                .ruleName("rule")
                .build();

        perform(request)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.detail").value("Missing required fields: description, remediationAdvice"));

        verify(generationPort, never()).generate(any(), anyDouble());
    }

    @Test
    void malformedJson_shouldReturn400InvalidRequest() throws Exception {
        mockMvc.perform(post("/api/remediation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"language\": \"python\", \"ruleName\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.detail").value("Malformed request body"));

        verify(generationPort, never()).generate(any(), anyDouble());
    }

    @Test
    void missingBody_shouldReturn400InvalidRequest() throws Exception {
        mockMvc.perform(post("/api/remediation").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));
    }

    @Test
    void generatorDown_shouldReturn500WithCause() throws Exception {
        when(generationPort.generate(any(), anyDouble()))
                .thenThrow(new GenerationException(GenerationException.Reason.UNAVAILABLE, "Cannot connect to Ollama"));

        perform(sqlInjection("java"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_code").value("GENERATION_FAILED"))
                .andExpect(jsonPath("$.cause").value("UNAVAILABLE"));

        verify(generationPort, times(1)).generate(any(), anyDouble());
        verify(scanPort, never()).scan(anyString(), any(), anyString());
    }

    @Test
    void scannerCrash_shouldReturn500WithoutRetry() throws Exception {
        when(generationPort.generate(any(), anyDouble())).thenReturn("CODE");
        when(scanPort.scan(anyString(), any(), anyString()))
                .thenThrow(new ScanException(ScanException.Reason.CRASHED, "Vorpal scan failed with code 2"));

        perform(sqlInjection("javascript"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_code").value("SCAN_FAILED"))
                .andExpect(jsonPath("$.cause").value("CRASHED"));

        verify(generationPort, times(1)).generate(any(), anyDouble());
    }

    @Test
    void unexpectedError_shouldReturn500InternalError() throws Exception {
        when(generationPort.generate(any(), anyDouble())).thenThrow(new IllegalStateException("boom"));

        perform(sqlInjection("python"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_code").value("INTERNAL_ERROR"));
    }

    @Test
    void health_shouldReportHealthy() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    private ResultActions perform(RemediateRequest request) throws Exception {
        return mockMvc.perform(post("/api/remediation")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)));
    }

    private static RemediateRequest sqlInjection(String language) {
        return RemediateRequest.builder()
                .language(language)
                .ruleName("Unsafe SQL Query Construction")
                .description("Dynamically constructing SQL queries through string concatenation with user input")
                .remediationAdvice("Use parameterized queries or prepared statements")
                .build();
    }
}
