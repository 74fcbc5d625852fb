package com.purchasingpower.remediation.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OllamaProperties {

    @NotBlank
    private String baseUrl = "http://127.0.0.1:11434";

    @NotBlank
    private String chatModel = "llama3.2";

    private double topP = 0.9;

    private int topK = 40;

    /**
     * Cap on generated tokens per answer.
     */
    @Min(1)
    private int numPredict = 1000;

    @Min(1)
    private int connectTimeoutMs = 10_000;

    /**
     * Time allowed for one chat completion, connection included.
     */
    @Min(1)
    private int timeoutSeconds = 60;
}
