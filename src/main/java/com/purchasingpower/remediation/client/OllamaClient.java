package com.purchasingpower.remediation.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.remediation.configuration.AppProperties;
import com.purchasingpower.remediation.configuration.OllamaProperties;
import com.purchasingpower.remediation.core.GenerationPort;
import com.purchasingpower.remediation.exception.GenerationException;
import com.purchasingpower.remediation.exception.GenerationException.Reason;
import com.purchasingpower.remediation.model.CallContext;
import com.purchasingpower.remediation.model.GenerationPrompt;
import com.purchasingpower.remediation.model.ServiceType;
import com.purchasingpower.remediation.util.CodeResponseSanitizer;
import com.purchasingpower.remediation.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Ollama chat backend for code generation.
 *
 * <p>Sends the system instruction and the user message as separate chat messages to
 * {@code /api/chat} and returns the assistant's content with markdown decoration removed.
 * Every call carries a connect timeout and an overall response timeout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OllamaClient implements GenerationPort {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final AppProperties props;
    private WebClient ollamaWebClient;

    @PostConstruct
    public void init() {
        OllamaProperties ollama = props.getOllama();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, ollama.getConnectTimeoutMs())
                .responseTimeout(Duration.ofSeconds(ollama.getTimeoutSeconds()));

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(ollama.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String generate(GenerationPrompt prompt, double temperature) {
        OllamaProperties ollama = props.getOllama();
        CallContext call = ExternalCallLogger.startCall(ServiceType.OLLAMA, "chat", log);
        call.logRequest(ExternalCallLogger.truncate(prompt.userMessage(), 200),
                "model", ollama.getChatModel(),
                "temperature", temperature);

        Map<String, Object> body = Map.of(
                "model", ollama.getChatModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", prompt.systemInstruction()),
                        Map.of("role", "user", "content", prompt.userMessage())
                ),
                "stream", false,
                "options", Map.of(
                        "temperature", temperature,
                        "top_p", ollama.getTopP(),
                        "top_k", ollama.getTopK(),
                        "num_predict", ollama.getNumPredict()
                )
        );

        JsonNode response;
        try {
            response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                    .block();
        } catch (RuntimeException e) {
            GenerationException failure = translate(e);
            call.logError(failure.getMessage(), e);
            throw failure;
        }

        String content = extractContent(response);
        String code = CodeResponseSanitizer.clean(content);
        call.logResponse(ExternalCallLogger.truncate(code, 500), "characters", code.length());
        return code;
    }

    @Override
    public boolean isAvailable() {
        try {
            ollamaWebClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(PROBE_TIMEOUT)
                    .block();
            return true;
        } catch (RuntimeException e) {
            log.warn("Ollama health probe failed: {}", e.getMessage());
            return false;
        }
    }

    private String extractContent(JsonNode response) {
        if (response == null || !response.has("message")) {
            throw new GenerationException(Reason.INVALID_RESPONSE,
                    "Invalid response format from Ollama: " + ExternalCallLogger.truncate(String.valueOf(response), 200));
        }
        JsonNode message = response.path("message");
        String role = message.path("role").asText();
        if (!"assistant".equals(role)) {
            throw new GenerationException(Reason.INVALID_RESPONSE, "Expected assistant role, got: " + role);
        }
        return message.path("content").asText("");
    }

    /**
     * Maps transport errors to a failure reason. Timeouts are checked first because
     * Reactor Netty wraps read timeouts in {@link WebClientRequestException}.
     */
    GenerationException translate(Throwable error) {
        Throwable unwrapped = Exceptions.unwrap(error);

        if (hasCause(error, InterruptedException.class)) {
            Thread.currentThread().interrupt();
            return new GenerationException(Reason.CANCELLED, "Ollama call was cancelled", unwrapped);
        }
        if (hasCause(error, TimeoutException.class)
                || hasCause(error, io.netty.handler.timeout.TimeoutException.class)) {
            return new GenerationException(Reason.TIMEOUT,
                    "Timeout while communicating with Ollama service", unwrapped);
        }
        if (hasCause(error, DecodingException.class) || hasCause(error, JsonProcessingException.class)) {
            return new GenerationException(Reason.INVALID_RESPONSE, "Invalid JSON response from Ollama service", unwrapped);
        }
        if (unwrapped instanceof WebClientResponseException responseError) {
            return new GenerationException(Reason.UNAVAILABLE,
                    "Ollama request failed with status " + responseError.getStatusCode().value() + ": "
                            + ExternalCallLogger.truncate(responseError.getResponseBodyAsString(), 200),
                    unwrapped);
        }
        if (hasCause(error, ConnectException.class)) {
            return new GenerationException(Reason.UNAVAILABLE,
                    "Cannot connect to Ollama at " + props.getOllama().getBaseUrl(), unwrapped);
        }
        if (unwrapped instanceof WebClientRequestException) {
            return new GenerationException(Reason.UNAVAILABLE,
                    "Network error while communicating with Ollama: " + unwrapped.getMessage(), unwrapped);
        }
        return new GenerationException(Reason.UNAVAILABLE, "Ollama client error: " + unwrapped.getMessage(), unwrapped);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
