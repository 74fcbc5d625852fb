package com.purchasingpower.remediation.configuration;

import com.purchasingpower.remediation.model.Language;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Settings of the remediation loop itself.
 *
 * <pre>
 * app:
 *   remediation:
 *     max-retries: 5
 *     temperature: 0.1
 *     supported-languages: [python, javascript, java, go, csharp, "c#"]
 * </pre>
 */
@Data
public class RemediationProperties {

    /**
     * Upper bound on generation+scan round trips for one request.
     */
    @Min(1)
    private int maxRetries = 5;

    /**
     * Sampling temperature passed to the generator. Kept low for conservative fixes.
     */
    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.1;

    /**
     * Language names accepted on the API. Each must be an alias of a {@link Language}.
     */
    @NotEmpty
    private List<String> supportedLanguages =
            new ArrayList<>(List.of("python", "javascript", "java", "go", "csharp", "c#"));

    /**
     * Resolves a requested language if it is both configured and known to the scanner.
     */
    public Optional<Language> resolveLanguage(String requested) {
        if (requested == null) {
            return Optional.empty();
        }
        String normalized = requested.trim().toLowerCase(Locale.ROOT);
        boolean configured = supportedLanguages.stream()
                .anyMatch(name -> name.trim().toLowerCase(Locale.ROOT).equals(normalized));
        return configured ? Language.fromName(normalized) : Optional.empty();
    }
}
