package com.purchasingpower.remediation.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-origin access for browser clients.
 *
 * <pre>
 * app:
 *   cors:
 *     allowed-origins: ["https://console.example.com"]
 * </pre>
 */
@Data
public class CorsProperties {

    /**
     * Origin patterns allowed to call the API. {@code *} allows any site.
     */
    @NotEmpty
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    private boolean allowCredentials = true;

    @Min(0)
    private long maxAgeSeconds = 3600;
}
