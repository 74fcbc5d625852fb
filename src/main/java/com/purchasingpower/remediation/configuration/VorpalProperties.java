package com.purchasingpower.remediation.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class VorpalProperties {

    /**
     * Scanner binary; the container image installs it here.
     */
    @NotBlank
    private String path = "/usr/local/bin/vorpal";

    /**
     * Used when {@link #path} does not exist, e.g. when running from a checkout.
     */
    private String fallbackPath = "resources/vorpal_cli";

    @Min(1)
    private int timeoutSeconds = 60;
}
