package com.purchasingpower.remediation.config;

import com.purchasingpower.remediation.configuration.AppProperties;
import com.purchasingpower.remediation.configuration.CorsProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Opens the remediation API and the health check to browser clients.
 *
 * <p>Origins are registered as patterns so that {@code *} can be combined with
 * credentials; the matching request origin is echoed back.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final AppProperties props;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        CorsProperties cors = props.getCors();
        String[] origins = cors.getAllowedOrigins().toArray(String[]::new);

        for (String path : new String[]{"/api/**", "/health"}) {
            registry.addMapping(path)
                    .allowedOriginPatterns(origins)
                    .allowedMethods("*")
                    .allowedHeaders("*")
                    .allowCredentials(cors.isAllowCredentials())
                    .maxAge(cors.getMaxAgeSeconds());
        }
    }
}
