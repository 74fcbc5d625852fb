package com.purchasingpower.remediation.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

    private String status;

    public static HealthResponse healthy() {
        return new HealthResponse("healthy");
    }
}
