package com.purchasingpower.remediation.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemediateResponse {

    @JsonProperty("remediated_code")
    private String remediatedCode;
}
