package com.linlay.calculatoragent.model.api;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record ToolInvokeRequest(
        @NotBlank
        String toolName,
        Map<String, Object> arguments
) {
}
