package com.linlay.calculatoragent.model.api;

import jakarta.validation.constraints.NotBlank;

public record EvaluateRequest(
        @NotBlank
        String query
) {
}
