package com.linlay.calculatoragent.model.api;

public record EvaluateResponse(
        String category,
        String answer,
        boolean ok
) {
}
