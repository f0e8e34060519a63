package com.linlay.calculatoragent.model.api;

import java.util.Map;

public record ToolDetailResponse(
        ToolDetail tool
) {
    public record ToolDetail(
            String name,
            String description,
            String afterCallHint,
            Map<String, Object> parameters
    ) {
    }
}
