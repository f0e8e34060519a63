package com.linlay.calculatoragent.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.calculatoragent.calculator.CalculatorEngine;
import com.linlay.calculatoragent.model.api.ApiResponse;
import com.linlay.calculatoragent.model.api.EvaluateRequest;
import com.linlay.calculatoragent.model.api.EvaluateResponse;
import com.linlay.calculatoragent.model.api.ToolDetailResponse;
import com.linlay.calculatoragent.model.api.ToolInvokeRequest;
import com.linlay.calculatoragent.model.api.ToolListResponse;
import com.linlay.calculatoragent.tool.BaseTool;
import com.linlay.calculatoragent.tool.ToolRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/calc")
public class CalculatorController {

    private static final Logger log = LoggerFactory.getLogger(CalculatorController.class);

    private final CalculatorEngine calculatorEngine;
    private final ToolRegistry toolRegistry;

    public CalculatorController(CalculatorEngine calculatorEngine, ToolRegistry toolRegistry) {
        this.calculatorEngine = calculatorEngine;
        this.toolRegistry = toolRegistry;
    }

    @PostMapping("/evaluate")
    public ApiResponse<EvaluateResponse> evaluate(@Valid @RequestBody EvaluateRequest request) {
        CalculatorEngine.Evaluation evaluation = calculatorEngine.evaluateDetailed(request.query());
        return ApiResponse.success(new EvaluateResponse(
                evaluation.category().value(),
                evaluation.answer(),
                evaluation.ok()
        ));
    }

    @GetMapping("/tools")
    public ApiResponse<ToolListResponse> tools() {
        List<ToolListResponse.ToolSummary> tools = toolRegistry.list().stream()
                .map(tool -> new ToolListResponse.ToolSummary(tool.name(), tool.description(), tool.parametersSchema()))
                .toList();
        return ApiResponse.success(new ToolListResponse(tools));
    }

    @GetMapping("/tool")
    public ApiResponse<ToolDetailResponse> tool(@RequestParam String toolName) {
        BaseTool tool = toolRegistry.find(toolName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tool: " + toolName));
        return ApiResponse.success(new ToolDetailResponse(new ToolDetailResponse.ToolDetail(
                tool.name(),
                tool.description(),
                tool.afterCallHint(),
                tool.parametersSchema()
        )));
    }

    @PostMapping("/tool/invoke")
    public ApiResponse<JsonNode> invoke(@Valid @RequestBody ToolInvokeRequest request) {
        log.info("Received tool invocation toolName={}", request.toolName());
        return ApiResponse.success(toolRegistry.invoke(request.toolName(), request.arguments()));
    }
}
