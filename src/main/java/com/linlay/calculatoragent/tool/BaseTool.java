package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A calculator operation callable by an agent with structured arguments.
 */
public interface BaseTool {

    String name();

    String description();

    /**
     * Guidance shown to the caller after an invocation; empty when there is none.
     */
    default String afterCallHint() {
        return "";
    }

    /**
     * JSON schema of the {@code args} accepted by {@link #invoke(Map)}.
     */
    Map<String, Object> parametersSchema();

    JsonNode invoke(Map<String, Object> args);
}
