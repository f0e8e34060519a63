package com.linlay.calculatoragent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, BaseTool> toolsByName;

    public ToolRegistry(List<BaseTool> tools) {
        Map<String, BaseTool> byName = new LinkedHashMap<>();
        for (BaseTool tool : tools) {
            String name = normalizeName(tool.name());
            if (byName.putIfAbsent(name, tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + name);
            }
        }
        this.toolsByName = byName;
    }

    public JsonNode invoke(String toolName, Map<String, Object> args) {
        BaseTool tool = toolsByName.get(normalizeName(toolName));
        if (Objects.isNull(tool)) {
            throw new IllegalArgumentException("Unknown tool: " + toolName);
        }
        log.info("Invoking tool {} with argument keys {}", tool.name(), args == null ? List.of() : args.keySet());
        return tool.invoke(args == null ? Map.of() : args);
    }

    public List<BaseTool> list() {
        return toolsByName.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(Map.Entry::getValue)
                .toList();
    }

    public Optional<BaseTool> find(String toolName) {
        return Optional.ofNullable(toolsByName.get(normalizeName(toolName)));
    }

    private static String normalizeName(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
