package com.purchasingpower.micros.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fixed mapping from handler to the tools it may offer the model. Built once from the
 * registered {@link Tool} beans; only the logging handler may offer write tools.
 */
@Slf4j
@Component
public class HandlerToolsets {

    private static final Map<HandlerKind, List<String>> TOOL_NAMES = Map.of(
            HandlerKind.SEARCH, List.of("tool_search_food", "tool_list_foods", "tool_lookup_upc"),
            HandlerKind.LOGGING, List.of("tool_log_meal", "tool_list_foods", "tool_list_meals"),
            HandlerKind.ANALYSIS, List.of("tool_compute_day", "tool_get_user_goals"),
            HandlerKind.RECOMMEND, List.of("tool_compute_day", "tool_get_user_goals"));

    private final Map<HandlerKind, List<Tool>> toolsets;

    public HandlerToolsets(List<Tool> tools) {
        Map<String, Tool> byName = tools.stream()
                .collect(Collectors.toMap(Tool::getName, Function.identity()));

        EnumMap<HandlerKind, List<Tool>> built = new EnumMap<>(HandlerKind.class);
        for (HandlerKind kind : HandlerKind.values()) {
            List<Tool> toolset = TOOL_NAMES.get(kind).stream()
                    .map(name -> {
                        Tool tool = byName.get(name);
                        if (tool == null) {
                            throw new IllegalStateException("Tool '" + name + "' required by " + kind + " is not registered");
                        }
                        if (tool.getCategory() == Tool.ToolCategory.ACTION && kind != HandlerKind.LOGGING) {
                            throw new IllegalStateException("Write tool '" + name + "' is only allowed for " + HandlerKind.LOGGING);
                        }
                        return tool;
                    })
                    .collect(Collectors.toList());
            built.put(kind, Collections.unmodifiableList(toolset));
            log.debug("Toolset {}: {}", kind, TOOL_NAMES.get(kind));
        }
        this.toolsets = Collections.unmodifiableMap(built);
    }

    public List<Tool> forHandler(HandlerKind kind) {
        return toolsets.get(kind);
    }
}
