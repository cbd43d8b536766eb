package com.purchasingpower.micros.agent;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

import java.util.Map;

/**
 * An operation the model may call from inside a handler's tool loop.
 *
 * <p>Example implementation:
 * <pre>
 * public class ListMealsTool implements Tool {
 *     public String getName() { return "tool_list_meals"; }
 *
 *     public ToolResult execute(Map&lt;String, Object&gt; params, ToolContext context) {
 *         int limit = ToolParams.intOr(params, "limit", 25);
 *         return ToolResult.success(mealLogService.listMeals(context.getUserId(), limit, 0), "...");
 *     }
 * }
 * </pre>
 *
 * The acting user always comes from the {@link ToolContext}, never from model arguments.
 */
public interface Tool {

    /**
     * Unique name the model uses to call this tool (e.g. "tool_search_food").
     */
    String getName();

    /**
     * Explains to the model what the tool does and when to use it.
     */
    String getDescription();

    /**
     * JSON schema of the arguments object.
     */
    JsonObjectSchema getParameters();

    /**
     * Execute this tool with the given parameters.
     *
     * @param parameters Arguments decoded from the model's tool call
     * @param context Per-turn execution context
     * @return Tool execution result
     */
    ToolResult execute(Map<String, Object> parameters, ToolContext context);

    ToolCategory getCategory();

    default ToolSpecification toSpecification() {
        return ToolSpecification.builder()
                .name(getName())
                .description(getDescription())
                .parameters(getParameters())
                .build();
    }

    enum ToolCategory {
        /**
         * Read-only catalog, diary and goal queries.
         */
        LOOKUP,

        /**
         * Tools that write (meal logging).
         */
        ACTION
    }
}
