package de.mirkosertic.mcp.wikiassistant.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps tool response DTOs into MCP tool results.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    /**
     * Serialize the response as the single text content of the result. The result is flagged
     * as an error when the response reports {@code success=false}.
     */
    public static McpSchema.CallToolResult createResult(final ToolResponse response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(!response.success())
                .build();
    }

    /**
     * An error result carrying only a message, for failures before a response DTO exists.
     */
    public static McpSchema.CallToolResult createErrorResult(final String errorMessage) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", errorMessage);
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(body))))
                .isError(true)
                .build();
    }

    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            logger.error("Failed to serialize tool response {}", obj.getClass().getSimpleName(), e);
            return "{\"success\":false,\"error\":\"JSON serialization error\"}";
        }
    }
}
