package de.mirkosertic.mcp.wikiassistant.mcp.dto;

import de.mirkosertic.mcp.wikiassistant.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the removePagesByTitle tool.
 */
public record RemovePagesByTitleRequest(
        @Description(value = "Case-sensitive text; every page whose title contains it is removed",
                examples = {"Login required", "Page "})
        String titleContains,

        @Nullable
        @Description("Must be true to rewrite the corpus file. Default is false.")
        Boolean confirm
) {
    public static RemovePagesByTitleRequest fromMap(final Map<String, Object> args) {
        return new RemovePagesByTitleRequest((String) args.get("titleContains"), (Boolean) args.get("confirm"));
    }

    public boolean effectiveConfirm() {
        return confirm != null && confirm;
    }
}
