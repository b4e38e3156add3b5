package de.mirkosertic.mcp.wikiassistant.mcp;

import de.mirkosertic.mcp.wikiassistant.crawler.CrawlMode;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.RemovePagesByTitleRequest;
import de.mirkosertic.mcp.wikiassistant.mcp.dto.SearchPagesRequest;
import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SchemaGenerator Tests")
class SchemaGeneratorTest {

    record SampleRequest(
            @Description("Free text") String text,
            @Nullable @Description("How many") Integer limit,
            @Nullable Double threshold,
            @Nullable Boolean verbose,
            @Nullable CrawlMode mode,
            @Nullable List<String> tags,
            @Nullable Map<String, Object> extra
    ) {
    }

    @Test
    @DisplayName("Nullable components are optional, the rest are required")
    void requiredComponents() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(SearchPagesRequest.class);

        assertThat(schema.type()).isEqualTo("object");
        assertThat(schema.required()).containsExactly("question");
        assertThat(schema.properties()).containsOnlyKeys("question", "topN");
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should map Java types to JSON schema types")
    void mapsTypes() {
        final Map<String, Object> properties = SchemaGenerator.generateSchema(SampleRequest.class).properties();

        assertThat((Map<String, Object>) properties.get("text"))
                .containsEntry("type", "string")
                .containsEntry("description", "Free text");
        assertThat((Map<String, Object>) properties.get("limit")).containsEntry("type", "integer");
        assertThat((Map<String, Object>) properties.get("threshold")).containsEntry("type", "number");
        assertThat((Map<String, Object>) properties.get("verbose")).containsEntry("type", "boolean");
        assertThat((Map<String, Object>) properties.get("mode"))
                .containsEntry("type", "string")
                .containsEntry("enum", List.of("systematic", "random"));
        assertThat((Map<String, Object>) properties.get("tags"))
                .containsEntry("type", "array")
                .containsEntry("items", Map.of("type", "string"));
        assertThat((Map<String, Object>) properties.get("extra")).containsEntry("additionalProperties", true);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Examples are copied from the description")
    void examples() {
        final Map<String, Object> properties =
                SchemaGenerator.generateSchema(RemovePagesByTitleRequest.class).properties();

        assertThat((Map<String, Object>) properties.get("titleContains"))
                .containsEntry("examples", List.of("Login required", "Page "));
        assertThat((Map<String, Object>) properties.get("confirm")).doesNotContainKey("examples");
    }

    @Test
    @DisplayName("The empty schema has no properties")
    void emptySchema() {
        final McpSchema.JsonSchema schema = SchemaGenerator.emptySchema();

        assertThat(schema.properties()).isEmpty();
        assertThat(schema.required()).isEmpty();
    }
}
