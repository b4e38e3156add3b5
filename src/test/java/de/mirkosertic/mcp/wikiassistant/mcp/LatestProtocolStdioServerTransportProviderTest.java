package de.mirkosertic.mcp.wikiassistant.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.spec.ProtocolVersions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LatestProtocolStdioServerTransportProvider Tests")
class LatestProtocolStdioServerTransportProviderTest {

    private final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());

    @Test
    @DisplayName("Offers the newest revision first and keeps the oldest as fallback")
    void offersNewestFirst() {
        final List<String> versions = new LatestProtocolStdioServerTransportProvider(jsonMapper).protocolVersions();

        assertThat(versions.get(0)).isEqualTo(ProtocolVersions.MCP_2025_06_18);
        assertThat(versions).endsWith(ProtocolVersions.MCP_2024_11_05);
    }

    @Test
    @DisplayName("Should reject an empty version list")
    void rejectsEmptyList() {
        assertThatThrownBy(() -> new LatestProtocolStdioServerTransportProvider(jsonMapper, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
