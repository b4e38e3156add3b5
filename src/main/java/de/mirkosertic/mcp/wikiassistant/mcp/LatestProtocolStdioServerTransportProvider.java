package de.mirkosertic.mcp.wikiassistant.mcp;

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.ProtocolVersions;

import java.util.List;

/**
 * STDIO transport that negotiates the newer MCP protocol revisions.
 * <p>
 * {@link StdioServerTransportProvider} only offers {@code 2024-11-05}. Clients that speak a
 * newer revision get it, older clients fall back to the last entry.
 */
public class LatestProtocolStdioServerTransportProvider extends StdioServerTransportProvider {

    static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of(
            ProtocolVersions.MCP_2025_06_18,
            ProtocolVersions.MCP_2025_03_26,
            ProtocolVersions.MCP_2024_11_05
    );

    private final List<String> protocolVersions;

    public LatestProtocolStdioServerTransportProvider(final McpJsonMapper jsonMapper) {
        this(jsonMapper, SUPPORTED_PROTOCOL_VERSIONS);
    }

    /**
     * @param protocolVersions offered revisions, newest first
     */
    LatestProtocolStdioServerTransportProvider(final McpJsonMapper jsonMapper, final List<String> protocolVersions) {
        super(jsonMapper);
        if (protocolVersions.isEmpty()) {
            throw new IllegalArgumentException("At least one protocol version is required");
        }
        this.protocolVersions = List.copyOf(protocolVersions);
    }

    @Override
    public List<String> protocolVersions() {
        return protocolVersions;
    }
}
