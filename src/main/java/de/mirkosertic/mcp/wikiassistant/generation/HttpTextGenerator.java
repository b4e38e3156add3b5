package de.mirkosertic.mcp.wikiassistant.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link TextGenerator} calling a JSON-over-HTTP completion endpoint.
 * <p>
 * The request body is {@code {"prompt": "..."}}, the completion is read from a string field of
 * the JSON response ({@code output} by default).
 */
public class HttpTextGenerator implements TextGenerator {

    private static final Logger logger = LoggerFactory.getLogger(HttpTextGenerator.class);

    private final URI endpoint;
    private final Duration timeout;
    private final String responseField;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public HttpTextGenerator(final URI endpoint, final Duration timeout, final String responseField) {
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.responseField = responseField;
        this.objectMapper = new ObjectMapper();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String generate(final String prompt) throws TextGenerationException {
        final String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("prompt", prompt));
        } catch (final JsonProcessingException e) {
            throw new TextGenerationException("Could not encode prompt", e);
        }

        final HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        final HttpResponse<String> response;
        try {
            logger.debug("Sending prompt of {} characters to {}", prompt.length(), endpoint);
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (final HttpTimeoutException e) {
            throw new TextGenerationException("Generator timed out after " + timeout.toMillis() + "ms", e);
        } catch (final IOException e) {
            throw new TextGenerationException("Generator unreachable: " + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TextGenerationException("Interrupted while waiting for the generator", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new TextGenerationException("Generator answered HTTP " + response.statusCode());
        }

        final JsonNode json;
        try {
            json = objectMapper.readTree(response.body());
        } catch (final JsonProcessingException e) {
            throw new TextGenerationException("Generator response is not JSON: " + e.getOriginalMessage(), e);
        }
        final JsonNode output = json != null ? json.get(responseField) : null;
        if (output == null || !output.isTextual()) {
            throw new TextGenerationException("Generator response has no text field '" + responseField + "'");
        }
        return output.asText();
    }
}
