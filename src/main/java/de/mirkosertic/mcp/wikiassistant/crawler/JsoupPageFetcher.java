package de.mirkosertic.mcp.wikiassistant.crawler;

import de.mirkosertic.mcp.wikiassistant.corpus.Page;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.function.BiFunction;

/**
 * {@link PageFetcher} backed by jsoup's HTTP connection.
 * <p>
 * Requests carry a browser-like {@code User-Agent}, follow redirects and are bounded by the
 * configured timeout. The page URL recorded is the final URL after redirects, which is what
 * makes random discovery deduplicable.
 */
public class JsoupPageFetcher implements PageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final CrawlerSettings settings;
    private final WikiPageExtractor extractor;

    public JsoupPageFetcher(final CrawlerSettings settings, final WikiPageExtractor extractor) {
        this.settings = settings;
        this.extractor = extractor;
    }

    @Override
    public FetchResult fetchRevision(final long oldid) {
        return fetch(settings.revisionUrl(oldid), "oldid " + oldid,
                (document, finalUrl) -> extractor.extractRevision(document, oldid, finalUrl));
    }

    @Override
    public FetchResult fetchRandom() {
        return fetch(settings.randomPageUrl(), "random page", extractor::extractDiscovered);
    }

    private FetchResult fetch(final String url, final String label,
                              final BiFunction<Document, String, Page> extraction) {
        try {
            final Connection.Response response = Jsoup.connect(url)
                    .userAgent(settings.userAgent())
                    .timeout(settings.requestTimeoutMs())
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .maxBodySize(0)
                    .execute();

            final int status = response.statusCode();
            if (status < 200 || status >= 300) {
                logger.warn("Failed to fetch {}: HTTP {}", label, status);
                return FetchResult.failed(FetchError.HTTP_STATUS, "HTTP " + status);
            }

            final String finalUrl = response.url().toString();
            final Page page = extraction.apply(response.parse(), finalUrl);
            if (page == null) {
                logger.debug("No title container on {} ({})", label, finalUrl);
                return FetchResult.empty("No title container at " + finalUrl);
            }

            logger.debug("{}: {} ({} words)", label, page.title(), page.wordCount());
            return FetchResult.fetched(page);

        } catch (final SocketTimeoutException | HttpTimeoutException e) {
            logger.warn("Timeout fetching {}: {}", label, e.getMessage());
            return FetchResult.failed(FetchError.TIMEOUT, "Timeout after " + settings.requestTimeoutMs() + "ms");
        } catch (final UnsupportedMimeTypeException e) {
            logger.warn("Unsupported content type for {}: {}", label, e.getMimeType());
            return FetchResult.failed(FetchError.EXTRACTION, "Unsupported content type " + e.getMimeType());
        } catch (final IOException e) {
            logger.warn("Error fetching {}: {}", label, e.getMessage());
            return FetchResult.failed(FetchError.NETWORK, String.valueOf(e.getMessage()));
        } catch (final RuntimeException e) {
            logger.warn("Error extracting {}", label, e);
            return FetchResult.failed(FetchError.EXTRACTION, String.valueOf(e.getMessage()));
        }
    }
}
