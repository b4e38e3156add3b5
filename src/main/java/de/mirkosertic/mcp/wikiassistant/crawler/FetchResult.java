package de.mirkosertic.mcp.wikiassistant.crawler;

import de.mirkosertic.mcp.wikiassistant.corpus.Page;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Outcome of fetching one page. Exactly one of three shapes:
 * <ul>
 *   <li>{@link Outcome#FETCHED}: {@code page} is set</li>
 *   <li>{@link Outcome#EMPTY}: nothing worth keeping, {@code message} names the reason</li>
 *   <li>{@link Outcome#FAILED}: {@code error} and {@code message} describe the failure</li>
 * </ul>
 */
public record FetchResult(
        Outcome outcome,
        @Nullable Page page,
        @Nullable FetchError error,
        String message
) {

    public enum Outcome {
        FETCHED,
        EMPTY,
        FAILED
    }

    public FetchResult {
        Objects.requireNonNull(outcome, "outcome");
        message = message != null ? message : "";
        if (outcome == Outcome.FETCHED && page == null) {
            throw new IllegalArgumentException("FETCHED result requires a page");
        }
        if (outcome == Outcome.FAILED && error == null) {
            throw new IllegalArgumentException("FAILED result requires an error type");
        }
    }

    public static FetchResult fetched(final Page page) {
        return new FetchResult(Outcome.FETCHED, page, null, "");
    }

    public static FetchResult empty(final String reason) {
        return new FetchResult(Outcome.EMPTY, null, null, reason);
    }

    public static FetchResult failed(final FetchError error, final String message) {
        return new FetchResult(Outcome.FAILED, null, error, message);
    }

    public boolean isFetched() {
        return outcome == Outcome.FETCHED;
    }
}
