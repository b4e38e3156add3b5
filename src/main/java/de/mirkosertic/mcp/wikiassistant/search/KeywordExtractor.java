package de.mirkosertic.mcp.wikiassistant.search;

import de.mirkosertic.mcp.wikiassistant.generation.TextGenerationException;
import de.mirkosertic.mcp.wikiassistant.generation.TextGenerator;
import de.mirkosertic.mcp.wikiassistant.util.TextCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a question into weighted search keywords.
 * <p>
 * The weighting is delegated to the {@link TextGenerator}, which answers with
 * {@code term:weight} lines. When the generator fails or none of its lines survive parsing,
 * every question token longer than two characters becomes a keyword of weight 10.
 */
public class KeywordExtractor {

    private static final Logger logger = LoggerFactory.getLogger(KeywordExtractor.class);

    static final double FALLBACK_WEIGHT = WeightedKeyword.MAX_WEIGHT;
    static final int FALLBACK_MIN_TOKEN_LENGTH = 3;

    /** Plain decimal numbers, optionally signed, optionally with exponent. */
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Comparator<WeightedKeyword> BY_WEIGHT_DESCENDING =
            Comparator.comparingDouble(WeightedKeyword::weight).reversed();

    private final TextGenerator generator;
    private final PromptBuilder promptBuilder;

    public KeywordExtractor(final TextGenerator generator, final PromptBuilder promptBuilder) {
        this.generator = generator;
        this.promptBuilder = promptBuilder;
    }

    /**
     * Weighted keywords for the question, highest weight first. Equal weights keep the order
     * in which they were produced.
     */
    public List<WeightedKeyword> extract(final String question) {
        List<WeightedKeyword> keywords;
        try {
            final String response = generator.generate(promptBuilder.keywordPrompt(question));
            keywords = parse(response);
            if (keywords.isEmpty()) {
                logger.info("No usable keyword lines in generator response, falling back to question tokens");
                keywords = fallback(question);
            }
        } catch (final TextGenerationException e) {
            logger.warn("Keyword generation failed, falling back to question tokens: {}", e.getMessage());
            keywords = fallback(question);
        }
        keywords.sort(BY_WEIGHT_DESCENDING);
        logger.info("Weighted keywords: {}", keywords);
        return keywords;
    }

    /**
     * Parse {@code term:weight} lines. Lines without a separator, with a term shorter than two
     * characters, or with a weight that is not a number within [1, 10] are skipped.
     *
     * @return keywords in response order, possibly empty
     */
    public static List<WeightedKeyword> parse(final String response) {
        final List<WeightedKeyword> keywords = new ArrayList<>();
        if (response == null) {
            return keywords;
        }
        for (final String rawLine : TextCleaner.stripInvalidCharacters(response).split("\\R")) {
            final String line = rawLine.trim();
            final int separator = line.indexOf(':');
            if (separator < 0) {
                continue;
            }
            final String term = line.substring(0, separator).trim().toLowerCase(Locale.ROOT);
            final String weightText = line.substring(separator + 1).trim();
            if (term.length() <= 1 || !NUMBER.matcher(weightText).matches()) {
                logger.debug("Skipping keyword line '{}'", line);
                continue;
            }
            final double weight = Double.parseDouble(weightText);
            if (weight < WeightedKeyword.MIN_WEIGHT || weight > WeightedKeyword.MAX_WEIGHT) {
                logger.debug("Skipping keyword line '{}', weight out of range", line);
                continue;
            }
            keywords.add(new WeightedKeyword(term, weight));
        }
        return keywords;
    }

    /**
     * Whitespace tokens of the lowercased question longer than two characters, each with weight 10.
     */
    public static List<WeightedKeyword> fallback(final String question) {
        final List<WeightedKeyword> keywords = new ArrayList<>();
        if (question == null) {
            return keywords;
        }
        for (final String token : WHITESPACE.split(question.toLowerCase(Locale.ROOT))) {
            if (token.length() >= FALLBACK_MIN_TOKEN_LENGTH) {
                keywords.add(new WeightedKeyword(token, FALLBACK_WEIGHT));
            }
        }
        return keywords;
    }
}
