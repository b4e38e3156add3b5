package de.mirkosertic.mcp.wikiassistant.search;

import de.mirkosertic.mcp.wikiassistant.corpus.Page;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Scores pages against weighted keywords.
 * <p>
 * All comparisons are case-insensitive. For a keyword with weight {@code w}:
 * <table>
 *   <caption>Score contributions</caption>
 *   <tr><td>keyword equals the whole title</td><td>50w</td></tr>
 *   <tr><td>otherwise keyword is a substring of the title</td><td>20w</td></tr>
 *   <tr><td>keyword is a whole word of the title</td><td>25w</td></tr>
 *   <tr><td>keyword is a substring of the space-joined categories</td><td>15w</td></tr>
 *   <tr><td>each non-overlapping occurrence in the content</td><td>2w</td></tr>
 *   <tr><td>keyword is a whole word within the first 200 content words</td><td>5w</td></tr>
 *   <tr><td>each title word containing the keyword, keywords longer than 3 characters only</td><td>3w</td></tr>
 * </table>
 * Scoring never mutates pages and is safe to run in parallel.
 */
public class RelevanceScorer {

    static final double EXACT_TITLE_POINTS = 50.0;
    static final double TITLE_SUBSTRING_POINTS = 20.0;
    static final double TITLE_WORD_BOUNDARY_POINTS = 25.0;
    static final double CATEGORY_POINTS = 15.0;
    static final double CONTENT_OCCURRENCE_POINTS = 2.0;
    static final double CONTENT_START_WORD_BOUNDARY_POINTS = 5.0;
    static final double TITLE_WORD_PARTIAL_POINTS = 3.0;

    static final int CONTENT_START_WORDS = 200;
    static final int PARTIAL_MATCH_MIN_LENGTH = 4;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Comparator<MatchResult> BY_SCORE_DESCENDING =
            Comparator.comparingDouble(MatchResult::score).reversed();

    /**
     * Relevance of one page. Zero means the page is unrelated to all keywords.
     */
    public double score(final Page page, final List<WeightedKeyword> keywords) {
        return scoreCompiled(page, compile(keywords));
    }

    /**
     * The {@code topN} most relevant pages, best first.
     */
    public List<Page> rank(final List<Page> pages, final List<WeightedKeyword> keywords, final int topN) {
        final List<MatchResult> matches = rankWithScores(pages, keywords, topN);
        final List<Page> ranked = new ArrayList<>(matches.size());
        for (final MatchResult match : matches) {
            ranked.add(match.page());
        }
        return ranked;
    }

    /**
     * The {@code topN} most relevant pages with their scores, best first. Pages scoring zero are
     * left out; equal scores keep corpus order.
     *
     * @throws IllegalArgumentException if {@code topN} is not positive
     */
    public List<MatchResult> rankWithScores(final List<Page> pages, final List<WeightedKeyword> keywords,
                                            final int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be positive, was " + topN);
        }
        final List<CompiledKeyword> compiled = compile(keywords);
        final double[] scores = new double[pages.size()];
        IntStream.range(0, pages.size())
                .parallel()
                .forEach(i -> scores[i] = scoreCompiled(pages.get(i), compiled));

        final List<MatchResult> matches = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > 0) {
                matches.add(new MatchResult(pages.get(i), scores[i]));
            }
        }
        // List.sort is stable, ties keep corpus order
        matches.sort(BY_SCORE_DESCENDING);
        return new ArrayList<>(matches.subList(0, Math.min(topN, matches.size())));
    }

    private double scoreCompiled(final Page page, final List<CompiledKeyword> keywords) {
        final String title = page.title().toLowerCase(Locale.ROOT);
        final String content = page.content().toLowerCase(Locale.ROOT);
        final String categories = String.join(" ", page.categories()).toLowerCase(Locale.ROOT);
        final String contentStart = firstWords(content, CONTENT_START_WORDS);
        final String[] titleWords = splitWords(title);

        double score = 0.0;
        for (final CompiledKeyword keyword : keywords) {
            final String term = keyword.term();
            final double weight = keyword.weight();

            if (term.equals(title)) {
                score += EXACT_TITLE_POINTS * weight;
            } else if (title.contains(term)) {
                score += TITLE_SUBSTRING_POINTS * weight;
            }

            if (categories.contains(term)) {
                score += CATEGORY_POINTS * weight;
            }

            score += countOccurrences(content, term) * CONTENT_OCCURRENCE_POINTS * weight;

            if (keyword.wholeWord().matcher(title).find()) {
                score += TITLE_WORD_BOUNDARY_POINTS * weight;
            }

            if (keyword.wholeWord().matcher(contentStart).find()) {
                score += CONTENT_START_WORD_BOUNDARY_POINTS * weight;
            }

            if (term.length() >= PARTIAL_MATCH_MIN_LENGTH) {
                for (final String word : titleWords) {
                    if (word.contains(term)) {
                        score += TITLE_WORD_PARTIAL_POINTS * weight;
                    }
                }
            }
        }
        return score;
    }

    /**
     * Non-overlapping occurrences of {@code term} in {@code text}.
     */
    static int countOccurrences(final String text, final String term) {
        if (term.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = text.indexOf(term);
        while (from >= 0) {
            count++;
            from = text.indexOf(term, from + term.length());
        }
        return count;
    }

    static String firstWords(final String text, final int limit) {
        final String[] words = splitWords(text);
        return String.join(" ", words.length <= limit ? words : Arrays.copyOf(words, limit));
    }

    private static String[] splitWords(final String text) {
        return Arrays.stream(WHITESPACE.split(text))
                .filter(word -> !word.isEmpty())
                .toArray(String[]::new);
    }

    private static List<CompiledKeyword> compile(final List<WeightedKeyword> keywords) {
        final List<CompiledKeyword> compiled = new ArrayList<>(keywords.size());
        for (final WeightedKeyword keyword : keywords) {
            compiled.add(new CompiledKeyword(keyword.term(), keyword.weight(),
                    Pattern.compile("\\b" + Pattern.quote(keyword.term()) + "\\b", Pattern.UNICODE_CHARACTER_CLASS)));
        }
        return compiled;
    }

    private record CompiledKeyword(String term, double weight, Pattern wholeWord) {
    }
}
