package de.mirkosertic.mcp.wikiassistant.util;

import java.util.regex.Pattern;

/**
 * Normalizes text scraped from wiki pages or returned by the text generator.
 *
 * <p>Removed characters:</p>
 * <ul>
 *   <li>Unicode replacement characters (U+FFFD) from failed decoding</li>
 *   <li>Null and control characters other than tab, line feed and carriage return</li>
 *   <li>Zero-width characters and the byte order mark</li>
 * </ul>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000" +                    // NULL
        "\u0001-\u0008" +             // Control chars before TAB
        "\u000B-\u000C" +             // VT, FF
        "\u000E-\u001F" +             // Control chars after CR
        "\u200B" +                    // Zero-width space
        "\u200C" +                    // Zero-width non-joiner
        "\u200D" +                    // Zero-width joiner
        "\uFEFF" +                    // Byte order mark
        "\uFFFD" +                    // Replacement character
        "]"
    );

    /**
     * Any run of whitespace, including single line breaks and non-breaking spaces.
     */
    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\u00A0]+");

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * Remove invalid characters and collapse every whitespace run into a single space, so the
     * result is one line of space separated words.
     *
     * @param text the text to clean (may be null)
     * @return cleaned text, or null if input was null
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        final String withoutInvalid = INVALID_CHARS.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(withoutInvalid).replaceAll(" ").strip();
    }

    /**
     * Remove invalid characters only. Line structure is kept, which matters for generator
     * output that is parsed line by line.
     *
     * @param text the text to clean (may be null)
     * @return text without invalid characters, or null if input was null
     */
    public static String stripInvalidCharacters(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return INVALID_CHARS.matcher(text).replaceAll("");
    }
}
