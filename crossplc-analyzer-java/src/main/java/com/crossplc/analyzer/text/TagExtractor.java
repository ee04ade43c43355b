package com.crossplc.analyzer.text;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts tag references from a fragment of control-logic text.
 *
 * A tag reference starts with an uppercase letter, may be a dotted member path and may
 * carry one array index: {@code TANK1.LEVEL[3]}. The index is stripped, so an element and
 * its array are the same tag. Lowercase identifiers, numbers, string literal contents and
 * Structured Text reserved words are never reported.
 */
public final class TagExtractor {

    private TagExtractor() {}

    private static final Pattern TAG_PATTERN = Pattern.compile(
        "\\b[A-Z][A-Z0-9_]*(?:\\.[A-Z][A-Z0-9_]*)*(?!\\w)(?:\\[[^\\]]*\\])?");

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("\\b\\w+\\b");

    private static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"]*\"|'[^']*'");

    private static final Set<String> RESERVED_WORDS = Set.of(
        "IF", "THEN", "ELSE", "ELSIF", "END_IF",
        "CASE", "OF", "END_CASE",
        "FOR", "TO", "BY", "DO", "END_FOR",
        "WHILE", "END_WHILE", "REPEAT", "UNTIL", "END_REPEAT",
        "AND", "OR", "XOR", "NOT", "MOD",
        "TRUE", "FALSE", "RETURN", "EXIT"
    );

    /**
     * Returns the first tag referenced in {@code expr} with any index removed,
     * or null if there is none.
     */
    public static String extractTag(String expr) {
        if (expr == null) return null;
        Matcher m = TAG_PATTERN.matcher(stripStringLiterals(expr));
        while (m.find()) {
            String tag = baseName(m.group());
            if (!isReservedWord(tag)) {
                return tag;
            }
        }
        return null;
    }

    /** All tags referenced in {@code expr}, indices removed, in order of first appearance. */
    public static Set<String> extractTags(String expr) {
        Set<String> tags = new LinkedHashSet<>();
        if (expr == null) return tags;
        Matcher m = TAG_PATTERN.matcher(stripStringLiterals(expr));
        while (m.find()) {
            String tag = baseName(m.group());
            if (!isReservedWord(tag)) {
                tags.add(tag);
            }
        }
        return tags;
    }

    /**
     * Every word token in {@code text}, without the uppercase or reserved word filters.
     * Used where any identifier may be a tag, such as transition guards.
     */
    public static Set<String> extractIdentifiers(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text == null) return words;
        Matcher m = IDENTIFIER_PATTERN.matcher(text);
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }

    public static boolean isReservedWord(String word) {
        return word != null && RESERVED_WORDS.contains(word.toUpperCase(Locale.ROOT));
    }

    static String baseName(String reference) {
        int bracket = reference.indexOf('[');
        return bracket >= 0 ? reference.substring(0, bracket) : reference;
    }

    static String stripStringLiterals(String text) {
        return STRING_LITERAL.matcher(text).replaceAll(" ");
    }
}
