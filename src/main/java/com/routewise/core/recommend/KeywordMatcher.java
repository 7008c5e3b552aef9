package com.routewise.core.recommend;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Pure keyword-overlap scoring between a provider's declared keywords and the
 * tokens of a context text. Needs neither the catalog nor the learning store.
 * <p>
 * A single-word keyword matches a token when they are equal, when the token
 * contains the keyword (keywords of four or more characters), or when both
 * reduce to the same stem. A multi-word keyword ({@code "web search"},
 * {@code "text_generation"}) matches only when every word matches.
 */
public final class KeywordMatcher {

    /**
     * @param score   matched / declared, in [0,1]
     * @param matched the declared keywords that matched, sorted
     */
    public record MatchResult(double score, Set<String> matched) {
        public static final MatchResult NONE = new MatchResult(0.0, Set.of());
    }

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WORD_SPLIT = Pattern.compile("[\\s_\\-]+");
    private static final int MIN_SUBSTRING_LENGTH = 4;
    private static final int MIN_STEM_LENGTH = 3;

    private KeywordMatcher() {} // utility class

    /**
     * Lower-cases and splits text on anything that is not a letter or digit.
     */
    public static Set<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        var tokens = new LinkedHashSet<String>();
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static MatchResult match(Set<String> declaredKeywords, Set<String> contextTokens) {
        if (declaredKeywords == null || declaredKeywords.isEmpty()
                || contextTokens == null || contextTokens.isEmpty()) {
            return MatchResult.NONE;
        }
        var matched = new TreeSet<String>();
        for (String keyword : declaredKeywords) {
            if (keywordMatches(keyword.toLowerCase(Locale.ROOT), contextTokens)) {
                matched.add(keyword);
            }
        }
        if (matched.isEmpty()) {
            return MatchResult.NONE;
        }
        return new MatchResult((double) matched.size() / declaredKeywords.size(), Set.copyOf(matched));
    }

    static boolean keywordMatches(String keyword, Set<String> tokens) {
        String[] words = WORD_SPLIT.split(keyword.trim());
        return words.length > 0 && Arrays.stream(words)
                .filter(w -> !w.isEmpty())
                .allMatch(word -> wordMatches(word, tokens));
    }

    private static boolean wordMatches(String word, Set<String> tokens) {
        if (tokens.contains(word)) {
            return true;
        }
        String wordStem = stem(word);
        for (String token : tokens) {
            if (word.length() >= MIN_SUBSTRING_LENGTH && token.contains(word)) {
                return true;
            }
            if (stem(token).equals(wordStem)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Light suffix stripping; enough to equate "searches", "searching" and "search".
     */
    static String stem(String word) {
        String w = word.toLowerCase(Locale.ROOT);
        if (w.endsWith("ies") && w.length() - 3 >= MIN_STEM_LENGTH) {
            return w.substring(0, w.length() - 3) + "y";
        }
        for (String suffix : new String[] {"ing", "edly", "ed", "es", "ly", "s"}) {
            if (w.endsWith(suffix) && w.length() - suffix.length() >= MIN_STEM_LENGTH) {
                return w.substring(0, w.length() - suffix.length());
            }
        }
        return w;
    }
}
