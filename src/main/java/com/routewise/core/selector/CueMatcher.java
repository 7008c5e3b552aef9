package com.routewise.core.selector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Word-boundary, case-insensitive matching of a fixed list of cue phrases.
 */
final class CueMatcher {

    private record Cue(String phrase, Pattern pattern) {}

    private final List<Cue> cues;

    CueMatcher(Collection<String> phrases) {
        var compiled = new ArrayList<Cue>();
        for (String phrase : phrases) {
            if (phrase == null || phrase.isBlank()) {
                continue;
            }
            String lower = phrase.trim().toLowerCase(Locale.ROOT);
            compiled.add(new Cue(lower, Pattern.compile("\\b" + Pattern.quote(lower) + "\\b")));
        }
        this.cues = List.copyOf(compiled);
    }

    /**
     * Returns the cue phrases found in {@code text}, in declaration order.
     */
    List<String> find(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        var found = new ArrayList<String>();
        for (Cue cue : cues) {
            if (cue.pattern().matcher(lower).find()) {
                found.add(cue.phrase());
            }
        }
        return found;
    }

    boolean matchesAny(String text) {
        return !find(text).isEmpty();
    }
}
