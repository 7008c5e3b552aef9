package com.routewise.core.selector;

import com.routewise.core.model.ComplexityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rule-based complexity classification.
 * <p>
 * Each rule casts votes for a class: text length votes once for the band it
 * falls in, any freshness cue votes for {@link ComplexityClass#MEDIUM}, and
 * multi-step cues vote for {@link ComplexityClass#COMPLEX} (twice when two or
 * more different cues or a numbered list appear). The class with the most
 * votes wins; ties go to the higher class.
 */
@Component
public class RequestClassifier {

    private static final Logger log = LoggerFactory.getLogger(RequestClassifier.class);

    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
    private static final Pattern NUMBERED_STEPS = Pattern.compile("(?s)\\b1[.)]\\s.*\\b2[.)]\\s");

    private final ClassifierProperties properties;
    private final CueMatcher multiStep;
    private final CueMatcher freshness;
    private final CueMatcher months;

    public RequestClassifier(ClassifierProperties properties) {
        this.properties = properties;
        this.multiStep = new CueMatcher(properties.getMultiStepCues());
        this.freshness = new CueMatcher(properties.getFreshnessCues());
        this.months = new CueMatcher(properties.getMonthNames());
    }

    public ComplexityClass classify(String text) {
        String body = text == null ? "" : text.strip();
        int[] votes = new int[ComplexityClass.values().length];

        votes[lengthBand(body.length()).ordinal()]++;

        if (!freshnessCues(body).isEmpty()) {
            votes[ComplexityClass.MEDIUM.ordinal()]++;
        }

        List<String> steps = multiStepCues(body);
        if (!steps.isEmpty()) {
            votes[ComplexityClass.COMPLEX.ordinal()]++;
            if (steps.size() >= 2) {
                votes[ComplexityClass.COMPLEX.ordinal()]++;
            }
        }

        ComplexityClass winner = ComplexityClass.SIMPLE;
        for (ComplexityClass candidate : ComplexityClass.values()) {
            // >= so later (higher) classes win ties
            if (votes[candidate.ordinal()] >= votes[winner.ordinal()]) {
                winner = candidate;
            }
        }
        log.debug("Classified request ({} chars) as {} with votes {}/{}/{}",
                body.length(), winner, votes[0], votes[1], votes[2]);
        return winner;
    }

    /**
     * Multi-step cues found in the text; a numbered list counts as one cue.
     */
    public List<String> multiStepCues(String text) {
        var found = new ArrayList<>(multiStep.find(text));
        if (text != null && NUMBERED_STEPS.matcher(text).find()) {
            found.add("numbered steps");
        }
        return found;
    }

    /**
     * Information-freshness cues, including date references when enabled.
     */
    public List<String> freshnessCues(String text) {
        var found = new ArrayList<>(freshness.find(text));
        if (text != null && properties.isDateReferencesEnabled()) {
            String lower = text.toLowerCase(Locale.ROOT);
            var year = YEAR.matcher(lower);
            if (year.find()) {
                found.add(year.group());
            }
            found.addAll(months.find(lower));
        }
        return found;
    }

    private ComplexityClass lengthBand(int length) {
        if (length >= properties.getComplexLength()) {
            return ComplexityClass.COMPLEX;
        }
        if (length >= properties.getMediumLength()) {
            return ComplexityClass.MEDIUM;
        }
        return ComplexityClass.SIMPLE;
    }
}
