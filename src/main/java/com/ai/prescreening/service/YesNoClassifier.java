package com.ai.prescreening.service;

import com.ai.prescreening.conversation.YesNoResult;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies candidate utterances into YES, NO, or UNKNOWN.
 * Covers Flemish/Dutch and English variations, the languages the offline interpreter is used with.
 */
@Service
public class YesNoClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "ja", "jaja", "jawel", "jazeker", "zeker", "ok", "oke", "oké", "okay", "goed", "prima",
            "dat klopt", "klopt", "tuurlijk", "natuurlijk", "zeker weten", "absoluut",
            "yes", "yeah", "yep", "yup", "sure", "correct", "right", "absolutely", "definitely"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "nee", "neen", "nee hoor", "neenee", "helaas niet", "niet", "nooit", "liever niet", "geen tijd",
            "no", "nope", "nah", "not now", "not yet", "never"
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(ja|jawel|zeker|ok|oke|okay|prima|klopt|tuurlijk|natuurlijk|absoluut|yes|yeah|yep|sure|correct|absolutely|definitely)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(nee|neen|niet|nooit|geen|helaas|no|nope|nah|not|never)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
    );

    /**
     * Classify candidate input. Mixed signals ("ja, maar niet in het weekend") are UNKNOWN.
     */
    public YesNoResult classify(String userInput) {
        if (userInput == null || userInput.isBlank()) {
            return YesNoResult.UNKNOWN;
        }
        String normalized = userInput.trim().toLowerCase().replaceAll("[.!?,]+$", "");

        if (normalized.length() <= 15) {
            if (AFFIRMATIVE_EXACT.contains(normalized)) {
                return YesNoResult.YES;
            }
            if (NEGATIVE_EXACT.contains(normalized)) {
                return YesNoResult.NO;
            }
        }

        boolean affirmative = AFFIRMATIVE_PATTERN.matcher(normalized).find();
        boolean negative = NEGATIVE_PATTERN.matcher(normalized).find();
        if (affirmative && negative) {
            return YesNoResult.UNKNOWN;
        }
        if (affirmative) {
            return YesNoResult.YES;
        }
        if (negative) {
            return YesNoResult.NO;
        }
        return YesNoResult.UNKNOWN;
    }

    public boolean isAffirmative(String userInput) {
        return classify(userInput) == YesNoResult.YES;
    }

    public boolean isNegative(String userInput) {
        return classify(userInput) == YesNoResult.NO;
    }
}
