package com.lead.discovery.signal;

import com.lead.discovery.core.model.SignalCategory;
import com.lead.discovery.core.model.SignalType;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Keyword libraries scanned over page text. Libraries with a fixed strength always
 * yield that strength; the others derive it from the surrounding content.
 */
public enum SignalPatternLibrary {

    LOAN(SignalType.LOAN_NEED, SignalCategory.KEYWORD, 80, null,
            "\\b(?:need|looking for|seeking|want)\\s+(?:a\\s+)?(?:business\\s+)?loan\\b",
            "\\b(?:small business|startup|working capital)\\s+(?:loan|financing)\\b",
            "\\b(?:equipment|inventory|expansion)\\s+financing\\b",
            "\\bcash flow\\s+(?:problem|issue|challenge)\\b",
            "\\bneed\\s+(?:capital|funding|money)\\b",
            "\\b(?:line of credit|credit line)\\b",
            "\\bdebt consolidation\\b",
            "\\brefinance\\b",
            "\\b(?:bridge|gap)\\s+financing\\b"),

    CONSULTING(SignalType.CONSULTING_NEED, SignalCategory.KEYWORD, 75, null,
            "\\bneed\\s+(?:help|advice|guidance|consultant)\\b",
            "\\blooking for\\s+(?:consultant|consulting|advisor)\\b",
            "\\bimprove\\s+(?:operations|efficiency|processes)\\b",
            "\\b(?:business|strategic|management)\\s+consulting\\b",
            "\\bdigital transformation\\b",
            "\\bprocess improvement\\b",
            "\\borganizational\\s+(?:change|restructuring)\\b",
            "\\bcost\\s+reduction\\b",
            "\\bperformance\\s+optimization\\b"),

    CONSULTING_PROBLEMS(SignalType.CONSULTING_NEED, SignalCategory.PROBLEM_INDICATOR, 70, 65,
            "\\bproblem\\s+with\\s+\\w+",
            "\\bchallenge\\s+in\\s+\\w+",
            "\\bstruggling\\s+with\\s+\\w+",
            "\\bdifficulty\\s+\\w+ing",
            "\\bnot\\s+sure\\s+how\\s+to\\s+\\w+",
            "\\bneed\\s+to\\s+improve\\s+\\w+"),

    FINANCIAL_DISTRESS(SignalType.FINANCIAL_DISTRESS, SignalCategory.KEYWORD, 85, 90,
            "\\bcash flow\\s+(?:problem|crisis|shortage)\\b",
            "\\bstruggling\\s+to\\s+(?:pay|meet|cover)\\b",
            "\\bmissing\\s+payments\\b",
            "\\b(?:behind|late)\\s+on\\s+(?:payments|bills|rent)\\b",
            "\\bfinancial\\s+(?:difficulty|hardship|trouble|crisis)\\b",
            "\\bneed\\s+money\\s+(?:urgently|quickly|now|fast)\\b",
            "\\bpayroll\\s+(?:problem|issue|shortage)\\b",
            "\\bcannot\\s+(?:pay|afford)\\b"),

    GROWTH(SignalType.GROWTH, SignalCategory.KEYWORD, 75, 70,
            "\\b(?:hiring|recruiting|expanding team)\\b",
            "\\bnew\\s+(?:location|office|store|branch)\\b",
            "\\b(?:expanding|growth|growing|scaling)\\b",
            "\\bincreased\\s+(?:revenue|sales|demand)\\b",
            "\\bnew\\s+(?:product|service)\\s+launch\\b",
            "\\bmarket\\s+expansion\\b",
            "\\bcapacity\\s+expansion\\b"),

    EXPANSION(SignalType.EXPANSION, SignalCategory.KEYWORD, 80, 80,
            "\\bopening\\s+new\\s+(?:location|office|store)\\b",
            "\\bentering\\s+new\\s+market\\b",
            "\\bacquisition\\b",
            "\\bmerger\\b",
            "\\bfranchise\\s+expansion\\b",
            "\\bgeographic\\s+expansion\\b",
            "\\bscale\\s+(?:up|operations)\\b");

    private final SignalType signalType;
    private final SignalCategory category;
    private final int confidence;
    private final Integer fixedStrength;
    private final List<Pattern> patterns;

    SignalPatternLibrary(SignalType signalType, SignalCategory category, int confidence,
                         Integer fixedStrength, String... patterns) {
        this.signalType = signalType;
        this.category = category;
        this.confidence = confidence;
        this.fixedStrength = fixedStrength;
        this.patterns = Arrays.stream(patterns)
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public SignalType signalType() {
        return signalType;
    }

    public SignalCategory category() {
        return category;
    }

    public int confidence() {
        return confidence;
    }

    /**
     * True when the strength is computed from the surrounding content rather than fixed.
     */
    public boolean contextualStrength() {
        return fixedStrength == null;
    }

    /**
     * Strength of every match, or the contextual strength when none is fixed.
     */
    public int strengthFor(String content) {
        return fixedStrength != null ? fixedStrength : SignalDetector.keywordStrength(content);
    }

    public List<Pattern> patterns() {
        return patterns;
    }
}
