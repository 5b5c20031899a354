package it.aw.specrepeal.calibration;

import it.aw.specrepeal.model.MatchResult;
import it.aw.specrepeal.text.TextNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Motivazioni leggibili e riferimenti alle specifiche di un verdetto. */
public final class ReasonFormatter {

    public static final String NO_MATCH_REASON = "No strong spec matches found — infraction appears valid.";

    static final int MAX_REASONS = 3;
    static final int SNIPPET_LENGTH = 150;

    private ReasonFormatter() {}

    public static List<String> reasons(List<MatchResult> matches) {
        if (matches.isEmpty()) return List.of(NO_MATCH_REASON);
        List<String> reasons = new ArrayList<>(MAX_REASONS);
        for (MatchResult m : matches.subList(0, Math.min(MAX_REASONS, matches.size()))) {
            reasons.add(m.chunk().sourceReference() + " (" + m.scorePercent() + "% similarity): "
                    + TextNormalizer.snippet(m.chunk().text(), SNIPPET_LENGTH));
        }
        return reasons;
    }

    public static List<String> specReferences(List<MatchResult> matches) {
        Set<String> refs = new LinkedHashSet<>();
        for (MatchResult m : matches) refs.add(m.chunk().sourceReference());
        return new ArrayList<>(refs);
    }
}
