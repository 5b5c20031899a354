package it.aw.specrepeal.calibration;

import it.aw.specrepeal.model.AnalysisConfig;
import it.aw.specrepeal.model.RepealStatus;

/** Tabella delle soglie: confidenza e numero di match &rarr; stato. */
public final class DecisionPolicy {

    private DecisionPolicy() {}

    public static RepealStatus decide(double confidence, int matchCount, AnalysisConfig config) {
        RepealStatus status;
        if (confidence >= config.highThreshold() && matchCount >= config.minMatches()) {
            status = RepealStatus.REPEALABLE;
        } else if (confidence >= config.mediumThreshold()) {
            status = RepealStatus.REVIEW_RECOMMENDED;
        } else {
            status = RepealStatus.VALID_INFRACTION;
        }
        if (status != RepealStatus.REVIEW_RECOMMENDED) return status;
        return switch (config.reviewMode()) {
            case THREE_TIER -> RepealStatus.REVIEW_RECOMMENDED;
            case COLLAPSE_TO_VALID -> RepealStatus.VALID_INFRACTION;
            case COLLAPSE_TO_REPEALABLE -> RepealStatus.REPEALABLE;
        };
    }
}
