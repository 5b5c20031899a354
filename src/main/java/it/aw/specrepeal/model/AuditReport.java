package it.aw.specrepeal.model;

import java.util.List;

/**
 * Verdetti di un intero audit con i contatori riepilogativi per stato.
 */
public record AuditReport(
        String              auditName,
        List<RepealVerdict> verdicts,
        int                 repealable,
        int                 reviewRecommended,
        int                 valid
) {
    public static AuditReport of(String auditName, List<RepealVerdict> verdicts) {
        int repealable = 0, review = 0, valid = 0;
        for (RepealVerdict v : verdicts) {
            switch (v.status()) {
                case REPEALABLE -> repealable++;
                case REVIEW_RECOMMENDED -> review++;
                case VALID_INFRACTION -> valid++;
            }
        }
        return new AuditReport(auditName, List.copyOf(verdicts), repealable, review, valid);
    }
}
