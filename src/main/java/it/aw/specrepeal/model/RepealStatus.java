package it.aw.specrepeal.model;

public enum RepealStatus {
    REPEALABLE,
    REVIEW_RECOMMENDED,
    VALID_INFRACTION
}
