package com.promptvault.model;

import org.springframework.data.domain.Sort;

/**
 * Fixed orderings for prompt listings.
 *
 * Anything that is not {@code "score"} or {@code "created"} falls back to
 * {@link #UPDATED}, including an absent value.
 */
public enum SortMode {
    /**
     * Highest average rating first, recently updated first among equals.
     */
    SCORE(Sort.by(Sort.Order.desc("scoreAvg"), Sort.Order.desc("updatedAt"))),

    /**
     * Newest prompts first.
     */
    CREATED(Sort.by(Sort.Order.desc("createdAt"))),

    /**
     * Recently updated first (default).
     */
    UPDATED(Sort.by(Sort.Order.desc("updatedAt")));

    private final Sort sort;

    SortMode(Sort sort) {
        this.sort = sort;
    }

    public Sort getSort() {
        return sort;
    }

    public static SortMode fromParameter(String sortBy) {
        if (sortBy == null) {
            return UPDATED;
        }
        switch (sortBy) {
            case "score":
                return SCORE;
            case "created":
                return CREATED;
            default:
                return UPDATED;
        }
    }
}
