package com.revenueplatform.common.model;

/**
 * Kind of pricing action carried by a {@link Recommendation}.
 *
 * <p>{@link #NO_ACTION} is part of the vocabulary but never emitted: a day with no
 * matching rule simply produces no recommendation.
 */
public enum RecommendationType {
    RATE_INCREASE,
    PRICE_DROP,
    APPLY_PROMOTION,
    LAST_MINUTE_DEAL,
    EXTENDED_STAY_INCENTIVE,
    NO_ACTION
}
