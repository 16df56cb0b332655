package com.bubblegrade.modules.grading;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How an exam is scored.
 *
 * @param partialCredit                   stored with the key; single-answer items have no partial state to credit
 * @param penaltyIncorrect                points subtracted per incorrect answer, never negative
 * @param requireManualReviewOnAmbiguity  any ambiguous mark sends the scan to review
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GradingPolicy(
        @JsonProperty("partial_credit") Boolean partialCredit,
        @JsonProperty("penalty_incorrect") Double penaltyIncorrect,
        @JsonProperty("require_manual_review_on_ambiguity") Boolean requireManualReviewOnAmbiguity) {

    public static final GradingPolicy DEFAULT = new GradingPolicy(false, 0.0, true);

    public GradingPolicy {
        partialCredit = partialCredit != null && partialCredit;
        penaltyIncorrect = penaltyIncorrect == null ? 0.0 : Math.max(0.0, penaltyIncorrect);
        requireManualReviewOnAmbiguity = requireManualReviewOnAmbiguity == null || requireManualReviewOnAmbiguity;
    }
}
