package com.realtyhub.backend.modules.lead.application;

import com.realtyhub.backend.global.config.RealtyhubProperties;
import com.realtyhub.backend.modules.lead.domain.BudgetRange;
import com.realtyhub.backend.modules.lead.domain.Lead;
import com.realtyhub.backend.modules.lead.domain.PreferredLocation;

import org.springframework.stereotype.Component;

/**
 * Additive lead score over the lead's own fields. Every signal only adds points, so filling in more
 * fields never lowers the score. The sum is capped and the result always lies in 0..100.
 */
@Component
public class LeadScoringPolicy {

    private final RealtyhubProperties.Scoring weights;

    public LeadScoringPolicy(RealtyhubProperties properties) {
        this.weights = properties.lead().scoring();
    }

    public int score(Lead lead) {
        int score = 0;
        if (hasText(lead.getName())) {
            score += weights.name();
        }
        if (hasText(lead.getPhoneNumber())) {
            score += weights.phone();
        }
        if (hasText(lead.getEmail())) {
            score += weights.email();
        }

        String message = lead.getMessage();
        int messageLength = message == null ? 0 : message.length();
        if (messageLength > weights.messageLengthThreshold()) {
            score += weights.message();
        }
        if (messageLength > weights.longMessageLengthThreshold()) {
            score += weights.longMessage();
        }

        BudgetRange budget = lead.getBudget();
        if (budget != null) {
            score += weights.budget();
            if (budget.hasPositiveMin()) {
                score += weights.budgetMin();
            }
            if (budget.hasPositiveMax()) {
                score += weights.budgetMax();
            }
        }

        PreferredLocation location = lead.getPreferredLocation();
        if (location != null) {
            score += weights.location();
            if (hasText(location.getCity())) {
                score += weights.locationCity();
            }
            if (hasText(location.getState())) {
                score += weights.locationState();
            }
        }

        score += lead.getPropertyInterests().size() * weights.perPropertyInterest();
        score += lead.getTags().size() * weights.perTag();

        int capped = Math.min(score, weights.cap());
        return Math.max(Lead.SCORE_MIN, Math.min(Lead.SCORE_MAX, capped));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
