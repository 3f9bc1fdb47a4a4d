package com.realtyhub.backend.modules.lead.presentation.dto;

import java.math.BigDecimal;

import com.realtyhub.backend.modules.lead.domain.BudgetRange;

import jakarta.validation.constraints.DecimalMin;

public record BudgetPayload(
        @DecimalMin("0") BigDecimal min,
        @DecimalMin("0") BigDecimal max
) {

    public static BudgetPayload from(BudgetRange budget) {
        return budget == null ? null : new BudgetPayload(budget.getMin(), budget.getMax());
    }

    public BudgetRange toBudgetRange() {
        return new BudgetRange(min, max);
    }
}
