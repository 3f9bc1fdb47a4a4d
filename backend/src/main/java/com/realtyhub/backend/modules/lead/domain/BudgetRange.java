package com.realtyhub.backend.modules.lead.domain;

import java.math.BigDecimal;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class BudgetRange {

    @Column(name = "budget_min", precision = 15, scale = 2)
    private BigDecimal min;

    @Column(name = "budget_max", precision = 15, scale = 2)
    private BigDecimal max;

    protected BudgetRange() {
    }

    public BudgetRange(BigDecimal min, BigDecimal max) {
        this.min = min;
        this.max = max;
    }

    public BigDecimal getMin() {
        return min;
    }

    public BigDecimal getMax() {
        return max;
    }

    public boolean hasPositiveMin() {
        return min != null && min.signum() > 0;
    }

    public boolean hasPositiveMax() {
        return max != null && max.signum() > 0;
    }
}
