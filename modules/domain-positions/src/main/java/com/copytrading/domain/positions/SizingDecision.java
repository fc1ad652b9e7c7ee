package com.copytrading.domain.positions;

import java.math.BigDecimal;

public record SizingDecision(
    BigDecimal size, BigDecimal riskBudget, BigDecimal priceRisk, BigDecimal unclampedSize) {}
