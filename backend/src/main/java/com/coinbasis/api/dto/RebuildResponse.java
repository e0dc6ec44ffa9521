package com.coinbasis.api.dto;

import java.math.BigDecimal;

public record RebuildResponse(String asset, int lots, int disposals, int needsReview, BigDecimal remainingAmount) {
}
