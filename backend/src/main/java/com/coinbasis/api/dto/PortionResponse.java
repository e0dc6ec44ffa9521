package com.coinbasis.api.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record PortionResponse(
        String lotId,
        Instant acquiredAt,
        BigDecimal amount,
        BigDecimal costBasisUsd,
        BigDecimal proceedsUsd,
        Boolean shortTerm
) {
}
