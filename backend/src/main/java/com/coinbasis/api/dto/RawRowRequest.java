package com.coinbasis.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * One exported row. Values are kept as the provider wrote them; the normalizer parses them.
 */
public record RawRowRequest(
        @NotBlank(message = "INVALID_ROW")
        String timestamp,
        @NotBlank(message = "INVALID_ROW")
        String operation,
        String asset,
        String change,
        String remark,
        String externalId
) {
}
