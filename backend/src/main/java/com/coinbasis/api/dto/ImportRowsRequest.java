package com.coinbasis.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * POST /api/v1/owners/{owner}/imports/{provider} request body: header columns plus rows in file order.
 */
public record ImportRowsRequest(
        @NotEmpty(message = "MISSING_COLUMNS")
        List<String> columns,

        @NotEmpty(message = "EMPTY_BATCH")
        List<@Valid RawRowRequest> rows
) {
}
