package com.coinbasis.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * POST /api/v1/owners/{owner}/fills/{provider} request body.
 */
public record ImportFillsRequest(
        @NotEmpty(message = "EMPTY_BATCH")
        List<@Valid FillRequest> fills
) {
}
