package com.coinbasis.api.controller;

import com.coinbasis.api.dto.ErrorBody;
import com.coinbasis.costbasis.tax.TaxSummaryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * GET /tax-summary?from=&to= (inclusive UTC dates) or ?year=.
 */
@RestController
@RequestMapping("/api/v1/owners/{owner}")
@RequiredArgsConstructor
public class TaxController {

    private final TaxSummaryService taxSummaryService;

    @GetMapping("/tax-summary")
    public ResponseEntity<?> getSummary(
            @PathVariable String owner,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) Integer year
    ) {
        if (year != null) {
            return ResponseEntity.ok(taxSummaryService.summarizeYear(owner.trim(), year));
        }
        if (from == null || to == null) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PERIOD", "from and to, or year, are required"));
        }
        if (to.isBefore(from)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PERIOD", "to must not be before from"));
        }
        return ResponseEntity.ok(taxSummaryService.summarize(owner.trim(), from, to));
    }
}
