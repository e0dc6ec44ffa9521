package com.coinbasis.api.controller;

import com.coinbasis.api.dto.ImportFillsRequest;
import com.coinbasis.api.dto.ImportRowsRequest;
import com.coinbasis.api.dto.RawRowRequest;
import com.coinbasis.ingestion.normalizer.ExchangeFill;
import com.coinbasis.ingestion.normalizer.RawBatch;
import com.coinbasis.ingestion.normalizer.RawRecord;
import com.coinbasis.ingestion.pipeline.BatchResult;
import com.coinbasis.ingestion.pipeline.ImportBatchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * POST /imports/{provider} (exported rows) and POST /fills/{provider} (exchange API fills).
 * Partial failures come back in the BatchResult; structural problems are 400.
 */
@RestController
@RequestMapping("/api/v1/owners/{owner}")
@RequiredArgsConstructor
public class ImportController {

    private final ImportBatchService importBatchService;

    @PostMapping("/imports/{provider}")
    public ResponseEntity<BatchResult> importRows(@PathVariable String owner,
                                                  @PathVariable String provider,
                                                  @RequestBody @Valid ImportRowsRequest request) {
        List<RawRecord> rows = new ArrayList<>(request.rows().size());
        for (int i = 0; i < request.rows().size(); i++) {
            RawRowRequest row = request.rows().get(i);
            rows.add(new RawRecord(i, row.timestamp(), row.operation(), row.asset(), row.change(),
                    row.remark(), row.externalId()));
        }
        BatchResult result = importBatchService.importRows(new RawBatch(owner.trim(), provider, request.columns(), rows));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/fills/{provider}")
    public ResponseEntity<BatchResult> importFills(@PathVariable String owner,
                                                   @PathVariable String provider,
                                                   @RequestBody @Valid ImportFillsRequest request) {
        List<ExchangeFill> fills = request.fills().stream()
                .map(f -> new ExchangeFill(f.type(), f.asset(), f.quantity(), f.price(), f.feeAmount(),
                        f.feeAsset(), f.quoteAsset(), f.externalId(), f.timestamp()))
                .toList();
        return ResponseEntity.ok(importBatchService.importFills(owner.trim(), provider, fills));
    }
}
