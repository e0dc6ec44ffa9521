package com.coinbasis.ingestion.normalizer;

import com.coinbasis.domain.OperationKind;
import com.coinbasis.domain.TransactionEvent;
import com.coinbasis.ingestion.config.IngestionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Expands exchange-API fills into the same legs a file export would contain, so both sources go through
 * one grouper. BUY gives BUY_LEG + SPEND_LEG (+ FEE_LEG), SELL gives SELL_LEG + REVENUE_LEG (+ FEE_LEG),
 * CONVERT gives a CONVERT_LEG pair (+ CONVERT_FEE_LEG); transfers give a single event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExchangeFillNormalizer {

    private static final int LEGS_PER_FILL = 3;

    private final IngestionProperties ingestionProperties;

    public NormalizationResult normalizeAll(String owner, String provider, List<ExchangeFill> fills) {
        if (owner == null || owner.isBlank()) {
            throw new StructuralInputException(StructuralInputException.MISSING_OWNER, "Batch has no owner");
        }
        String providerKey = provider.strip().toLowerCase(Locale.ROOT);
        List<TransactionEvent> events = new ArrayList<>();
        List<RowDiagnostic> diagnostics = new ArrayList<>();
        Map<String, Integer> occurrences = new HashMap<>();
        for (int i = 0; i < fills.size(); i++) {
            ExchangeFill fill = fills.get(i);
            String problem = validate(fill);
            if (problem != null) {
                diagnostics.add(new RowDiagnostic(i, DiagnosticCode.PARSE_ERROR, problem));
                continue;
            }
            events.addAll(expand(owner, providerKey, fill, i, occurrences));
        }
        log.info("Normalized {} fills into {} events for owner {} ({}), {} diagnostics",
                fills.size(), events.size(), owner, providerKey, diagnostics.size());
        return new NormalizationResult(events, diagnostics, Map.of());
    }

    private List<TransactionEvent> expand(String owner, String provider, ExchangeFill fill, int index,
                                          Map<String, Integer> occurrences) {
        String asset = fill.asset().strip().toUpperCase(Locale.ROOT);
        String quote = fill.quoteAsset() == null || fill.quoteAsset().isBlank()
                ? ingestionProperties.getDefaultQuoteAsset()
                : fill.quoteAsset().strip().toUpperCase(Locale.ROOT);
        String feeAsset = fill.feeAsset() == null || fill.feeAsset().isBlank()
                ? null
                : fill.feeAsset().strip().toUpperCase(Locale.ROOT);
        boolean hasFee = fill.feeAmount() != null && fill.feeAmount().signum() > 0 && feeAsset != null;
        BigDecimal quantity = fill.quantity();
        BigDecimal quoteAmount = fill.price() == null ? null : quantity.multiply(fill.price());
        LegFactory legs = new LegFactory(owner, provider, fill, index, occurrences);

        List<TransactionEvent> out = new ArrayList<>();
        switch (fill.type()) {
            case BUY -> {
                out.add(legs.leg("base", OperationKind.BUY_LEG, asset, quantity, null));
                out.add(legs.leg("quote", OperationKind.SPEND_LEG, quote, quoteAmount.negate(), null));
                if (hasFee) {
                    out.add(legs.leg("fee", OperationKind.FEE_LEG, feeAsset, fill.feeAmount().negate(), null));
                }
            }
            case SELL -> {
                out.add(legs.leg("base", OperationKind.SELL_LEG, asset, quantity.negate(), null));
                out.add(legs.leg("quote", OperationKind.REVENUE_LEG, quote, quoteAmount, null));
                if (hasFee) {
                    out.add(legs.leg("fee", OperationKind.FEE_LEG, feeAsset, fill.feeAmount().negate(), null));
                }
            }
            case CONVERT -> {
                // a fee in either converted asset rides on that leg; any other fee asset gets a convert-class fee leg
                BigDecimal baseFee = hasFee && feeAsset.equals(asset) ? fill.feeAmount() : null;
                BigDecimal quoteFee = hasFee && feeAsset.equals(quote) ? fill.feeAmount() : null;
                out.add(legs.leg("base", OperationKind.CONVERT_LEG, asset, quantity, baseFee));
                out.add(legs.leg("quote", OperationKind.CONVERT_LEG, quote, quoteAmount.negate(), quoteFee));
                if (hasFee && baseFee == null && quoteFee == null) {
                    out.add(legs.leg("fee", OperationKind.CONVERT_FEE_LEG, feeAsset, fill.feeAmount().negate(), null));
                }
            }
            case DEPOSIT -> out.add(legs.leg("base", OperationKind.DEPOSIT, asset, quantity,
                    hasFee && feeAsset.equals(asset) ? fill.feeAmount() : null));
            case WITHDRAWAL -> out.add(legs.leg("base", OperationKind.WITHDRAWAL, asset, quantity.negate(),
                    hasFee && feeAsset.equals(asset) ? fill.feeAmount() : null));
            case TRANSFER -> out.add(legs.leg("base", OperationKind.TRANSFER, asset, quantity, null));
        }
        return out;
    }

    private static String validate(ExchangeFill fill) {
        if (fill == null || fill.type() == null) {
            return "missing fill type";
        }
        if (fill.asset() == null || fill.asset().isBlank()) {
            return "missing asset";
        }
        if (fill.timestamp() == null) {
            return "missing timestamp";
        }
        if (fill.quantity() == null || fill.quantity().signum() <= 0) {
            return "quantity must be positive";
        }
        boolean needsPrice = fill.type() == FillType.BUY || fill.type() == FillType.SELL || fill.type() == FillType.CONVERT;
        if (needsPrice && (fill.price() == null || fill.price().signum() <= 0)) {
            return "price must be positive for " + fill.type();
        }
        return null;
    }

    private static final class LegFactory {
        private final String owner;
        private final String provider;
        private final ExchangeFill fill;
        private final int index;
        private final Map<String, Integer> occurrences;
        private int legIndex;

        LegFactory(String owner, String provider, ExchangeFill fill, int index, Map<String, Integer> occurrences) {
            this.owner = owner;
            this.provider = provider;
            this.fill = fill;
            this.index = index;
            this.occurrences = occurrences;
        }

        TransactionEvent leg(String leg, OperationKind kind, String asset, BigDecimal amount, BigDecimal embeddedFee) {
            String label = fill.type().name().toLowerCase(Locale.ROOT) + ":" + leg;
            String sourceRef;
            if (fill.externalId() != null && !fill.externalId().isBlank()) {
                sourceRef = SourceRefs.external(provider, fill.externalId(), leg);
            } else {
                String key = SourceRefs.fingerprint(provider, fill.timestamp(), label, asset, amount, null, 0);
                int occurrence = occurrences.merge(key, 1, Integer::sum) - 1;
                sourceRef = SourceRefs.fingerprint(provider, fill.timestamp(), label, asset, amount, null, occurrence);
            }
            return TransactionEvent.builder()
                    .owner(owner)
                    .provider(provider)
                    .timestamp(fill.timestamp())
                    .operationKind(kind)
                    .operationLabel(label)
                    .asset(asset)
                    .signedAmount(amount)
                    .sourceRef(sourceRef)
                    .embeddedFee(embeddedFee)
                    .sequence(index * LEGS_PER_FILL + legIndex++)
                    .build();
        }
    }
}
