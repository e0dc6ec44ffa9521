package com.coinbasis.ingestion.normalizer;

import com.coinbasis.domain.OperationKind;
import com.coinbasis.domain.TransactionEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventNormalizerTest {

    private static final String OWNER = "user-1";
    private static final List<String> COLUMNS = List.of("User_ID", "UTC_Time", "Account", "Operation", "Coin", "Change", "Remark");

    private final EventNormalizer normalizer = new EventNormalizer();
    private final ProviderMapping binance = new ProviderMapping("binance",
            List.of("UTC_Time", "Operation", "Coin", "Change"),
            Map.of(
                    "Transaction Buy", OperationKind.BUY_LEG,
                    "Transaction Spend", OperationKind.SPEND_LEG,
                    "Transaction Fee", OperationKind.FEE_LEG,
                    "Withdraw", OperationKind.WITHDRAWAL,
                    "Deposit", OperationKind.DEPOSIT));

    @Test
    @DisplayName("maps a Binance row to a canonical event")
    void normalize_buyRow() {
        NormalizationOutcome outcome = normalizer.normalize(OWNER,
                new RawRecord(3, "24/12/2024 14:54", "Transaction Buy", "doge", "601", null, null), binance);

        assertThat(outcome.isSkipped()).isFalse();
        TransactionEvent event = outcome.event();
        assertThat(event.getOwner()).isEqualTo(OWNER);
        assertThat(event.getProvider()).isEqualTo("binance");
        assertThat(event.getTimestamp()).isEqualTo(Instant.parse("2024-12-24T14:54:00Z"));
        assertThat(event.getOperationKind()).isEqualTo(OperationKind.BUY_LEG);
        assertThat(event.getOperationLabel()).isEqualTo("Transaction Buy");
        assertThat(event.getAsset()).isEqualTo("DOGE");
        assertThat(event.getSignedAmount()).isEqualByComparingTo("601");
        assertThat(event.getSequence()).isEqualTo(3);
        assertThat(event.getSourceRef()).startsWith("binance:row:").endsWith(":0");
        assertThat(event.getEmbeddedFee()).isNull();
    }

    @Test
    @DisplayName("labels match ignoring case and repeated whitespace")
    void normalize_labelMatchIsLenient() {
        NormalizationOutcome outcome = normalizer.normalize(OWNER,
                new RawRecord(0, "2024-12-24 14:54:00", "  transaction   SPEND ", "USDT", "-199.56205", null, null), binance);

        assertThat(outcome.event().getOperationKind()).isEqualTo(OperationKind.SPEND_LEG);
    }

    @Test
    @DisplayName("external id becomes the sourceRef")
    void normalize_externalIdSourceRef() {
        NormalizationOutcome outcome = normalizer.normalize(OWNER,
                new RawRecord(0, "2024-12-24 14:54:00", "Deposit", "BTC", "0.5", null, "tx-42"), binance);

        assertThat(outcome.event().getSourceRef()).isEqualTo("binance:ext:tx-42");
    }

    @Test
    @DisplayName("fee in the remark is kept as embedded fee")
    void normalize_remarkFee() {
        NormalizationOutcome outcome = normalizer.normalize(OWNER,
                new RawRecord(0, "2024-12-24 14:54:00", "Withdraw", "BTC", "-0.5", "Withdraw fee 0.0005", null), binance);

        assertThat(outcome.event().getEmbeddedFee()).isEqualByComparingTo("0.0005");
    }

    @Test
    @DisplayName("remark fee not smaller than the amount is ignored")
    void normalize_remarkFeeLargerThanAmountIgnored() {
        NormalizationOutcome outcome = normalizer.normalize(OWNER,
                new RawRecord(0, "2024-12-24 14:54:00", "Withdraw", "BTC", "-0.5", "fee 2", null), binance);

        assertThat(outcome.event().getEmbeddedFee()).isNull();
    }

    @Test
    void normalize_amountWithThousandsSeparator() {
        NormalizationOutcome outcome = normalizer.normalize(OWNER,
                new RawRecord(0, "2025-01-06 09:06", "Deposit", "SHIB", "4,194,630", null, null), binance);

        assertThat(outcome.event().getSignedAmount()).isEqualByComparingTo("4194630");
    }

    @Test
    void normalize_unknownOperation_skipped() {
        NormalizationOutcome outcome = normalizer.normalize(OWNER,
                new RawRecord(7, "2024-12-24 14:54:00", "Launchpool Interest", "BNB", "0.1", null, null), binance);

        assertThat(outcome.isSkipped()).isTrue();
        assertThat(outcome.diagnostic().code()).isEqualTo(DiagnosticCode.UNKNOWN_OPERATION);
        assertThat(outcome.diagnostic().rowIndex()).isEqualTo(7);
    }

    @Test
    void normalize_badTimestampOrAmount_parseError() {
        assertThat(normalizer.normalize(OWNER,
                new RawRecord(1, "not a date", "Deposit", "BTC", "1", null, null), binance).diagnostic().code())
                .isEqualTo(DiagnosticCode.PARSE_ERROR);
        assertThat(normalizer.normalize(OWNER,
                new RawRecord(2, "2024-12-24 14:54:00", "Deposit", "BTC", "1.2.3", null, null), binance).diagnostic().code())
                .isEqualTo(DiagnosticCode.PARSE_ERROR);
        assertThat(normalizer.normalize(OWNER,
                new RawRecord(3, "2024-12-24 14:54:00", "Deposit", " ", "1", null, null), binance).diagnostic().code())
                .isEqualTo(DiagnosticCode.PARSE_ERROR);
    }

    @Test
    @DisplayName("batch: identical rows keep distinct sourceRefs, unknown labels counted once each")
    void normalizeAll_duplicatesAndUnknowns() {
        RawBatch batch = new RawBatch(OWNER, "binance", COLUMNS, List.of(
                new RawRecord(0, "29/12/2024 22:06", "Transaction Buy", "SHIB", "47830", null, null),
                new RawRecord(1, "29/12/2024 22:06", "Transaction Spend", "USDT", "-1.0302582", null, null),
                new RawRecord(2, "29/12/2024 22:06", "Transaction Buy", "SHIB", "47830", null, null),
                new RawRecord(3, "29/12/2024 22:06", "Simple Earn Flexible Interest", "USDT", "0.01", null, null),
                new RawRecord(4, "30/12/2024 22:06", "Simple Earn Flexible Interest", "USDT", "0.01", null, null),
                new RawRecord(5, "bad", "Deposit", "BTC", "1", null, null)));

        NormalizationResult result = normalizer.normalizeAll(batch, binance);

        assertThat(result.events()).hasSize(3);
        assertThat(result.events().get(0).getSourceRef()).endsWith(":0");
        assertThat(result.events().get(2).getSourceRef()).endsWith(":1");
        assertThat(result.events().get(0).getSourceRef().replaceAll(":\\d+$", ""))
                .isEqualTo(result.events().get(2).getSourceRef().replaceAll(":\\d+$", ""));
        assertThat(result.unknownOperationCounts()).containsEntry("Simple Earn Flexible Interest", 2);
        assertThat(result.unknownOperationRowCount()).isEqualTo(2);
        assertThat(result.parseErrorCount()).isEqualTo(1);
        assertThat(result.diagnostics()).hasSize(2);
    }

    @Test
    @DisplayName("normalizing the same batch twice yields the same sourceRefs")
    void normalizeAll_deterministic() {
        RawBatch batch = new RawBatch(OWNER, "binance", COLUMNS, List.of(
                new RawRecord(0, "24/12/2024 14:54", "Transaction Spend", "USDT", "-199.56205", null, null),
                new RawRecord(1, "24/12/2024 14:54", "Transaction Buy", "DOGE", "601", null, null)));

        List<String> first = normalizer.normalizeAll(batch, binance).events().stream().map(TransactionEvent::getSourceRef).toList();
        List<String> second = normalizer.normalizeAll(batch, binance).events().stream().map(TransactionEvent::getSourceRef).toList();

        assertThat(first).isEqualTo(second).doesNotHaveDuplicates();
    }

    @Test
    void normalizeAll_missingColumns_throws() {
        RawBatch batch = new RawBatch(OWNER, "binance", List.of("UTC_Time", "Coin"), List.of(
                new RawRecord(0, "24/12/2024 14:54", "Transaction Buy", "DOGE", "601", null, null)));

        assertThatThrownBy(() -> normalizer.normalizeAll(batch, binance))
                .isInstanceOf(StructuralInputException.class)
                .satisfies(e -> assertThat(((StructuralInputException) e).getErrorCode())
                        .isEqualTo(StructuralInputException.MISSING_COLUMNS))
                .hasMessageContaining("Operation")
                .hasMessageContaining("Change");
    }

    @Test
    void normalizeAll_missingOwner_throws() {
        RawBatch batch = new RawBatch(" ", "binance", COLUMNS, List.of());

        assertThatThrownBy(() -> normalizer.normalizeAll(batch, binance))
                .isInstanceOf(StructuralInputException.class)
                .satisfies(e -> assertThat(((StructuralInputException) e).getErrorCode())
                        .isEqualTo(StructuralInputException.MISSING_OWNER));
    }
}
