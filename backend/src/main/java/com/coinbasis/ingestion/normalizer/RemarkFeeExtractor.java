package com.coinbasis.ingestion.normalizer;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a fee amount out of a free-text remark ("Withdraw fee 0.0005", "0.1 fee deducted").
 * The fee is denominated in the row's own asset.
 */
public final class RemarkFeeExtractor {

    private static final List<Pattern> FEE_PATTERNS = List.of(
            Pattern.compile("fee\\D*?(\\d+(?:\\.\\d+)?)"),
            Pattern.compile("(\\d+(?:\\.\\d+)?)\\D*?fee")
    );

    private RemarkFeeExtractor() {
    }

    public static Optional<BigDecimal> extract(String remark) {
        if (remark == null || remark.isBlank()) {
            return Optional.empty();
        }
        String text = remark.toLowerCase(Locale.ROOT);
        if (!text.contains("fee")) {
            return Optional.empty();
        }
        for (Pattern pattern : FEE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                BigDecimal fee = new BigDecimal(matcher.group(1));
                if (fee.signum() > 0) {
                    return Optional.of(fee);
                }
            }
        }
        return Optional.empty();
    }
}
