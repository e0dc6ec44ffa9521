package com.coinbasis.ingestion.normalizer;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Idempotency keys for transaction events. External ids win; rows without one are keyed by a content
 * fingerprint so that overlapping exports of the same account map to the same events.
 */
public final class SourceRefs {

    private static final int FINGERPRINT_HEX_LENGTH = 24;

    private SourceRefs() {
    }

    public static String external(String provider, String externalId) {
        return provider + ":ext:" + externalId.strip();
    }

    public static String external(String provider, String externalId, String leg) {
        return external(provider, externalId) + ":" + leg;
    }

    /**
     * Content key for a row with no external id. occurrence numbers identical rows within one batch.
     */
    public static String fingerprint(String provider, Instant timestamp, String label, String asset,
                                     BigDecimal amount, String remark, int occurrence) {
        String content = String.join("\u001f",
                String.valueOf(timestamp),
                label == null ? "" : label.strip().toLowerCase(Locale.ROOT),
                asset,
                amount.stripTrailingZeros().toPlainString(),
                remark == null ? "" : remark.strip());
        return provider + ":row:" + sha256(content).substring(0, FINGERPRINT_HEX_LENGTH) + ":" + occurrence;
    }

    private static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
