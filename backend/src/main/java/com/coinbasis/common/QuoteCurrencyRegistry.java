package com.coinbasis.common;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Registry of quote currencies. Quote legs are valued at par ($1.00) and never open or consume lots.
 */
@Component
public class QuoteCurrencyRegistry {

    private static final Set<String> QUOTE_CURRENCIES = Set.of(
            "USDT",
            "USDC",
            "BUSD",
            "FDUSD",
            "TUSD",
            "DAI",
            "USDP",
            "USD"
    );

    /**
     * Returns true if the given asset symbol (any case) is a quote currency.
     */
    public boolean isQuoteCurrency(String assetSymbol) {
        if (assetSymbol == null || assetSymbol.isBlank()) {
            return false;
        }
        return QUOTE_CURRENCIES.contains(assetSymbol.strip().toUpperCase(Locale.ROOT));
    }
}
