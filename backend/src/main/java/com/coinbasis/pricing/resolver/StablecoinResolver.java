package com.coinbasis.pricing.resolver;

import com.coinbasis.common.QuoteCurrencyRegistry;
import com.coinbasis.domain.PriceSource;
import com.coinbasis.pricing.HistoricalPriceRequest;
import com.coinbasis.pricing.PriceResolutionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Resolves quote currencies (USDT, USDC, BUSD, ...) to $1.00.
 */
@Component
@RequiredArgsConstructor
public class StablecoinResolver {

    private static final BigDecimal ONE_USD = BigDecimal.ONE.setScale(18, RoundingMode.HALF_UP);

    private final QuoteCurrencyRegistry quoteCurrencyRegistry;

    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        if (request == null || request.getAsset() == null) {
            return PriceResolutionResult.unknown();
        }
        if (quoteCurrencyRegistry.isQuoteCurrency(request.getAsset())) {
            return PriceResolutionResult.known(ONE_USD, PriceSource.STABLECOIN);
        }
        return PriceResolutionResult.unknown();
    }
}
