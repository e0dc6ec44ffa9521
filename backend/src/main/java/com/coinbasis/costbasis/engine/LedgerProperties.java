package com.coinbasis.costbasis.engine;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Lot ledger configuration (coinbasis.ledger).
 */
@ConfigurationProperties(prefix = "coinbasis.ledger")
@Getter
@Setter
public class LedgerProperties {

    /**
     * When true, DEPOSIT events (deposits, airdrops, rewards, opening balances) open lots valued at their
     * declared cost or historical price. When false only trades open lots.
     */
    private boolean depositsCreateLots = true;
}
