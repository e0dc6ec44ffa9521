package com.coinbasis.ingestion.grouping;

import com.coinbasis.domain.TransactionEvent;

import java.math.BigDecimal;

record Leg(TransactionEvent event, LegRole role) {

    String asset() {
        return event.getAsset();
    }

    BigDecimal amount() {
        return event.absoluteAmount();
    }

    String roleAssetKey() {
        return role + ":" + event.getAsset();
    }
}
