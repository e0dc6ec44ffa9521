package com.coinbasis.costbasis.override;

import lombok.Getter;

/**
 * Thrown by OpeningBalanceService when the declared balance is invalid. API maps it to 400 with the error code.
 */
@Getter
public class OpeningBalanceException extends RuntimeException {

    public static final String INVALID_OPENING_BALANCE = "INVALID_OPENING_BALANCE";

    private final String errorCode;

    public OpeningBalanceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
