package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Amount in minor units (cents) of the given currency.
 *
 * @param currency ISO 4217 currency code
 * @param amount   amount in minor units
 */
public record Money(String currency, long amount) {

    public static final String EUR = "EUR";

    /**
     * Converts a decimal euro amount, rounding half-up to whole cents.
     *
     * @param value decimal amount
     * @return money in EUR
     */
    public static Money fromDecimal(BigDecimal value) {
        long cents = value.setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValueExact();
        return new Money(EUR, cents);
    }
}
