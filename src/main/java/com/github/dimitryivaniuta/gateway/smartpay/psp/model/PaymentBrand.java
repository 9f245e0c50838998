package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Payment brands the connector can force at the PSP.
 */
public enum PaymentBrand {
    IDEAL,
    AFTERPAY,
    PAYPAL,
    MASTERCARD,
    VISA,
    BANCONTACT,
    MAESTRO,
    V_PAY;

    /**
     * Maps a store payment method name, case-insensitive. {@code VPAY} is accepted for {@link #V_PAY}.
     *
     * @param externalName payment method name configured in the store
     * @return brand, empty when unsupported
     */
    public static Optional<PaymentBrand> fromExternalName(String externalName) {
        if (externalName == null) {
            return Optional.empty();
        }
        String name = externalName.trim().toUpperCase(Locale.ROOT);
        if ("VPAY".equals(name)) {
            return Optional.of(V_PAY);
        }
        for (PaymentBrand brand : values()) {
            if (brand.name().equals(name)) {
                return Optional.of(brand);
            }
        }
        return Optional.empty();
    }
}
