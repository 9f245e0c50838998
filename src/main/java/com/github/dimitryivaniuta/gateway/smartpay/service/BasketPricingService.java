package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ShoppingBasket;
import java.math.BigDecimal;

/**
 * Computes what the PSP charges for a basket.
 */
public interface BasketPricingService {

    /**
     * @param basket basket with its lines
     * @return price including VAT, in euros
     */
    BigDecimal pspPriceInVat(ShoppingBasket basket);
}
