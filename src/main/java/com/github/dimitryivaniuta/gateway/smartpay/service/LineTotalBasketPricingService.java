package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.service.dto.DetailItem;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ShoppingBasket;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Prices a basket as the sum of {@code price * quantity} over its lines. Line prices include VAT.
 */
@Component
public class LineTotalBasketPricingService implements BasketPricingService {

    @Override
    public BigDecimal pspPriceInVat(ShoppingBasket basket) {
        BigDecimal total = BigDecimal.ZERO;
        for (DetailItem line : basket.lines()) {
            total = total.add(line.decimalValue(OrderMapper.LINE_PRICE)
                    .multiply(BigDecimal.valueOf(line.intValue(OrderMapper.LINE_QUANTITY))));
        }
        return total;
    }
}
