package com.github.dimitryivaniuta.gateway.smartpay.web.dto;

import com.github.dimitryivaniuta.gateway.smartpay.service.dto.DetailItem;
import com.github.dimitryivaniuta.gateway.smartpay.service.dto.ShoppingBasket;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;

/**
 * Basket in a checkout request.
 *
 * @param details basket-level details
 * @param lines   line details ({@code title}, {@code description}, {@code connecteditemid}, {@code quantity}, {@code price})
 */
public record BasketDto(
        Map<String, String> details,
        @NotEmpty List<Map<String, String>> lines
) {

    public ShoppingBasket toBasket() {
        return new ShoppingBasket(
                new DetailItem(details),
                lines.stream().map(DetailItem::new).toList()
        );
    }
}
