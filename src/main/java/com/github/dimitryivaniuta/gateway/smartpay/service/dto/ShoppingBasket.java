package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

import java.util.List;
import java.util.Objects;

/**
 * A basket and its lines.
 *
 * @param main  basket-level details
 * @param lines basket lines
 */
public record ShoppingBasket(DetailItem main, List<DetailItem> lines) {

    public ShoppingBasket {
        main = main == null ? new DetailItem(null) : main;
        lines = lines == null ? List.of() : lines.stream().filter(Objects::nonNull).toList();
    }
}
