package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One basket line as announced to the PSP.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderItem(
        String id,
        String name,
        String description,
        int quantity,
        Money amount
) {}
