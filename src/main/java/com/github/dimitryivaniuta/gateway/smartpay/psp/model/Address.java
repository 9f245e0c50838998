package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Billing or shipping address.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Address(
        String firstName,
        String lastName,
        String street,
        String postalCode,
        String city,
        CountryCode countryCode,
        String houseNumber,
        String houseNumberAddition
) {}
