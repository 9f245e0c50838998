package com.github.dimitryivaniuta.gateway.smartpay.psp.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * ISO 3166-1 alpha-2 country code.
 *
 * @param value upper-case code
 */
public record CountryCode(@JsonValue String value) {

    private static final Set<String> ISO_COUNTRIES = Set.of(Locale.getISOCountries());

    /**
     * Parses a code case-insensitively.
     *
     * @param raw raw code
     * @return code, empty when it is not a known ISO country
     */
    public static Optional<CountryCode> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return ISO_COUNTRIES.contains(normalized) ? Optional.of(new CountryCode(normalized)) : Optional.empty();
    }
}
