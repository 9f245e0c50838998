package com.github.dimitryivaniuta.gateway.smartpay.service.dto;

import java.math.BigDecimal;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Store item exposed as string details (customer, basket or basket line).
 *
 * <p>Keys or values that are {@code null} are dropped, so a null field reads as absent.</p>
 *
 * @param details detail values by key
 */
public record DetailItem(Map<String, String> details) {

    public DetailItem {
        details = details == null
                ? Map.of()
                : details.entrySet().stream()
                        .filter(e -> e.getKey() != null && e.getValue() != null)
                        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    /**
     * @param key detail key
     * @return value, empty string when absent
     */
    public String value(String key) {
        String v = details.get(key);
        return v == null ? "" : v;
    }

    public boolean isBlank(String key) {
        return value(key).isBlank();
    }

    public int intValue(String key) {
        String v = value(key).trim();
        return v.isEmpty() ? 0 : Integer.parseInt(v);
    }

    public BigDecimal decimalValue(String key) {
        String v = value(key).trim();
        return v.isEmpty() ? BigDecimal.ZERO : new BigDecimal(v);
    }
}
