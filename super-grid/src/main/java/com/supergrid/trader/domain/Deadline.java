package com.supergrid.trader.domain;

import java.util.Locale;

/**
 * Validity horizon of a grid. Accepted as configuration and carried on the
 * config, but not consulted when evaluating prices.
 */
public enum Deadline {
    FIVE_DAYS("5D"),
    TWENTY_DAYS("20D"),
    SIXTY_DAYS("60D"),
    GOOD_TILL_CANCELLED("GTC");

    private final String code;

    Deadline(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve a deadline from either its enum name or its short code.
     */
    public static Deadline parse(String value) {
        if (value == null || value.isBlank()) {
            return FIVE_DAYS;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Deadline deadline : values()) {
            if (deadline.name().equals(normalized) || deadline.code.equals(normalized)) {
                return deadline;
            }
        }
        throw new GridConfigurationException("Unknown deadline: " + value);
    }
}
