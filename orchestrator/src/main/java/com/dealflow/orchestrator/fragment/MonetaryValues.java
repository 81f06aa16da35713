package com.dealflow.orchestrator.fragment;

import java.util.Locale;
import java.util.Optional;

/**
 * Reads monetary values of the shape {@code {"amount": 2.5, "unit": "M", "currency": "USD"}}.
 */
public final class MonetaryValues {

    private MonetaryValues() {}

    /**
     * The amount in base units: an explicit {@code normalized_amount} if the
     * value carries one, else {@code amount} scaled by its K/M/B unit.
     */
    public static Optional<Double> normalizedAmount(Fragment money) {
        Optional<Double> explicit = Fragments.doubleAt(money, "normalized_amount");
        if (explicit.isPresent()) {
            return explicit;
        }
        return Fragments.doubleAt(money, "amount")
                .map(amount -> amount * multiplier(Fragments.stringAt(money, "unit").orElse("")));
    }

    static double multiplier(String unit) {
        return switch (unit.trim().toUpperCase(Locale.ROOT)) {
            case "K" -> 1_000d;
            case "M" -> 1_000_000d;
            case "B" -> 1_000_000_000d;
            default  -> 1d;
        };
    }
}
