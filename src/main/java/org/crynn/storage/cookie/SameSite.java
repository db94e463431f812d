package org.crynn.storage.cookie;

import java.util.Locale;
import java.util.Optional;

public enum SameSite {
    NONE("None"),
    LAX("Lax"),
    STRICT("Strict");

    private final String attributeValue;

    SameSite(String attributeValue) {
        this.attributeValue = attributeValue;
    }

    public String attributeValue() {
        return attributeValue;
    }

    /** Case-insensitive; unknown values are treated as absent. */
    public static Optional<SameSite> parse(String raw) {
        if (raw == null) return Optional.empty();
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> Optional.of(NONE);
            case "lax" -> Optional.of(LAX);
            case "strict" -> Optional.of(STRICT);
            default -> Optional.empty();
        };
    }
}
