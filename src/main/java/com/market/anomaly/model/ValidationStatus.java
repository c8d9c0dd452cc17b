package com.market.anomaly.model;

import java.util.Locale;

/**
 * Review outcome of an anomaly's narrative. Never stored; always derived from
 * the narrative linked to the anomaly at read time.
 */
public enum ValidationStatus {
    NOT_GENERATED,
    PENDING,
    VALID,
    INVALID;

    public static ValidationStatus fromNarrative(Narrative narrative) {
        if (narrative == null) return NOT_GENERATED;
        if (!narrative.isValidated()) return PENDING;
        return Boolean.TRUE.equals(narrative.getValidationPassed()) ? VALID : INVALID;
    }

    /**
     * Filter predicate: does an anomaly with this narrative (or none) fall under this status.
     */
    public boolean matches(Narrative narrative) {
        return fromNarrative(narrative) == this;
    }

    public static ValidationStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Validation status must not be empty");
        }
        return ValidationStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
