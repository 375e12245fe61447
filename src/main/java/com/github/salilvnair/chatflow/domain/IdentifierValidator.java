package com.github.salilvnair.chatflow.domain;

/**
 * Format checks for tax identifiers.
 */
public interface IdentifierValidator {

    boolean isValidGstin(String gstin);

    boolean isValidPan(String pan);

    /** Upper-cases and removes whitespace; returns an empty string for {@code null}. */
    default String normalize(String identifier) {
        return identifier == null ? "" : identifier.replaceAll("\\s+", "").toUpperCase(java.util.Locale.ROOT);
    }
}
