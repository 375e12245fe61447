package com.github.salilvnair.chatflow.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.github.salilvnair.chatflow.support.TestConstants.INVALID_GSTIN;
import static com.github.salilvnair.chatflow.support.TestConstants.VALID_GSTIN;
import static com.github.salilvnair.chatflow.support.TestConstants.VALID_PAN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegexIdentifierValidatorTest {

    private final IdentifierValidator validator = new RegexIdentifierValidator();

    @Test
    void acceptsWellFormedIdentifiers() {
        assertTrue(validator.isValidGstin(VALID_GSTIN));
        assertTrue(validator.isValidGstin(" 27abcde1234f1z5 "));
        assertTrue(validator.isValidPan(VALID_PAN));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "27ABCDE1234F1Y5", "2AABCDE1234F1Z5", "27ABCDE1234F0Z5"})
    void rejectsMalformedGstin(String gstin) {
        assertFalse(validator.isValidGstin(gstin));
    }

    @Test
    void rejectsTruncatedGstinAndBadPan() {
        assertFalse(validator.isValidGstin(INVALID_GSTIN));
        assertFalse(validator.isValidGstin(null));
        assertFalse(validator.isValidPan("ABCD1234F"));
    }

    @Test
    void normalizeStripsWhitespaceAndUppercases() {
        assertEquals("ABCDE1234F", validator.normalize(" abcde 1234f "));
        assertEquals("", validator.normalize(null));
    }
}
