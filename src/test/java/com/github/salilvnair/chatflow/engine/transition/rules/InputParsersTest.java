package com.github.salilvnair.chatflow.engine.transition.rules;

import com.github.salilvnair.chatflow.engine.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InputParsersTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    @Test
    void amountAcceptsCurrencyPrefixesAndSeparators() {
        assertEquals(450000L, InputParsers.amount("4,50,000"));
        assertEquals(1200L, InputParsers.amount("Rs. 1200"));
        assertEquals(99L, InputParsers.amount("₹99.50"));
        assertEquals(0L, InputParsers.amount("skip"));
        assertEquals(0L, InputParsers.amount("None"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "-5", "12abc", "1.234"})
    void amountRejectsNonNumbers(String raw) {
        ValidationException ex = assertThrows(ValidationException.class, () -> InputParsers.amount(raw));
        assertEquals("error.invalid_amount", ex.getMessageKey());
    }

    @Test
    void periodNormalisesToReturnFormat() {
        assertEquals("042024", InputParsers.period("04-2024"));
        assertEquals("112023", InputParsers.period("11/2023"));
        assertEquals("012025", InputParsers.period("1-2025"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"13-2024", "00-2024", "04-2016", "April 2024", "2024-04"})
    void periodRejectsInvalidValues(String raw) {
        ValidationException ex = assertThrows(ValidationException.class, () -> InputParsers.period(raw));
        assertEquals("error.invalid_period", ex.getMessageKey());
    }

    @Test
    void dateOfBirthIsStrict() {
        assertEquals("15/08/1990", InputParsers.dateOfBirth("15-08-1990", TODAY));
        assertThrows(ValidationException.class, () -> InputParsers.dateOfBirth("31/02/1990", TODAY));
        assertThrows(ValidationException.class, () -> InputParsers.dateOfBirth("01/01/2999", TODAY));
    }

    @Test
    void dateOfBirthIsJudgedAgainstGivenDay() {
        assertEquals("01/06/2024", InputParsers.dateOfBirth("01/06/2024", TODAY));
        ValidationException ex = assertThrows(ValidationException.class, () -> InputParsers.dateOfBirth("02/06/2024", TODAY));
        assertEquals("error.invalid_date", ex.getMessageKey());
    }

    @Test
    void nameCollapsesWhitespaceAndChecksLength() {
        assertEquals("Asha Rao", InputParsers.name("  Asha   Rao "));
        assertThrows(ValidationException.class, () -> InputParsers.name("A"));
    }
}
