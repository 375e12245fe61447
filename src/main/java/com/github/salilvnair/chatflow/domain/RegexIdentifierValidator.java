package com.github.salilvnair.chatflow.domain;

import java.util.regex.Pattern;

/**
 * GSTIN: 2 digit state code, the holder's PAN, entity number, {@code Z}, check character.
 * PAN: 5 letters, 4 digits, 1 letter.
 */
public class RegexIdentifierValidator implements IdentifierValidator {

    private static final Pattern GSTIN = Pattern.compile("^[0-9]{2}[A-Z]{5}[0-9]{4}[A-Z][1-9A-Z]Z[0-9A-Z]$");
    private static final Pattern PAN = Pattern.compile("^[A-Z]{5}[0-9]{4}[A-Z]$");

    @Override
    public boolean isValidGstin(String gstin) {
        String value = normalize(gstin);
        return GSTIN.matcher(value).matches() && PAN.matcher(value.substring(2, 12)).matches();
    }

    @Override
    public boolean isValidPan(String pan) {
        return PAN.matcher(normalize(pan)).matches();
    }
}
