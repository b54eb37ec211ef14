package com.mongodb.csm.converters;

import picocli.CommandLine;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Accepts an ISO-8601 instant ({@code 2024-01-01T00:00:00Z}) or epoch seconds.
 */
public class InstantConverter implements CommandLine.ITypeConverter<Instant> {
    @Override
    public Instant convert(String s) throws Exception {
        String value = s.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochSecond(Long.parseLong(value));
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new CommandLine.TypeConversionException("Invalid start time '" + s + "', expected ISO-8601 or epoch seconds");
        }
    }
}
