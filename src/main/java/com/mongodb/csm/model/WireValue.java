package com.mongodb.csm.model;

import com.mongodb.csm.exceptions.ConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * An option whose textual form is the value MongoDB (or the user) uses, e.g. {@code updateLookup}.
 */
public interface WireValue {

    String value();

    static <E extends Enum<E> & WireValue> E fromValue(Class<E> type, String value) {
        for (E constant : type.getEnumConstants()) {
            if (constant.value().equals(value)) {
                return constant;
            }
        }
        var allowed = Arrays.stream(type.getEnumConstants())
                .map(WireValue::value)
                .collect(Collectors.joining(", "));
        throw new ConfigurationException("Unknown " + type.getSimpleName() + " '" + value + "', expected one of: " + allowed);
    }
}
