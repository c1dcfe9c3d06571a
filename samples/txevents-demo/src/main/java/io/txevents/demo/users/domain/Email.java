package io.txevents.demo.users.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validated, lower-cased email address.
 */
public record Email(String value) {
    private static final Pattern FORMAT =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    public Email {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("email format is invalid: " + value);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
