package io.txevents.demo.users.domain;

/**
 * First and last name, each trimmed and 2 to 50 characters long.
 */
public record Name(String firstName, String lastName) {

    public Name {
        firstName = validated("first name", firstName);
        lastName = validated("last name", lastName);
    }

    public String fullName() {
        return firstName + " " + lastName;
    }

    private static String validated(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        String trimmed = raw.trim();
        if (trimmed.length() < 2 || trimmed.length() > 50) {
            throw new IllegalArgumentException(field + " must be 2-50 characters");
        }
        return trimmed;
    }
}
