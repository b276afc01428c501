package com.sociallink.schema.domain.constants;

public final class SchemaConstants {

    // Private constructor prevents instantiation
    private SchemaConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    /**
     * local@domain.tld, no whitespace. Applied on top of the default {@code @Email} check.
     */
    public static final String EMAIL_PATTERN = "^[^@\\s]+@[^@\\s]+\\.[^@\\s.]+$";

    public static final String BEARER_PREFIX = "Bearer ";
}
