package com.authzengine.security;

import lombok.Value;

/**
 * A single statement about a principal, e.g. {@code sub=alice}.
 */
@Value
public class Claim {

    String type;
    String value;

    public Claim(String type, String value) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Claim type cannot be blank");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Claim value cannot be blank");
        }
        this.type = type;
        this.value = value;
    }

    public static Claim of(String type, String value) {
        return new Claim(type, value);
    }

    public boolean isOfType(String claimType) {
        return type.equalsIgnoreCase(claimType);
    }
}
