package com.dtech.security;

/**
 * Discriminator carried by signed claims, so a token of one kind never verifies as another.
 */
public enum ClaimType {

    AUTH("auth"),
    INVITATION("invitation");

    private final String value;

    ClaimType(String value) {
        this.value = value;
    }

    /** Wire value, e.g. the prefix of an invitation token. */
    public String value() {
        return value;
    }
}
