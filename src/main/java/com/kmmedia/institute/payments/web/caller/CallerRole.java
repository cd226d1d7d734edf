package com.kmmedia.institute.payments.web.caller;

import java.util.Locale;

/**
 * Roles issued by the authentication collaborator.
 */
public enum CallerRole {
    STUDENT,
    TRAINER,
    ADMIN;

    /**
     * @param value header value, case-insensitive
     * @return role, or null when blank or unknown
     */
    public static CallerRole parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (CallerRole role : values()) {
            if (role.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                return role;
            }
        }
        return null;
    }
}
