package com.custodyledger.common;

import java.util.regex.Pattern;

/**
 * Utility class for validating principal identifiers.
 * A principal is an opaque, address-like token naming one account holder.
 */
public final class PrincipalId {

    public static final int MAX_LENGTH = 128;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._:@-]+");

    private PrincipalId() {
    }

    public static boolean isValid(String principal) {
        if (principal == null || principal.isEmpty() || principal.length() > MAX_LENGTH) {
            return false;
        }
        return ALLOWED.matcher(principal).matches();
    }

    public static String validate(String principal) {
        if (!isValid(principal)) {
            throw new IllegalArgumentException("Invalid principal: " + principal);
        }
        return principal;
    }
}
