package com.medtracker.auth.util;

/**
 * Log-safe rendering of an email address.
 */
public final class EmailMasker {

    private EmailMasker() {
    }

    public static String mask(String email) {
        if (email == null || email.isBlank()) {
            return "***";
        }
        int at = email.indexOf('@');
        if (at < 0) {
            return email.length() <= 3 ? "***" : email.substring(0, 3) + "...";
        }
        String local = email.substring(0, at);
        String visible = local.length() <= 3 ? local : local.substring(0, 3);
        return visible + "..." + email.substring(at);
    }
}
