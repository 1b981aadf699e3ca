package com.edudata.authservice.utils;

/**
 * Masks contacts (phone numbers, e-mail addresses) for log output.
 */
public final class ContactMasking {

    private ContactMasking() {}

    public static String mask(String contact) {
        if (contact == null || contact.isBlank()) {
            return "****";
        }
        int at = contact.indexOf('@');
        if (at > 0) {
            String local = contact.substring(0, at);
            String domain = contact.substring(at);
            return local.charAt(0) + "***" + domain;
        }
        if (contact.length() < 4) {
            return "****";
        }
        int visibleDigits = 4;
        int length = contact.length();
        return "*".repeat(length - visibleDigits) + contact.substring(length - visibleDigits);
    }
}
