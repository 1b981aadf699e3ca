package com.edudata.authservice.service;

public interface PasswordVerifier {

    /**
     * Checks a submitted password against a stored salted hash.
     *
     * @return false for a mismatch and for null/blank input; never throws for bad input
     */
    boolean verify(String plaintext, String storedHash);

    /** Salted adaptive hash for a new password. */
    String hash(String plaintext);
}
