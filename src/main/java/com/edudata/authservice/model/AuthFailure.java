package com.edudata.authservice.model;

/**
 * Terminal rejection reasons of the login state machine. {@link #code()} is the
 * machine-readable reason returned to clients; messages are actionable and never
 * say whether an identifier is registered.
 */
public enum AuthFailure {
    VALIDATION("ValidationError", "Required fields are missing or malformed."),
    DUPLICATE_IDENTIFIER("DuplicateIdentifier", "An account with this identifier already exists."),
    INVALID_CREDENTIALS("InvalidCredentials", "Invalid credentials."),
    INVALID_SESSION("InvalidSession", "This verification session is not valid. Please log in again."),
    ALREADY_USED("AlreadyUsed", "This code has already been used. Please log in again."),
    EXPIRED("Expired", "This code has expired. Please request a new code."),
    INVALID_CODE("InvalidCode", "Incorrect code. Please check the code and try again.");

    private final String code;
    private final String message;

    AuthFailure(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }
}
