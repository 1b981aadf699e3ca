package com.edudata.authservice.exception;

import com.edudata.authservice.model.AuthFailure;
import org.springframework.http.HttpStatus;

/**
 * Account-level exceptions.
 */
public final class UserExceptions {

    private UserExceptions() {}

    /** 404 Not Found – the authenticated subject no longer has an account. */
    public static final class UserNotFound extends ApiException {
        public UserNotFound(String detail) {
            super(HttpStatus.NOT_FOUND,
                    "https://edudata.dev/problems/user-not-found",
                    "User Not Found",
                    "UserNotFound",
                    detail);
        }
    }

    /** 400 Bad Request – identifier already registered. */
    public static final class UserAlreadyExists extends ApiException {
        public UserAlreadyExists() {
            super(HttpStatus.BAD_REQUEST,
                    "https://edudata.dev/problems/user-already-exists",
                    "User Already Exists",
                    AuthFailure.DUPLICATE_IDENTIFIER.code(),
                    AuthFailure.DUPLICATE_IDENTIFIER.message());
        }
    }
}
