package com.edudata.authservice.exception;

import com.edudata.authservice.model.AuthFailure;
import org.springframework.http.HttpStatus;

/**
 * Rejections of the login / one-time-code flow. All are 400s except {@link Unauthorized};
 * each carries its own reason so clients can tell "expired" from "wrong code".
 */
public final class AuthExceptions {

    private AuthExceptions() {}

    public static final class Rejected extends ApiException {

        private final AuthFailure failure;

        public Rejected(AuthFailure failure) {
            super(HttpStatus.BAD_REQUEST,
                    "https://edudata.dev/problems/" + slug(failure),
                    title(failure),
                    failure.code(),
                    failure.message());
            this.failure = failure;
        }

        public AuthFailure getFailure() {
            return failure;
        }
    }

    /** 401 – no valid session token on a protected call. */
    public static final class Unauthorized extends ApiException {
        public Unauthorized(String detail) {
            super(HttpStatus.UNAUTHORIZED,
                    "https://edudata.dev/problems/unauthorized",
                    "Unauthorized",
                    "Unauthorized",
                    detail);
        }
    }

    public static ApiException of(AuthFailure failure) {
        if (failure == AuthFailure.VALIDATION) {
            return new RequestExceptions.ValidationFailed(failure.message());
        }
        if (failure == AuthFailure.DUPLICATE_IDENTIFIER) {
            return new UserExceptions.UserAlreadyExists();
        }
        return new Rejected(failure);
    }

    private static String slug(AuthFailure failure) {
        return failure.name().toLowerCase().replace('_', '-');
    }

    private static String title(AuthFailure failure) {
        return switch (failure) {
            case INVALID_CREDENTIALS -> "Invalid Credentials";
            case INVALID_SESSION -> "Invalid Session";
            case ALREADY_USED -> "Code Already Used";
            case EXPIRED -> "Code Expired";
            case INVALID_CODE -> "Invalid Code";
            default -> "Bad Request";
        };
    }
}
